package org.netpreserve.sweeper;

import org.jetbrains.annotations.Nullable;

/**
 * Result of crawling one target.
 *
 * @param state          {@link CrawlState#DONE} or {@link CrawlState#FAILED}
 * @param failedIn       phase the crawl was in when it failed
 * @param lightCommitted light records stored
 * @param heavyCommitted heavy records stored
 * @param heavyFailed    items whose heavy fetch failed and that remain flagged for update
 * @param itemsGone      items found to be removed
 * @param swept          whether this crawl completed the target's first full sweep
 */
public record CrawlOutcome(
        long targetId,
        CrawlState state,
        @Nullable CrawlState failedIn,
        @Nullable FailureKind failure,
        @Nullable String message,
        int lightCommitted,
        int heavyCommitted,
        int heavyFailed,
        int itemsGone,
        boolean swept) {

    public boolean succeeded() {
        return state == CrawlState.DONE;
    }

    public static CrawlOutcome failed(long targetId, CrawlState failedIn, FailureKind failure, String message) {
        return new CrawlOutcome(targetId, CrawlState.FAILED, failedIn, failure, message, 0, 0, 0, 0, false);
    }
}
