package org.netpreserve.sweeper;

import org.jetbrains.annotations.Nullable;

import java.time.Instant;

/**
 * An account whose items are crawled. Rows are created by the discovery process, never by the crawler.
 *
 * @param isNew          true until the first full sweep of the target's items has completed
 * @param sweepStartedAt when the current full sweep started, null when none is in progress
 * @param lastCrawled    start of the most recent crawl that reached the target's page, null if never crawled
 */
public record Target(
        long id,
        String username,
        @Nullable String displayName,
        boolean alive,
        int priority,
        @Nullable Long workerId,
        boolean isNew,
        @Nullable Instant sweepStartedAt,
        @Nullable Instant lastCrawled) {
}
