package org.netpreserve.sweeper.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.sweeper.util.DurationDeserializer;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Configuration for crawling a single target.
 *
 * @param batchSize         items visited between re-reads of the remaining candidate set
 * @param maxItemsPerTarget upper bound on light records collected from a listing
 * @param maxTargets        upper bound on targets taken from the roster per run
 * @param maxScrolls        upper bound on scroll steps while loading a listing
 * @param itemTimeout       how long a detail page may take to become readable
 * @param targetDeadline    wall-clock budget for a whole target, after which the crawl is abandoned
 * @param minPause          shortest pause between detail visits
 * @param maxPause          longest pause between detail visits
 * @param timeZone          zone used to resolve relative and partial publication dates
 * @param detailNavigation  preferred way of reaching detail pages
 * @param mode              which kinds of data to collect, both when absent
 * @param recrawl           flag every alive item of the target for a fresh heavy fetch before sweeping
 */
public record CrawlConfig(
        int batchSize,
        int maxItemsPerTarget,
        int maxTargets,
        int maxScrolls,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration itemTimeout,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration targetDeadline,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration minPause,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration maxPause,
        ZoneId timeZone,
        DetailNavigation detailNavigation,
        CrawlMode mode,
        boolean recrawl
) {
    public CrawlConfig {
        if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be positive");
        if (minPause != null && maxPause != null && maxPause.compareTo(minPause) < 0) {
            throw new IllegalArgumentException("maxPause must not be shorter than minPause");
        }
    }

    public CrawlConfig withMaxItemsPerTarget(int maxItemsPerTarget) {
        return new CrawlConfig(batchSize, maxItemsPerTarget, maxTargets, maxScrolls, itemTimeout, targetDeadline,
                minPause, maxPause, timeZone, detailNavigation, mode, recrawl);
    }

    public CrawlConfig withMaxTargets(int maxTargets) {
        return new CrawlConfig(batchSize, maxItemsPerTarget, maxTargets, maxScrolls, itemTimeout, targetDeadline,
                minPause, maxPause, timeZone, detailNavigation, mode, recrawl);
    }

    public CrawlConfig withMode(CrawlMode mode) {
        return new CrawlConfig(batchSize, maxItemsPerTarget, maxTargets, maxScrolls, itemTimeout, targetDeadline,
                minPause, maxPause, timeZone, detailNavigation, mode, recrawl);
    }

    public CrawlConfig withRecrawl(boolean recrawl) {
        return new CrawlConfig(batchSize, maxItemsPerTarget, maxTargets, maxScrolls, itemTimeout, targetDeadline,
                minPause, maxPause, timeZone, detailNavigation, mode, recrawl);
    }
}
