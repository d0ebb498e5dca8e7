package org.netpreserve.sweeper;

/**
 * Phases of a single target crawl, in order. A crawl ends in {@link #DONE} or {@link #FAILED}.
 */
public enum CrawlState {
    NAVIGATING,
    LIGHT_SYNC,
    HEAVY_DECISION,
    HEAVY_SWEEP,
    RECONCILE,
    DONE,
    FAILED
}
