package org.netpreserve.sweeper.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Which kinds of data a crawl collects.
 */
public enum CrawlMode {
    /**
     * Read the listing only. No detail pages are visited and the first full sweep is not started.
     */
    LIGHT,
    /**
     * Visit the detail pages of items already flagged in the ledger, reaching them by URL without re-reading the
     * listing.
     */
    HEAVY,
    BOTH;

    @JsonCreator
    public static CrawlMode fromString(String value) {
        return value == null ? null : valueOf(value.toUpperCase(Locale.ROOT));
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
