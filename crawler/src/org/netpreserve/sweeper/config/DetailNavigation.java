package org.netpreserve.sweeper.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How the heavy sweep reaches an item's detail page.
 */
public enum DetailNavigation {
    /**
     * Click the item's tile on the already loaded listing, then return to the listing afterwards.
     */
    INDEXED_CLICK,
    /**
     * Navigate straight to the item's canonical URL.
     */
    DIRECT_URL;

    @JsonCreator
    public static DetailNavigation fromString(String value) {
        return value == null ? null : valueOf(value.toUpperCase(Locale.ROOT).replace('-', '_'));
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
