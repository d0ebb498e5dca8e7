package org.netpreserve.sweeper.browser;

import java.util.Optional;

/**
 * An element found on the current page. Only valid until the next navigation.
 */
public interface Element {
    /**
     * Reads the field identified by {@code selector} relative to this element. A selector of {@code ":scope"} reads
     * the element itself.
     */
    Optional<String> extractField(SelectorSpec selector);
}
