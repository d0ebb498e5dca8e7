package org.netpreserve.sweeper.extract;

import org.netpreserve.sweeper.parse.ItemKey;
import org.netpreserve.sweeper.util.Url;

import java.time.Instant;

/**
 * Typed result of reading an item, either from a listing or from its detail page.
 */
public sealed interface ItemRecord permits LightRecord, HeavyRecord {
    ItemKey key();

    Url url();

    /**
     * Name and version of the extraction strategy that produced the record.
     */
    String algorithm();

    Instant crawledAt();
}
