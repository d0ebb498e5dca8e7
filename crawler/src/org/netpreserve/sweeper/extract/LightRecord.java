package org.netpreserve.sweeper.extract;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.sweeper.parse.ItemKey;
import org.netpreserve.sweeper.util.Url;

import java.time.Instant;

/**
 * What a target's listing shows about an item.
 *
 * @param position zero-based position of the item's tile on the listing as it was loaded
 */
public record LightRecord(
        ItemKey key,
        Url url,
        int position,
        @Nullable String thumbnailUrl,
        @Nullable String altText,
        @Nullable String countText,
        @Nullable Long count,
        String algorithm,
        Instant crawledAt) implements ItemRecord {
}
