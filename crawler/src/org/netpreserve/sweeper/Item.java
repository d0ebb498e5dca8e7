package org.netpreserve.sweeper;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.sweeper.util.Url;

import java.time.Instant;

/**
 * Ledger row for an item. Light fields come from the target's listing, heavy fields from the item's detail page.
 * Raw text is kept beside each parsed value.
 *
 * @param needsUpdate true while heavy fields are missing or stale
 * @param comments    JSON array of the comment snapshot
 * @param failures    number of failed heavy fetches
 */
public record Item(
        long targetId,
        String itemId,
        Url url,
        boolean alive,
        boolean needsUpdate,
        @Nullable String thumbnailUrl,
        @Nullable String altText,
        @Nullable String countText,
        @Nullable Long countValue,
        @Nullable String lightAlgorithm,
        @Nullable Instant lightCrawledAt,
        @Nullable String title,
        @Nullable String publishedText,
        @Nullable Instant publishedAt,
        @Nullable String audioText,
        @Nullable String audioTitle,
        @Nullable String audioAuthor,
        @Nullable String likeCountText,
        @Nullable Long likeCount,
        @Nullable String commentCountText,
        @Nullable Long commentCount,
        @Nullable String collectCountText,
        @Nullable Long collectCount,
        @Nullable String comments,
        @Nullable String heavyAlgorithm,
        @Nullable Instant heavyCrawledAt,
        int failures,
        @Nullable String lastError) {
}
