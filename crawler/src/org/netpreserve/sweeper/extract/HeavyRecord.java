package org.netpreserve.sweeper.extract;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.sweeper.parse.AudioCredit;
import org.netpreserve.sweeper.parse.ItemKey;
import org.netpreserve.sweeper.util.Url;

import java.time.Instant;
import java.util.List;

/**
 * What an item's detail page shows.
 */
public record HeavyRecord(
        ItemKey key,
        Url url,
        @Nullable String title,
        @Nullable String publishedText,
        @Nullable Instant publishedAt,
        @Nullable String audioText,
        @Nullable AudioCredit audio,
        @Nullable String likeCountText,
        @Nullable Long likeCount,
        @Nullable String commentCountText,
        @Nullable Long commentCount,
        @Nullable String collectCountText,
        @Nullable Long collectCount,
        List<Comment> comments,
        String algorithm,
        Instant crawledAt) implements ItemRecord {
    public HeavyRecord {
        comments = comments == null ? List.of() : List.copyOf(comments);
    }
}
