package org.netpreserve.sweeper.sink;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.sweeper.Target;
import org.netpreserve.sweeper.extract.HeavyRecord;
import org.netpreserve.sweeper.extract.ItemRecord;
import org.netpreserve.sweeper.extract.LightRecord;
import org.netpreserve.sweeper.parse.Thumbnails;

import java.time.Instant;

/**
 * Message published for every committed record. Field names are part of the stream's schema.
 *
 * @param kind              "light" for listing data, "heavy" for detail data
 * @param count             the listing's count for light events, the like count for heavy events
 * @param thumbnailEssence  stable part of the thumbnail URL, light events only. Lets consumers match tiles seen on
 *                          different listings of the same item, whose thumbnail URLs carry different signatures.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ItemEvent(
        @JsonProperty("item_id") String itemId,
        @JsonProperty("item_url") String itemUrl,
        @JsonProperty("target_id") long targetId,
        @JsonProperty("target") String target,
        @JsonProperty("kind") String kind,
        @JsonProperty("count") @Nullable Long count,
        @JsonProperty("comment_count") @Nullable Long commentCount,
        @JsonProperty("thumbnail_essence") @Nullable String thumbnailEssence,
        @JsonProperty("algorithm") String algorithm,
        @JsonProperty("crawled_at") Instant crawledAt) {

    public static ItemEvent of(Target target, ItemRecord record) {
        Long count;
        Long commentCount = null;
        String thumbnailEssence = null;
        String kind;
        if (record instanceof LightRecord light) {
            kind = "light";
            count = light.count();
            thumbnailEssence = Thumbnails.essence(light.thumbnailUrl());
        } else if (record instanceof HeavyRecord heavy) {
            kind = "heavy";
            count = heavy.likeCount();
            commentCount = heavy.commentCount();
        } else {
            throw new IllegalArgumentException("Unknown record type " + record.getClass());
        }
        return new ItemEvent(record.key().itemId(), record.url().toString(), target.id(), target.username(), kind,
                count, commentCount, thumbnailEssence, record.algorithm(), record.crawledAt());
    }

    /**
     * Stream key. Keeps all events for an item in one partition.
     */
    public String key() {
        return targetId + "/" + itemId;
    }
}
