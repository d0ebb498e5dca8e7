package org.netpreserve.sweeper.db;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import org.netpreserve.sweeper.Item;
import org.netpreserve.sweeper.util.MustUpdate;

import java.util.List;
import java.util.Optional;

@RegisterConstructorMapper(Item.class)
public interface ItemDAO {
    /**
     * Inserts or merges an item. Fields that are null in {@code item} keep their stored value, so a light record
     * never wipes out heavy fields and vice versa. Storing heavy fields clears needs_update.
     */
    @SqlUpdate("""
            INSERT INTO items (target_id, item_id, url, alive, needs_update,
                               thumbnail_url, alt_text, count_text, count_value, light_algorithm, light_crawled_at,
                               title, published_text, published_at, audio_text, audio_title, audio_author,
                               like_count_text, like_count, comment_count_text, comment_count,
                               collect_count_text, collect_count, comments, heavy_algorithm, heavy_crawled_at)
            VALUES (:targetId, :itemId, :url, :alive, iif(:heavyCrawledAt IS NULL, 1, 0),
                    :thumbnailUrl, :altText, :countText, :countValue, :lightAlgorithm, :lightCrawledAt,
                    :title, :publishedText, :publishedAt, :audioText, :audioTitle, :audioAuthor,
                    :likeCountText, :likeCount, :commentCountText, :commentCount,
                    :collectCountText, :collectCount, :comments, :heavyAlgorithm, :heavyCrawledAt)
            ON CONFLICT (target_id, item_id) DO UPDATE SET
                url = excluded.url,
                alive = excluded.alive,
                needs_update = iif(excluded.heavy_crawled_at IS NOT NULL, 0, items.needs_update),
                thumbnail_url = coalesce(excluded.thumbnail_url, items.thumbnail_url),
                alt_text = coalesce(excluded.alt_text, items.alt_text),
                count_text = coalesce(excluded.count_text, items.count_text),
                count_value = coalesce(excluded.count_value, items.count_value),
                light_algorithm = coalesce(excluded.light_algorithm, items.light_algorithm),
                light_crawled_at = coalesce(excluded.light_crawled_at, items.light_crawled_at),
                title = coalesce(excluded.title, items.title),
                published_text = coalesce(excluded.published_text, items.published_text),
                published_at = coalesce(excluded.published_at, items.published_at),
                audio_text = coalesce(excluded.audio_text, items.audio_text),
                audio_title = coalesce(excluded.audio_title, items.audio_title),
                audio_author = coalesce(excluded.audio_author, items.audio_author),
                like_count_text = coalesce(excluded.like_count_text, items.like_count_text),
                like_count = coalesce(excluded.like_count, items.like_count),
                comment_count_text = coalesce(excluded.comment_count_text, items.comment_count_text),
                comment_count = coalesce(excluded.comment_count, items.comment_count),
                collect_count_text = coalesce(excluded.collect_count_text, items.collect_count_text),
                collect_count = coalesce(excluded.collect_count, items.collect_count),
                comments = coalesce(excluded.comments, items.comments),
                heavy_algorithm = coalesce(excluded.heavy_algorithm, items.heavy_algorithm),
                heavy_crawled_at = coalesce(excluded.heavy_crawled_at, items.heavy_crawled_at),
                last_error = iif(excluded.heavy_crawled_at IS NOT NULL, NULL, items.last_error)""")
    void upsert(@BindMethods Item item);

    @SqlQuery("SELECT * FROM items WHERE target_id = ? AND item_id = ?")
    Optional<Item> find(long targetId, String itemId);

    String BY_ID_DESC = " ORDER BY length(item_id) DESC, item_id DESC";

    @SqlQuery("SELECT * FROM items WHERE target_id = ?" + BY_ID_DESC)
    List<Item> listByTarget(long targetId);

    @SqlQuery("SELECT * FROM items WHERE target_id = ? AND alive AND needs_update" + BY_ID_DESC)
    List<Item> needingUpdate(long targetId);

    @SqlUpdate("UPDATE items SET needs_update = 1 WHERE target_id = ? AND alive")
    int flagAllForUpdate(long targetId);

    @SqlUpdate("UPDATE items SET alive = 0, needs_update = 0 WHERE target_id = :targetId AND item_id = :itemId")
    @MustUpdate
    void markGone(long targetId, String itemId);

    @SqlUpdate("""
            UPDATE items SET failures = failures + 1, last_error = :error
            WHERE target_id = :targetId AND item_id = :itemId""")
    @MustUpdate
    void recordFailure(long targetId, String itemId, String error);
}
