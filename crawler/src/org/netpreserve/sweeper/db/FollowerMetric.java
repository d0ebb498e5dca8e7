package org.netpreserve.sweeper.db;

import org.jetbrains.annotations.Nullable;

/**
 * Follower count of a target on one calendar day.
 *
 * @param collectedOn ISO date (yyyy-MM-dd) in the crawl's time zone
 */
public record FollowerMetric(long targetId, String collectedOn, @Nullable String followerText,
                             @Nullable Long followerCount) {
}
