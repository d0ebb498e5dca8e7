package org.netpreserve.sweeper.extract;

import org.jetbrains.annotations.Nullable;

/**
 * Follower count as displayed on a target's page, e.g. "12.3万", and its normalized value.
 */
public record FollowerCount(String text, @Nullable Long count) {
}
