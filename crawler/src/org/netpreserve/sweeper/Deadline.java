package org.netpreserve.sweeper;

import org.jetbrains.annotations.Nullable;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Wall-clock budget for a target crawl.
 */
public class Deadline {
    private final Clock clock;
    private final @Nullable Instant expiry;

    private Deadline(Clock clock, @Nullable Instant expiry) {
        this.clock = clock;
        this.expiry = expiry;
    }

    /**
     * @param budget null or zero for no deadline
     */
    public static Deadline after(Clock clock, @Nullable Duration budget) {
        if (budget == null || budget.isZero() || budget.isNegative()) return new Deadline(clock, null);
        return new Deadline(clock, clock.instant().plus(budget));
    }

    public boolean expired() {
        return expiry != null && !clock.instant().isBefore(expiry);
    }

    public @Nullable Instant expiry() {
        return expiry;
    }
}
