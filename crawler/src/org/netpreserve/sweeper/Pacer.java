package org.netpreserve.sweeper;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Random pause between detail visits.
 */
public class Pacer {
    private final long minMillis;
    private final long maxMillis;

    public Pacer(Duration min, Duration max) {
        this.minMillis = min == null ? 0 : min.toMillis();
        this.maxMillis = max == null ? minMillis : Math.max(minMillis, max.toMillis());
    }

    public void pause() throws InterruptedException {
        long millis = maxMillis > minMillis ? ThreadLocalRandom.current().nextLong(minMillis, maxMillis + 1) : minMillis;
        if (millis > 0) Thread.sleep(millis);
    }
}
