package org.netpreserve.sweeper.fanout;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.sweeper.CrawlOutcome;
import org.netpreserve.sweeper.FailureKind;

/**
 * Final result of a job after any retries.
 *
 * @param outcome outcome of the last attempt, null if the job was never run
 */
public record JobResult(CrawlJob job, @Nullable CrawlOutcome outcome) {
    public static final int EXIT_OK = 0;
    public static final int EXIT_SESSION_LOST = 41;
    public static final int EXIT_RETRY = 44;

    public static JobResult skipped(CrawlJob job) {
        return new JobResult(job, null);
    }

    public boolean sessionLost() {
        return outcome != null && outcome.failure() == FailureKind.SESSION_LOST;
    }

    /**
     * Process exit code reported to the job scheduler: 0 when there's nothing left to do (a missing target
     * included), 41 when the browser session was lost, 44 when the job should be redelivered later.
     */
    public int exitCode() {
        if (outcome == null) return EXIT_RETRY;
        if (outcome.succeeded() || outcome.failure() == FailureKind.TARGET_NOT_FOUND) return EXIT_OK;
        if (outcome.failure() == FailureKind.SESSION_LOST) return EXIT_SESSION_LOST;
        return EXIT_RETRY;
    }
}
