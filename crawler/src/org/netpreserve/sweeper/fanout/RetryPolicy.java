package org.netpreserve.sweeper.fanout;

import org.netpreserve.sweeper.CrawlOutcome;
import org.netpreserve.sweeper.FailureKind;

import java.time.Duration;
import java.util.Optional;

/**
 * Lost sessions are retried up to {@code maxRetries} times after {@code delay}, giving the browser time to be
 * restarted or logged in again. Other retryable failures get one immediate retry.
 */
public record RetryPolicy(int maxRetries, Duration delay) {

    /**
     * @return how long to wait before retrying, or empty if the job shouldn't be retried
     */
    public Optional<Duration> retryDelay(CrawlOutcome outcome, int retryCount) {
        FailureKind failure = outcome.failure();
        if (outcome.succeeded() || failure == null || !failure.retryable()) return Optional.empty();
        if (failure == FailureKind.INTERRUPTED) return Optional.empty();
        if (failure == FailureKind.SESSION_LOST) {
            return retryCount < maxRetries ? Optional.of(delay == null ? Duration.ZERO : delay) : Optional.empty();
        }
        return retryCount < 1 ? Optional.of(Duration.ZERO) : Optional.empty();
    }
}
