package org.netpreserve.sweeper.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.sweeper.util.DurationDeserializer;

import java.time.Duration;

/**
 * Configuration for running many targets in parallel.
 *
 * @param workers    number of workers, each with its own browser
 * @param maxRetries how many times a job that lost its browser session is retried
 * @param retryDelay pause before retrying a job that lost its browser session
 */
public record FanoutConfig(
        int workers,
        int maxRetries,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration retryDelay
) {
    public FanoutConfig withWorkers(int workers) {
        return new FanoutConfig(workers, maxRetries, retryDelay);
    }
}
