package org.netpreserve.sweeper.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.sweeper.util.DurationDeserializer;

import java.time.Duration;
import java.util.Map;

/**
 * Event stream configuration. Publishing is disabled when no bootstrap servers are given.
 *
 * @param bootstrapServers Kafka bootstrap servers
 * @param topic            topic that item events are written to
 * @param publishTimeout   how long to wait for the broker to acknowledge an event
 * @param properties       extra producer properties
 */
public record StreamConfig(
        @Nullable String bootstrapServers,
        String topic,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration publishTimeout,
        Map<String, String> properties
) {
    public boolean enabled() {
        return bootstrapServers != null && !bootstrapServers.isBlank();
    }
}
