package org.netpreserve.sweeper.sink;

/**
 * Destination for item events.
 */
public interface EventPublisher extends AutoCloseable {
    /**
     * Publishes an event and waits for it to be acknowledged.
     */
    void publish(ItemEvent event) throws PublicationException;

    @Override
    default void close() {
    }

    /**
     * A publisher that drops every event, used when no stream is configured.
     */
    static EventPublisher disabled() {
        return event -> {
        };
    }
}
