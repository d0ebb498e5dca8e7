package org.netpreserve.sweeper.sink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.netpreserve.sweeper.config.StreamConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes item events as JSON to a Kafka topic.
 */
public class KafkaEventPublisher implements EventPublisher {
    private static final Logger log = LoggerFactory.getLogger(KafkaEventPublisher.class);
    private final Producer<String, String> producer;
    private final String topic;
    private final Duration timeout;
    private final ObjectMapper mapper = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public KafkaEventPublisher(Producer<String, String> producer, String topic, Duration timeout) {
        this.producer = producer;
        this.topic = topic;
        this.timeout = timeout;
    }

    /**
     * Creates a publisher for the configured stream, or a disabled one if no stream is configured.
     */
    public static EventPublisher create(StreamConfig config) {
        if (config == null || !config.enabled() || config.topic() == null || config.topic().isBlank()) {
            log.info("Event stream not configured, publishing disabled");
            return EventPublisher.disabled();
        }
        var props = new Properties();
        if (config.properties() != null) props.putAll(config.properties());
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.bootstrapServers());
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.putIfAbsent(ProducerConfig.ACKS_CONFIG, "all");
        log.atInfo().addKeyValue("bootstrapServers", config.bootstrapServers()).addKeyValue("topic", config.topic())
                .log("Publishing item events to Kafka");
        return new KafkaEventPublisher(new KafkaProducer<>(props), config.topic(), config.publishTimeout());
    }

    @Override
    public void publish(ItemEvent event) throws PublicationException {
        String json;
        try {
            json = mapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new PublicationException("Unable to serialize event for " + event.key(), e);
        }
        try {
            producer.send(new ProducerRecord<>(topic, event.key(), json)).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new PublicationException("Publishing " + event.key() + " failed", e.getCause());
        } catch (TimeoutException e) {
            throw new PublicationException("Publishing " + event.key() + " timed out after " + timeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PublicationException("Interrupted while publishing " + event.key(), e);
        }
    }

    @Override
    public void close() {
        producer.close(timeout);
    }
}
