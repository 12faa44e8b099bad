package io.backup4j.internal.kafka;

import io.backup4j.core.ReloadPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes an empty record on the reload topic and waits for the broker to acknowledge it.
 */
public class KafkaReloadPublisher implements ReloadPublisher {
    private static final Logger log = LoggerFactory.getLogger(KafkaReloadPublisher.class);

    static final Duration SEND_TIMEOUT = Duration.ofSeconds(10);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final String topic;

    public KafkaReloadPublisher(KafkaTemplate<String, String> kafkaTemplate, String topic) {
        this.kafkaTemplate = Objects.requireNonNull(kafkaTemplate, "kafkaTemplate must not be null");
        this.topic = Objects.requireNonNull(topic, "topic must not be null");
    }

    @Override
    public void publishReload() {
        try {
            kafkaTemplate.send(topic, "").get(SEND_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            log.debug("Reload published topic={}", topic);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new KafkaException("Interrupted while publishing reload to topic " + topic, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new KafkaException("Failed to publish reload to topic " + topic + ": " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new KafkaException("Timed out publishing reload to topic " + topic, e);
        }
    }
}
