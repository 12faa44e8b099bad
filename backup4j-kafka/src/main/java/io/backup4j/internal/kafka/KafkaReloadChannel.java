package io.backup4j.internal.kafka;

import io.backup4j.core.ReloadChannel;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.ConsumerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Reload topic consumer.
 *
 * <p>Not thread-safe: every method except {@link #wakeup()} must be called from the listener
 * thread. Offsets are committed only in {@link #acknowledge()}, so auto-commit must be disabled
 * on the consumer factory; anything polled but not acknowledged before a reconnect is delivered
 * again.
 */
public class KafkaReloadChannel implements ReloadChannel {
    private static final Logger log = LoggerFactory.getLogger(KafkaReloadChannel.class);

    private final ConsumerFactory<String, String> consumerFactory;
    private final String topic;
    private final String groupId;

    private volatile Consumer<String, String> consumer;
    private boolean pending;

    public KafkaReloadChannel(ConsumerFactory<String, String> consumerFactory, String topic, String groupId) {
        this.consumerFactory = Objects.requireNonNull(consumerFactory, "consumerFactory must not be null");
        this.topic = Objects.requireNonNull(topic, "topic must not be null");
        this.groupId = Objects.requireNonNull(groupId, "groupId must not be null");
    }

    @Override
    public int poll(Duration timeout) {
        ConsumerRecords<String, String> records = consumer().poll(timeout);
        if (!records.isEmpty()) {
            pending = true;
        }
        return records.count();
    }

    @Override
    public void acknowledge() {
        Consumer<String, String> c = consumer;
        if (c != null && pending) {
            c.commitSync();
            pending = false;
        }
    }

    @Override
    public void reconnect() {
        closeConsumer();
        consumer();
    }

    @Override
    public void wakeup() {
        Consumer<String, String> c = consumer;
        if (c != null) {
            c.wakeup();
        }
    }

    @Override
    public void close() {
        closeConsumer();
    }

    private Consumer<String, String> consumer() {
        Consumer<String, String> c = consumer;
        if (c == null) {
            c = consumerFactory.createConsumer(groupId, null);
            c.subscribe(List.of(topic));
            consumer = c;
            log.info("Reload consumer subscribed topic={} groupId={}", topic, groupId);
        }
        return c;
    }

    private void closeConsumer() {
        Consumer<String, String> c = consumer;
        consumer = null;
        pending = false;
        if (c == null) {
            return;
        }
        try {
            c.close();
        } catch (RuntimeException e) {
            log.warn("Reload consumer close failed topic={} msg={}", topic, e.getMessage());
        }
    }
}
