package io.backup4j.internal.kafka;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.WakeupException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.core.ConsumerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class KafkaReloadChannelTest {

    private static final String TOPIC = "backup4j.schedules";
    private static final TopicPartition TP = new TopicPartition(TOPIC, 0);

    private MockConsumer<String, String> first;
    private MockConsumer<String, String> second;
    private ConsumerFactory<String, String> factory;
    private KafkaReloadChannel channel;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        first = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
        second = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
        factory = mock(ConsumerFactory.class);
        when(factory.createConsumer("backup4j-dispatcher", null)).thenReturn(first, second);
        channel = new KafkaReloadChannel(factory, TOPIC, "backup4j-dispatcher");
    }

    private void assignAndPublish(MockConsumer<String, String> consumer, int count) {
        consumer.rebalance(List.of(TP));
        consumer.updateBeginningOffsets(Map.of(TP, 0L));
        for (int i = 0; i < count; i++) {
            consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, i, null, ""));
        }
    }

    @Test
    void pollShouldSubscribeLazilyAndCountNotifications() {
        assertEquals(0, channel.poll(Duration.ZERO));
        assertEquals(Set.of(TOPIC), first.subscription());

        assignAndPublish(first, 2);

        assertEquals(2, channel.poll(Duration.ZERO));
        verify(factory, times(1)).createConsumer("backup4j-dispatcher", null);
    }

    @Test
    void acknowledgeShouldCommitPolledOffsets() {
        channel.poll(Duration.ZERO);
        assignAndPublish(first, 3);
        channel.poll(Duration.ZERO);

        assertNull(first.committed(Set.of(TP)).get(TP));
        channel.acknowledge();

        OffsetAndMetadata committed = first.committed(Set.of(TP)).get(TP);
        assertEquals(3L, committed.offset());
    }

    @Test
    void reconnectShouldReplaceConsumer() {
        channel.poll(Duration.ZERO);

        channel.reconnect();

        assertTrue(first.closed());
        assertEquals(Set.of(TOPIC), second.subscription());
    }

    @Test
    void wakeupShouldAbortNextPoll() {
        channel.poll(Duration.ZERO);

        channel.wakeup();

        assertThrows(WakeupException.class, () -> channel.poll(Duration.ofSeconds(5)));
    }

    @Test
    void closeShouldReleaseConsumerAndAllowWakeupAfterwards() {
        channel.poll(Duration.ZERO);

        channel.close();
        channel.wakeup();

        assertTrue(first.closed());
    }
}
