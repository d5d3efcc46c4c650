package com.simpleamqp.consumer;

import com.simpleamqp.exception.ConsumerTagNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Consumer Registry Tests")
class ConsumerRegistryTest {

    private ConsumerRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ConsumerRegistry();
    }

    @Test
    void testAddAndLookup() {
        ConsumerRegistry.Consumer consumer = registry.addConsumer("ctag-1", "orders", 3, false);

        assertThat(consumer.getQueueName()).isEqualTo("orders");
        assertThat(registry.hasConsumer("ctag-1")).isTrue();
        assertThat(registry.getConsumerChannel("ctag-1")).isEqualTo(3);
        assertThat(registry.getConsumerCount()).isEqualTo(1);
    }

    @Test
    void testDuplicateTagRejected() {
        registry.addConsumer("ctag-1", "orders", 1, false);

        assertThatThrownBy(() -> registry.addConsumer("ctag-1", "invoices", 2, true))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("ctag-1");
        assertThat(registry.getConsumerChannel("ctag-1")).isEqualTo(1);
    }

    @Test
    void testUnknownTag() {
        assertThatThrownBy(() -> registry.getConsumerChannel("missing"))
            .isInstanceOf(ConsumerTagNotFoundException.class);
        assertThatThrownBy(() -> registry.removeConsumer("missing"))
            .isInstanceOf(ConsumerTagNotFoundException.class);
    }

    @Test
    void testRemoveConsumer() {
        registry.addConsumer("ctag-1", "orders", 1, false);

        ConsumerRegistry.Consumer removed = registry.removeConsumer("ctag-1");

        assertThat(removed.getConsumerTag()).isEqualTo("ctag-1");
        assertThat(registry.hasConsumer("ctag-1")).isFalse();
    }

    @Test
    void testChannelsInRegistrationOrder() {
        registry.addConsumer("a", "q1", 4, false);
        registry.addConsumer("b", "q2", 2, false);
        registry.addConsumer("c", "q3", 4, true);

        assertThat(registry.getAllConsumerChannels()).containsExactly(4, 2);
        assertThat(registry.getConsumersForChannel(4))
            .extracting(ConsumerRegistry.Consumer::getConsumerTag)
            .containsExactly("a", "c");
    }

    @Test
    void testRemoveConsumersForChannel() {
        registry.addConsumer("a", "q1", 4, false);
        registry.addConsumer("b", "q2", 2, false);
        registry.addConsumer("c", "q3", 4, true);

        assertThat(registry.removeConsumersForChannel(4)).hasSize(2);
        assertThat(registry.getConsumerCount()).isEqualTo(1);
        assertThat(registry.hasConsumer("b")).isTrue();
        assertThat(registry.removeConsumersForChannel(9)).isEmpty();
    }

    @Test
    void testNoAckFlag() {
        registry.addConsumer("auto", "q1", 1, true);
        registry.addConsumer("manual", "q2", 1, false);

        assertThat(registry.isNoAckConsumer("auto")).isTrue();
        assertThat(registry.isNoAckConsumer("manual")).isFalse();
        assertThat(registry.isNoAckConsumer("missing")).isFalse();
    }

    @Test
    void testClear() {
        registry.addConsumer("a", "q1", 1, false);
        registry.clear();
        assertThat(registry.getConsumerCount()).isZero();
    }
}
