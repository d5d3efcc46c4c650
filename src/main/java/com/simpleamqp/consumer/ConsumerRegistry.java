package com.simpleamqp.consumer;

import com.simpleamqp.exception.ConsumerTagNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps consumer tags to the channel their deliveries arrive on.
 */
public class ConsumerRegistry {
    private static final Logger logger = LoggerFactory.getLogger(ConsumerRegistry.class);

    private final Map<String, Consumer> consumers = new LinkedHashMap<>();

    public static class Consumer {
        private final String consumerTag;
        private final String queueName;
        private final int channel;
        private final boolean noAck;

        public Consumer(String consumerTag, String queueName, int channel, boolean noAck) {
            this.consumerTag = consumerTag;
            this.queueName = queueName;
            this.channel = channel;
            this.noAck = noAck;
        }

        public String getConsumerTag() {
            return consumerTag;
        }

        public String getQueueName() {
            return queueName;
        }

        public int getChannel() {
            return channel;
        }

        public boolean isNoAck() {
            return noAck;
        }

        @Override
        public String toString() {
            return String.format("Consumer{tag='%s', queue='%s', channel=%d, noAck=%s}",
                    consumerTag, queueName, channel, noAck);
        }
    }

    /**
     * @throws IllegalStateException if the tag is already registered
     */
    public Consumer addConsumer(String consumerTag, String queueName, int channel, boolean noAck) {
        if (consumers.containsKey(consumerTag)) {
            throw new IllegalStateException("Consumer tag already registered: " + consumerTag);
        }
        Consumer consumer = new Consumer(consumerTag, queueName, channel, noAck);
        consumers.put(consumerTag, consumer);
        logger.debug("Added consumer: {}", consumer);
        return consumer;
    }

    /**
     * @throws ConsumerTagNotFoundException if the tag is not registered
     */
    public Consumer removeConsumer(String consumerTag) {
        Consumer consumer = consumers.remove(consumerTag);
        if (consumer == null) {
            throw new ConsumerTagNotFoundException(consumerTag);
        }
        logger.debug("Removed consumer: {}", consumer);
        return consumer;
    }

    /**
     * @throws ConsumerTagNotFoundException if the tag is not registered
     */
    public int getConsumerChannel(String consumerTag) {
        Consumer consumer = consumers.get(consumerTag);
        if (consumer == null) {
            throw new ConsumerTagNotFoundException(consumerTag);
        }
        return consumer.getChannel();
    }

    /**
     * True if {@code consumerTag} is registered and the broker settles its deliveries itself.
     */
    public boolean isNoAckConsumer(String consumerTag) {
        Consumer consumer = consumers.get(consumerTag);
        return consumer != null && consumer.isNoAck();
    }

    public boolean hasConsumer(String consumerTag) {
        return consumers.containsKey(consumerTag);
    }

    public Set<Integer> getAllConsumerChannels() {
        Set<Integer> channels = new LinkedHashSet<>();
        for (Consumer consumer : consumers.values()) {
            channels.add(consumer.getChannel());
        }
        return channels;
    }

    public List<Consumer> getConsumersForChannel(int channel) {
        List<Consumer> result = new ArrayList<>();
        for (Consumer consumer : consumers.values()) {
            if (consumer.getChannel() == channel) {
                result.add(consumer);
            }
        }
        return result;
    }

    /**
     * Forget every consumer on a channel that has gone away.
     */
    public List<Consumer> removeConsumersForChannel(int channel) {
        List<Consumer> removed = getConsumersForChannel(channel);
        for (Consumer consumer : removed) {
            consumers.remove(consumer.getConsumerTag());
        }
        if (!removed.isEmpty()) {
            logger.debug("Removed {} consumers on closed channel {}", removed.size(), channel);
        }
        return removed;
    }

    public void clear() {
        consumers.clear();
    }

    public int getConsumerCount() {
        return consumers.size();
    }
}
