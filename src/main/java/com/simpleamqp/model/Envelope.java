package com.simpleamqp.model;

/**
 * A fully assembled delivered message together with its basic.deliver metadata.
 */
public final class Envelope {
    private final Message message;
    private final String consumerTag;
    private final int channel;
    private final long deliveryTag;
    private final boolean redelivered;
    private final String exchange;
    private final String routingKey;

    public Envelope(Message message, String consumerTag, int channel, long deliveryTag,
                    boolean redelivered, String exchange, String routingKey) {
        this.message = message;
        this.consumerTag = consumerTag;
        this.channel = channel;
        this.deliveryTag = deliveryTag;
        this.redelivered = redelivered;
        this.exchange = exchange;
        this.routingKey = routingKey;
    }

    public Message getMessage() {
        return message;
    }

    public String getConsumerTag() {
        return consumerTag;
    }

    public int getChannel() {
        return channel;
    }

    public long getDeliveryTag() {
        return deliveryTag;
    }

    public boolean isRedelivered() {
        return redelivered;
    }

    public String getExchange() {
        return exchange;
    }

    public String getRoutingKey() {
        return routingKey;
    }

    @Override
    public String toString() {
        return String.format("Envelope{consumerTag='%s', channel=%d, deliveryTag=%d, redelivered=%s, exchange='%s', routingKey='%s'}",
                consumerTag, channel, deliveryTag, redelivered, exchange, routingKey);
    }
}
