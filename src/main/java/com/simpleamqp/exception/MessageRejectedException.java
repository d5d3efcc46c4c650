package com.simpleamqp.exception;

/**
 * The broker answered a confirmed publish with basic.nack.
 */
public class MessageRejectedException extends AmqpException {
    private final long deliveryTag;

    public MessageRejectedException(long deliveryTag) {
        super("Message rejected by broker, delivery tag: " + deliveryTag);
        this.deliveryTag = deliveryTag;
    }

    public long getDeliveryTag() {
        return deliveryTag;
    }
}
