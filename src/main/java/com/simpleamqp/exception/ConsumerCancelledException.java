package com.simpleamqp.exception;

/**
 * The broker cancelled a consumer, for example because its queue was deleted.
 */
public class ConsumerCancelledException extends AmqpException {
    private final String consumerTag;

    public ConsumerCancelledException(String consumerTag) {
        super("Consumer was cancelled by the broker: " + consumerTag);
        this.consumerTag = consumerTag;
    }

    public String getConsumerTag() {
        return consumerTag;
    }
}
