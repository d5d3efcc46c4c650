package com.simpleamqp.exception;

public class ConsumerTagNotFoundException extends AmqpException {
    private final String consumerTag;

    public ConsumerTagNotFoundException(String consumerTag) {
        super("Consumer tag not found: " + consumerTag);
        this.consumerTag = consumerTag;
    }

    public String getConsumerTag() {
        return consumerTag;
    }
}
