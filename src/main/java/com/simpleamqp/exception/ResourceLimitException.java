package com.simpleamqp.exception;

/**
 * No channel id is left below the negotiated channel-max.
 */
public class ResourceLimitException extends AmqpException {

    public ResourceLimitException(String message) {
        super(message);
    }
}
