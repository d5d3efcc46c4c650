package com.simpleamqp.exception;

/**
 * Base class for every error raised by the client.
 */
public class AmqpException extends RuntimeException {

    public AmqpException(String message) {
        super(message);
    }

    public AmqpException(String message, Throwable cause) {
        super(message, cause);
    }
}
