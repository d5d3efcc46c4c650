package com.simpleamqp.exception;

/**
 * The underlying socket read or write failed. The connection is most likely unusable.
 */
public class AmqpTransportException extends AmqpException {

    public AmqpTransportException(String message) {
        super(message);
    }

    public AmqpTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
