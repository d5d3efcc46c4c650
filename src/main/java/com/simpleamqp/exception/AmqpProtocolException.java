package com.simpleamqp.exception;

/**
 * The broker sent a frame that does not fit the expected sequence.
 */
public class AmqpProtocolException extends AmqpException {

    public AmqpProtocolException(String message) {
        super(message);
    }
}
