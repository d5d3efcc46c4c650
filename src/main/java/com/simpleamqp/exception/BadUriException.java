package com.simpleamqp.exception;

public class BadUriException extends AmqpException {

    public BadUriException(String uri) {
        super("URI is malformed: " + uri);
    }

    public BadUriException(String uri, Throwable cause) {
        super("URI is malformed: " + uri, cause);
    }
}
