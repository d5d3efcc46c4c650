package com.simpleamqp.exception;

public class ConnectionClosedException extends AmqpServerException {

    public ConnectionClosedException(int replyCode, String replyText, int classId, int methodId) {
        super("Connection", replyCode, replyText, classId, methodId);
    }

    /**
     * The session was already disconnected when an operation was attempted.
     */
    public static ConnectionClosedException notConnected() {
        return new ConnectionClosedException(0, "connection is closed", 0, 0);
    }

    @Override
    public boolean isHardError() {
        return true;
    }
}
