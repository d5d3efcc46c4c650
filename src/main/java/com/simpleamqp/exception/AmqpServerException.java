package com.simpleamqp.exception;

/**
 * The broker closed a channel or the connection with channel.close or connection.close.
 * Session state has already been updated by the time this is thrown.
 */
public abstract class AmqpServerException extends AmqpException {
    private final int replyCode;
    private final String replyText;
    private final int classId;
    private final int methodId;

    protected AmqpServerException(String scope, int replyCode, String replyText, int classId, int methodId) {
        super(String.format("%s closed by broker: %d %s (class=%d, method=%d)",
                scope, replyCode, replyText, classId, methodId));
        this.replyCode = replyCode;
        this.replyText = replyText;
        this.classId = classId;
        this.methodId = methodId;
    }

    public int getReplyCode() {
        return replyCode;
    }

    public String getReplyText() {
        return replyText;
    }

    /**
     * Class id of the method that caused the close, 0 if none.
     */
    public int getClassId() {
        return classId;
    }

    public int getMethodId() {
        return methodId;
    }

    public abstract boolean isHardError();
}
