package com.simpleamqp.session;

import com.simpleamqp.amqp.AmqpFrame;

import java.io.IOException;

/**
 * Outcome of waiting for a synchronous reply, before it is classified.
 */
public final class RpcReply {

    public enum Kind {
        NORMAL,
        LIBRARY_EXCEPTION,
        SERVER_EXCEPTION
    }

    private final Kind kind;
    private final AmqpFrame frame;
    private final IOException cause;

    private RpcReply(Kind kind, AmqpFrame frame, IOException cause) {
        this.kind = kind;
        this.frame = frame;
        this.cause = cause;
    }

    public static RpcReply normal(AmqpFrame frame) {
        return new RpcReply(Kind.NORMAL, frame, null);
    }

    /**
     * The transport failed underneath us.
     */
    public static RpcReply libraryException(IOException cause) {
        return new RpcReply(Kind.LIBRARY_EXCEPTION, null, cause);
    }

    /**
     * The broker answered with channel.close or connection.close.
     */
    public static RpcReply serverException(AmqpFrame closeFrame) {
        return new RpcReply(Kind.SERVER_EXCEPTION, closeFrame, null);
    }

    public Kind getKind() {
        return kind;
    }

    public AmqpFrame getFrame() {
        return frame;
    }

    public IOException getCause() {
        return cause;
    }
}
