package com.simpleamqp.transport;

import com.simpleamqp.amqp.AmqpFrame;

import java.io.IOException;
import java.util.Optional;

/**
 * The byte stream under a session: yields decoded frames and accepts frames to send.
 * Failures of the underlying connection surface as {@link IOException}; protocol-level
 * conditions are left to the caller.
 */
public interface FrameTransport extends AutoCloseable {

    long INFINITE = -1;

    /**
     * Send the protocol header that opens the AMQP conversation.
     */
    void writeProtocolHeader() throws IOException;

    /**
     * Read the next frame off the connection.
     *
     * @param timeoutMillis how long to wait, or {@link #INFINITE}
     * @return the frame, or empty if the timeout elapsed first
     */
    Optional<AmqpFrame> readFrame(long timeoutMillis) throws IOException;

    /**
     * Send a frame. Ownership of the frame's buffer passes to the transport.
     */
    void writeFrame(AmqpFrame frame) throws IOException;

    /**
     * Raise the largest inbound frame the transport accepts, once frame-max is negotiated.
     */
    void setMaxFrameSize(int frameMax);

    boolean isOpen();

    @Override
    void close();
}
