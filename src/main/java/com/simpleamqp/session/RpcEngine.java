package com.simpleamqp.session;

import com.simpleamqp.amqp.AmqpFrame;
import com.simpleamqp.amqp.AmqpMethod;
import com.simpleamqp.transport.FrameTransport;
import io.netty.buffer.ByteBuf;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Set;

/**
 * Synchronous request/reply on top of the shared frame stream.
 */
public class RpcEngine {
    private static final Logger logger = LoggerFactory.getLogger(RpcEngine.class);

    private final FrameTransport transport;
    private final FrameDemultiplexer demux;

    public RpcEngine(FrameTransport transport, FrameDemultiplexer demux) {
        this.transport = transport;
        this.demux = demux;
    }

    /**
     * Send {@code method} on {@code channel} and block until one of {@code expectedReplies}
     * arrives for it. The reply frame is owned by the demultiplexer.
     */
    public AmqpFrame doRpcOnChannel(int channel, AmqpMethod method, ByteBuf args, Set<AmqpMethod> expectedReplies) {
        sendMethod(channel, method, args);
        logger.debug("Waiting for {} on channel {}", expectedReplies, channel);
        AmqpFrame reply = demux.getRpcReplyOnChannel(channel, expectedReplies, FrameTransport.INFINITE)
                .orElseThrow(() -> new IllegalStateException("No reply without a timeout"));
        return demux.checkRpcReply(channel, RpcReply.normal(reply));
    }

    public void sendMethod(int channel, AmqpMethod method, ByteBuf args) {
        logger.debug("Sending {} on channel {}", method, channel);
        sendFrame(AmqpFrame.method(channel, method, args));
    }

    public void sendFrame(AmqpFrame frame) {
        int channel = frame.getChannel();
        try {
            transport.writeFrame(frame);
        } catch (IOException e) {
            demux.checkRpcReply(channel, RpcReply.libraryException(e));
        }
    }
}
