package com.simpleamqp.session;

import com.simpleamqp.amqp.AmqpFrame;
import com.simpleamqp.amqp.AmqpMethod;
import com.simpleamqp.amqp.ContentHeader;
import com.simpleamqp.amqp.MethodArgs;
import com.simpleamqp.exception.AmqpProtocolException;
import com.simpleamqp.model.Envelope;
import com.simpleamqp.model.Message;
import com.simpleamqp.transport.FrameTransport;
import io.netty.buffer.ByteBuf;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Rebuilds messages from a content header and its body frames, and turns complete
 * deliveries sitting in the frame buffer into envelopes as soon as they are whole.
 */
public class MessageAssembler implements FrameDemultiplexer.BufferListener {
    private static final Logger logger = LoggerFactory.getLogger(MessageAssembler.class);

    private final FrameDemultiplexer demux;
    private final Deque<Envelope> delivered = new ArrayDeque<>();

    public MessageAssembler(FrameDemultiplexer demux) {
        this.demux = demux;
    }

    /**
     * Read the content that follows a content-carrying method on {@code channel}:
     * one header frame, then body frames up to exactly the declared size.
     *
     * @throws AmqpProtocolException on any other frame kind or a body overrun
     */
    public Message readContent(int channel) {
        AmqpFrame headerFrame = nextContentFrame(channel);
        if (headerFrame.getType() != AmqpFrame.FrameType.HEADER) {
            throw new AmqpProtocolException("Expected content header on channel " + channel + ", got " + headerFrame);
        }
        ContentHeader header = ContentHeader.decode(headerFrame);
        byte[] body = new byte[bodySizeOf(header)];
        int received = 0;
        while (received < body.length) {
            AmqpFrame bodyFrame = nextContentFrame(channel);
            if (bodyFrame.getType() != AmqpFrame.FrameType.BODY) {
                throw new AmqpProtocolException("Expected content body on channel " + channel + ", got " + bodyFrame);
            }
            received = appendBody(channel, body, received, bodyFrame);
        }

        Message message = header.getProperties();
        message.setBody(body);
        return message;
    }

    private AmqpFrame nextContentFrame(int channel) {
        return demux.getNextContentFrameOnChannel(channel, FrameTransport.INFINITE)
                .orElseThrow(() -> new IllegalStateException("No frame without a timeout"));
    }

    private static int bodySizeOf(ContentHeader header) {
        if (header.getBodySize() > Integer.MAX_VALUE) {
            throw new AmqpProtocolException("Body too large: " + header.getBodySize() + " bytes");
        }
        return (int) header.getBodySize();
    }

    private static int appendBody(int channel, byte[] body, int received, AmqpFrame bodyFrame) {
        int size = bodyFrame.getSize();
        if (received + size > body.length) {
            throw new AmqpProtocolException("Body overrun on channel " + channel + ": declared "
                    + body.length + " bytes, received " + (received + size));
        }
        ByteBuf payload = bodyFrame.getPayload();
        payload.getBytes(payload.readerIndex(), body, received, size);
        return received + size;
    }

    /**
     * True when the buffer holds, for {@code channel}, a delivery followed by its header
     * and enough body frames to fill the declared size.
     */
    public boolean checkForQueuedMessageOnChannel(int channel) {
        return !findQueuedMessage(channel).isEmpty();
    }

    // The first buffered delivery on the channel with its header and bodies, if all have arrived
    private List<AmqpFrame> findQueuedMessage(int channel) {
        List<AmqpFrame> frames = demux.bufferedFramesOn(channel);
        int start = 0;
        while (start < frames.size() && !frames.get(start).isMethod(AmqpMethod.BASIC_DELIVER)) {
            start++;
        }
        if (start + 1 >= frames.size() || frames.get(start + 1).getType() != AmqpFrame.FrameType.HEADER) {
            return Collections.emptyList();
        }
        long needed = ContentHeader.decode(frames.get(start + 1)).getBodySize();
        long available = 0;
        int end = start + 2;
        while (end < frames.size() && available < needed
                && frames.get(end).getType() == AmqpFrame.FrameType.BODY) {
            available += frames.get(end).getSize();
            end++;
        }
        if (available < needed) {
            return Collections.emptyList();
        }
        return new ArrayList<>(frames.subList(start, end));
    }

    @Override
    public void onFrameBuffered(AmqpFrame frame) {
        int channel = frame.getChannel();
        List<AmqpFrame> queued;
        while (!(queued = findQueuedMessage(channel)).isEmpty()) {
            demux.takeBuffered(queued);
            MethodArgs.Deliver deliver = MethodArgs.decodeDeliver(queued.get(0));
            ContentHeader header = ContentHeader.decode(queued.get(1));
            byte[] body = new byte[bodySizeOf(header)];
            int received = 0;
            for (AmqpFrame bodyFrame : queued.subList(2, queued.size())) {
                received = appendBody(channel, body, received, bodyFrame);
            }
            Message message = header.getProperties();
            message.setBody(body);

            delivered.add(new Envelope(message, deliver.getConsumerTag(), channel, deliver.getDeliveryTag(),
                    deliver.isRedelivered(), deliver.getExchange(), deliver.getRoutingKey()));
            logger.debug("Queued delivery {} for consumer {} on channel {}",
                    deliver.getDeliveryTag(), deliver.getConsumerTag(), channel);
            demux.maybeReleaseBuffersOnChannel(channel);
        }
    }

    /**
     * Take the oldest assembled envelope for {@code consumerTag}.
     */
    public Optional<Envelope> pollDelivered(String consumerTag) {
        Iterator<Envelope> it = delivered.iterator();
        while (it.hasNext()) {
            Envelope envelope = it.next();
            if (envelope.getConsumerTag().equals(consumerTag)) {
                it.remove();
                return Optional.of(envelope);
            }
        }
        return Optional.empty();
    }

    /**
     * Queue an envelope read for a consumer other than the one being served.
     */
    public void enqueueDelivered(Envelope envelope) {
        delivered.add(envelope);
    }

    public int discardDelivered(String consumerTag) {
        int discarded = 0;
        Iterator<Envelope> it = delivered.iterator();
        while (it.hasNext()) {
            if (it.next().getConsumerTag().equals(consumerTag)) {
                it.remove();
                discarded++;
            }
        }
        if (discarded > 0) {
            logger.debug("Discarded {} undelivered messages for consumer {}", discarded, consumerTag);
        }
        return discarded;
    }

    public int getDeliveredCount() {
        return delivered.size();
    }
}
