package com.simpleamqp.confirms;

import com.simpleamqp.amqp.AmqpFrame;
import com.simpleamqp.amqp.AmqpMethod;
import com.simpleamqp.amqp.MethodArgs;
import com.simpleamqp.exception.AmqpProtocolException;
import com.simpleamqp.exception.MessageRejectedException;
import com.simpleamqp.exception.MessageReturnedException;
import com.simpleamqp.model.Message;
import com.simpleamqp.session.ChannelPool;
import com.simpleamqp.session.FrameDemultiplexer;
import com.simpleamqp.session.MessageAssembler;
import com.simpleamqp.transport.FrameTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Publisher-confirm bookkeeping per channel. Every publish on a confirm-mode channel
 * is settled by one call to {@link #getAckOnChannel(int)}.
 *
 * <p>The broker may acknowledge several publishes with one ack whose delivery tag jumps
 * ahead; the skipped tags are remembered and spent by the following publishes without
 * reading another frame.
 */
public class PublisherConfirms {
    private static final Logger logger = LoggerFactory.getLogger(PublisherConfirms.class);

    private static final Set<AmqpMethod> CONFIRM_REPLIES =
            EnumSet.of(AmqpMethod.BASIC_ACK, AmqpMethod.BASIC_NACK, AmqpMethod.BASIC_RETURN);
    private static final Set<AmqpMethod> ACK_ONLY = EnumSet.of(AmqpMethod.BASIC_ACK);

    private final FrameDemultiplexer demux;
    private final MessageAssembler assembler;
    private final ChannelPool pool;
    private final Map<Integer, ConfirmState> states = new HashMap<>();
    private long staleAckCount;

    public PublisherConfirms(FrameDemultiplexer demux, MessageAssembler assembler, ChannelPool pool) {
        this.demux = demux;
        this.assembler = assembler;
        this.pool = pool;
    }

    /**
     * Start counting from scratch, as after confirm.select on a newly opened channel.
     */
    public void reset(int channel) {
        states.put(channel, new ConfirmState());
    }

    /**
     * Wait for the broker's verdict on the last publish on {@code channel}. The channel is
     * returned to the pool whatever the outcome.
     *
     * @throws MessageRejectedException if the broker nacked the publish
     * @throws MessageReturnedException if the broker returned the message as unroutable
     */
    public void getAckOnChannel(int channel) {
        ConfirmState state = states.computeIfAbsent(channel, k -> new ConfirmState());
        try {
            if (state.unconsumedAck > 0) {
                state.unconsumedAck--;
                logger.debug("Publish on channel {} covered by an earlier ack, {} left",
                        channel, state.unconsumedAck);
                return;
            }

            AmqpFrame frame = waitFor(channel, CONFIRM_REPLIES);
            AmqpMethod method = frame.getMethod();
            switch (method) {
                case BASIC_ACK:
                    recordAck(channel, state, MethodArgs.decodeConfirm(frame));
                    return;
                case BASIC_NACK: {
                    MethodArgs.Confirm nack = MethodArgs.decodeConfirm(frame);
                    state.lastDeliveryTag = nack.getDeliveryTag();
                    if (nack.isMultiple()) {
                        logger.warn("Nack on channel {} covers several publishes up to {}, only one rejection is reported",
                                channel, nack.getDeliveryTag());
                    }
                    throw new MessageRejectedException(nack.getDeliveryTag());
                }
                case BASIC_RETURN: {
                    MethodArgs.Return returned = MethodArgs.decodeReturn(frame);
                    Message message = assembler.readContent(channel);
                    recordAck(channel, state, MethodArgs.decodeConfirm(waitFor(channel, ACK_ONLY)));
                    throw new MessageReturnedException(message, returned.getReplyCode(), returned.getReplyText(),
                            returned.getExchange(), returned.getRoutingKey());
                }
                default:
                    throw new AmqpProtocolException("Unexpected confirm reply on channel " + channel + ": " + method);
            }
        } finally {
            pool.returnChannel(channel);
            demux.maybeReleaseBuffersOnChannel(channel);
        }
    }

    private AmqpFrame waitFor(int channel, Set<AmqpMethod> expected) {
        return demux.getMethodOnChannel(channel, expected, FrameTransport.INFINITE)
                .orElseThrow(() -> new IllegalStateException("No reply without a timeout"));
    }

    private void recordAck(int channel, ConfirmState state, MethodArgs.Confirm ack) {
        long tag = ack.getDeliveryTag();
        if (tag <= state.lastDeliveryTag) {
            staleAckCount++;
            logger.warn("Ignoring stale ack {} on channel {}, last delivery tag is {}",
                    tag, channel, state.lastDeliveryTag);
            return;
        }
        long gap = tag - state.lastDeliveryTag;
        state.lastDeliveryTag = tag;
        if (gap > 1) {
            state.unconsumedAck = gap - 1;
        }
    }

    public long getLastDeliveryTag(int channel) {
        ConfirmState state = states.get(channel);
        return state != null ? state.lastDeliveryTag : 0;
    }

    public long getUnconsumedAck(int channel) {
        ConfirmState state = states.get(channel);
        return state != null ? state.unconsumedAck : 0;
    }

    /**
     * Acks that did not advance the delivery tag, across all channels.
     */
    public long getStaleAckCount() {
        return staleAckCount;
    }

    private static class ConfirmState {
        long lastDeliveryTag;
        long unconsumedAck;
    }
}
