package com.simpleamqp.session;

import com.simpleamqp.amqp.AmqpConstants;
import com.simpleamqp.amqp.AmqpFrame;
import com.simpleamqp.amqp.AmqpMethod;
import com.simpleamqp.exception.AmqpTransportException;
import com.simpleamqp.exception.ResourceLimitException;
import com.simpleamqp.transport.FrameTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The channel table of one connection. Hands out open channels for the duration of an
 * operation, opens new ones on demand and records closes observed from either end.
 * Slot 0 is the connection's own channel and is never handed out.
 */
public class ChannelPool {
    private static final Logger logger = LoggerFactory.getLogger(ChannelPool.class);

    /**
     * Runs the broker-side open of a freshly allocated channel id.
     */
    @FunctionalInterface
    public interface ChannelOpener {
        void open(int channel);
    }

    private final FrameTransport transport;
    private final ChannelOpener opener;
    private final List<ChannelSlot> slots = new ArrayList<>();
    private int channelMax = AmqpConstants.MAX_CHANNEL_ID;
    private int lastUsed;
    private boolean connected;

    public ChannelPool(FrameTransport transport, ChannelOpener opener) {
        this.transport = transport;
        this.opener = opener;
        slots.add(new ChannelSlot(ChannelState.USED));
    }

    /**
     * Apply the negotiated channel-max. Zero means no limit beyond the protocol's.
     */
    public void setChannelMax(int negotiated) {
        this.channelMax = negotiated == 0 ? AmqpConstants.MAX_CHANNEL_ID : negotiated;
    }

    public int getChannelMax() {
        return channelMax;
    }

    public boolean isConnected() {
        return connected;
    }

    public void setConnected(boolean connected) {
        this.connected = connected;
    }

    /**
     * Borrow a channel: the last returned one if still open, else any open one,
     * else a newly opened one. The channel is {@link ChannelState#USED} until returned.
     */
    public int getChannel() {
        int channel;
        if (lastUsed != 0 && stateOf(lastUsed) == ChannelState.OPEN) {
            channel = lastUsed;
        } else {
            channel = findOpen();
            if (channel == 0) {
                channel = createNewChannel();
            }
        }
        slots.get(channel).state = ChannelState.USED;
        logger.debug("Borrowed channel {}", channel);
        return channel;
    }

    private int findOpen() {
        for (int i = 1; i < slots.size(); i++) {
            if (slots.get(i).state == ChannelState.OPEN) {
                return i;
            }
        }
        return 0;
    }

    /**
     * Allocate the lowest free channel id and open it on the broker.
     *
     * @throws ResourceLimitException if channel-max channels are already in use
     */
    public int createNewChannel() {
        int channel = 0;
        for (int i = 1; i < slots.size(); i++) {
            if (slots.get(i).state == ChannelState.CLOSED) {
                channel = i;
                break;
            }
        }
        if (channel == 0) {
            if (slots.size() > channelMax) {
                throw new ResourceLimitException("All " + channelMax + " channels are in use");
            }
            channel = slots.size();
            slots.add(new ChannelSlot(ChannelState.CLOSED));
        }

        ChannelSlot slot = slots.get(channel);
        // Claimed while the open handshake runs so nothing else picks it
        slot.state = ChannelState.USED;
        try {
            opener.open(channel);
        } catch (RuntimeException e) {
            slot.state = ChannelState.CLOSED;
            throw e;
        }
        slot.state = ChannelState.OPEN;
        logger.debug("Opened channel {}", channel);
        return channel;
    }

    /**
     * Give a borrowed channel back. A channel closed while it was borrowed stays closed.
     */
    public void returnChannel(int channel) {
        ChannelSlot slot = slotOf(channel);
        if (slot == null || channel == 0) {
            return;
        }
        if (slot.state == ChannelState.USED) {
            slot.state = ChannelState.OPEN;
        }
        lastUsed = channel;
    }

    public boolean isChannelOpen(int channel) {
        return stateOf(channel) != ChannelState.CLOSED;
    }

    public ChannelState stateOf(int channel) {
        ChannelSlot slot = slotOf(channel);
        return slot != null ? slot.state : ChannelState.CLOSED;
    }

    public Optional<String> getDirectReplyTag(int channel) {
        ChannelSlot slot = slotOf(channel);
        return slot != null ? Optional.ofNullable(slot.directReplyTag) : Optional.empty();
    }

    public void setDirectReplyTag(int channel, String consumerTag) {
        ChannelSlot slot = slotOf(channel);
        if (slot == null || slot.state == ChannelState.CLOSED) {
            throw new IllegalStateException("Channel " + channel + " is not open");
        }
        slot.directReplyTag = consumerTag;
    }

    public void clearDirectReplyTag(int channel) {
        ChannelSlot slot = slotOf(channel);
        if (slot != null) {
            slot.directReplyTag = null;
        }
    }

    /**
     * Record a close we initiated and the broker confirmed.
     */
    public void channelClosed(int channel) {
        ChannelSlot slot = slotOf(channel);
        if (slot != null && channel != 0) {
            slot.state = ChannelState.CLOSED;
            slot.directReplyTag = null;
            logger.debug("Channel {} closed", channel);
        }
    }

    /**
     * Record a broker-initiated channel close and answer it with channel.close-ok.
     */
    public void finishCloseChannel(int channel) {
        channelClosed(channel);
        send(AmqpFrame.method(channel, AmqpMethod.CHANNEL_CLOSE_OK, null));
    }

    /**
     * Record a broker-initiated connection close and answer it with connection.close-ok.
     */
    public void finishCloseConnection() {
        connectionClosed();
        send(AmqpFrame.method(0, AmqpMethod.CONNECTION_CLOSE_OK, null));
    }

    /**
     * Mark the connection down and every channel closed.
     */
    public void connectionClosed() {
        connected = false;
        for (int i = 1; i < slots.size(); i++) {
            slots.get(i).state = ChannelState.CLOSED;
            slots.get(i).directReplyTag = null;
        }
        lastUsed = 0;
        logger.debug("Connection closed, all channels marked closed");
    }

    private void send(AmqpFrame frame) {
        try {
            transport.writeFrame(frame);
        } catch (IOException e) {
            throw new AmqpTransportException("Failed to acknowledge close on channel " + frame.getChannel(), e);
        }
    }

    private ChannelSlot slotOf(int channel) {
        return channel >= 0 && channel < slots.size() ? slots.get(channel) : null;
    }

    private static class ChannelSlot {
        ChannelState state;
        String directReplyTag;

        ChannelSlot(ChannelState state) {
            this.state = state;
        }
    }
}
