package com.simpleamqp.confirms;

import com.simpleamqp.exception.AmqpTransportException;
import com.simpleamqp.exception.ChannelClosedException;
import com.simpleamqp.exception.MessageRejectedException;
import com.simpleamqp.exception.MessageReturnedException;
import com.simpleamqp.session.ChannelPool;
import com.simpleamqp.session.ChannelState;
import com.simpleamqp.session.FrameDemultiplexer;
import com.simpleamqp.session.MessageAssembler;
import com.simpleamqp.transport.ScriptedFrameTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.simpleamqp.transport.BrokerFrames.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("Publisher Confirms Tests")
class PublisherConfirmsTest {

    private ScriptedFrameTransport transport;
    private ChannelPool pool;
    private MessageAssembler assembler;
    private PublisherConfirms confirms;
    private int channel;

    @BeforeEach
    void setUp() {
        transport = new ScriptedFrameTransport();
        pool = new ChannelPool(transport, id -> { });
        FrameDemultiplexer demux = new FrameDemultiplexer(transport, pool);
        assembler = new MessageAssembler(demux);
        demux.setBufferListener(assembler);
        confirms = new PublisherConfirms(demux, assembler, pool);
        channel = pool.getChannel();
        confirms.reset(channel);
    }

    @Test
    void testAckReturnsChannel() {
        transport.enqueue(ack(channel, 1));

        confirms.getAckOnChannel(channel);

        assertThat(confirms.getLastDeliveryTag(channel)).isEqualTo(1);
        assertThat(confirms.getUnconsumedAck(channel)).isZero();
        assertThat(pool.stateOf(channel)).isEqualTo(ChannelState.OPEN);
    }

    @Test
    void testAckGapCoversLaterPublishes() {
        transport.enqueue(ack(channel, 5));

        confirms.getAckOnChannel(channel);
        assertThat(confirms.getUnconsumedAck(channel)).isEqualTo(4);

        for (int remaining = 3; remaining >= 0; remaining--) {
            confirms.getAckOnChannel(channel);
            assertThat(confirms.getUnconsumedAck(channel)).isEqualTo(remaining);
        }
        assertThat(transport.getPendingFrameCount()).isZero();

        // Nothing left to spend, so the next call has to read
        assertThatThrownBy(() -> confirms.getAckOnChannel(channel)).isInstanceOf(AmqpTransportException.class);
    }

    @Test
    void testNackRejectsAndReturnsChannel() {
        transport.enqueue(nack(channel, 7, false));

        assertThatThrownBy(() -> confirms.getAckOnChannel(channel))
            .isInstanceOfSatisfying(MessageRejectedException.class,
                e -> assertThat(e.getDeliveryTag()).isEqualTo(7));
        assertThat(pool.stateOf(channel)).isEqualTo(ChannelState.OPEN);
        assertThat(confirms.getLastDeliveryTag(channel)).isEqualTo(7);
    }

    @Test
    void testMultipleNackRaisesOnce() {
        transport.enqueue(nack(channel, 3, true), ack(channel, 4));

        assertThatThrownBy(() -> confirms.getAckOnChannel(channel))
            .isInstanceOfSatisfying(MessageRejectedException.class,
                e -> assertThat(e.getDeliveryTag()).isEqualTo(3));
        confirms.getAckOnChannel(channel);
        assertThat(confirms.getLastDeliveryTag(channel)).isEqualTo(4);
    }

    @Test
    void testReturnedMessage() {
        transport.enqueue(
            basicReturn(channel, 312, "NO_ROUTE", "orders", "eu.created"),
            header(channel, 5), body(channel, "hello"),
            ack(channel, 1));

        assertThatThrownBy(() -> confirms.getAckOnChannel(channel))
            .isInstanceOfSatisfying(MessageReturnedException.class, e -> {
                assertThat(e.getReplyCode()).isEqualTo(312);
                assertThat(e.getReplyText()).isEqualTo("NO_ROUTE");
                assertThat(e.getExchange()).isEqualTo("orders");
                assertThat(e.getRoutingKey()).isEqualTo("eu.created");
                assertThat(e.getReturnedMessage().getBodyAsString()).isEqualTo("hello");
            });
        assertThat(transport.getPendingFrameCount()).isZero();
        assertThat(confirms.getLastDeliveryTag(channel)).isEqualTo(1);
        assertThat(pool.stateOf(channel)).isEqualTo(ChannelState.OPEN);
    }

    @Test
    void testStaleAckIsCountedNotRaised() {
        transport.enqueue(ack(channel, 3), ack(channel, 2));
        confirms.getAckOnChannel(channel);
        // spend the two covered publishes
        confirms.getAckOnChannel(channel);
        confirms.getAckOnChannel(channel);

        assertThatCode(() -> confirms.getAckOnChannel(channel)).doesNotThrowAnyException();
        assertThat(confirms.getStaleAckCount()).isEqualTo(1);
        assertThat(confirms.getLastDeliveryTag(channel)).isEqualTo(3);
    }

    @Test
    void testChannelCloseWhileWaiting() {
        transport.enqueue(channelClose(channel, 404, "NOT_FOUND - no exchange 'missing'"));

        assertThatThrownBy(() -> confirms.getAckOnChannel(channel)).isInstanceOf(ChannelClosedException.class);
        assertThat(pool.stateOf(channel)).isEqualTo(ChannelState.CLOSED);
    }

    @Test
    void testDeliveryWhileWaitingIsKept() {
        transport.enqueue(deliver(channel, "ctag-1", 1), header(channel, 2), body(channel, "hi"), ack(channel, 1));

        confirms.getAckOnChannel(channel);

        assertThat(assembler.pollDelivered("ctag-1")).isPresent();
    }

    @Test
    void testResetStartsOver() {
        transport.enqueue(ack(channel, 4));
        confirms.getAckOnChannel(channel);

        confirms.reset(channel);

        assertThat(confirms.getLastDeliveryTag(channel)).isZero();
        assertThat(confirms.getUnconsumedAck(channel)).isZero();
    }
}
