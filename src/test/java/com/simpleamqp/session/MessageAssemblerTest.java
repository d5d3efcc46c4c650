package com.simpleamqp.session;

import com.simpleamqp.amqp.AmqpMethod;
import com.simpleamqp.amqp.ContentHeader;
import com.simpleamqp.exception.AmqpProtocolException;
import com.simpleamqp.model.Envelope;
import com.simpleamqp.model.Message;
import com.simpleamqp.transport.FrameTransport;
import com.simpleamqp.transport.ScriptedFrameTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Optional;

import static com.simpleamqp.transport.BrokerFrames.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("Message Assembler Tests")
class MessageAssemblerTest {

    private ScriptedFrameTransport transport;
    private FrameDemultiplexer demux;
    private MessageAssembler assembler;

    @BeforeEach
    void setUp() {
        transport = new ScriptedFrameTransport();
        ChannelPool pool = new ChannelPool(transport, channel -> { });
        demux = new FrameDemultiplexer(transport, pool);
        assembler = new MessageAssembler(demux);
        demux.setBufferListener(assembler);
    }

    @Test
    @DisplayName("Body fragments are concatenated byte for byte")
    void testReadContent() {
        transport.enqueue(header(1, 10), body(1, "abcdef"), body(1, "ghij"));

        Message message = assembler.readContent(1);

        assertThat(message.getBodyAsString()).isEqualTo("abcdefghij");
    }

    @Test
    @DisplayName("Header properties are carried into the message")
    void testReadContentProperties() {
        Message sent = new Message("{}");
        sent.setContentType("application/json");
        sent.setMessageId("m-1");
        transport.enqueue(ContentHeader.encode(1, sent), body(1, "{}"));

        Message message = assembler.readContent(1);

        assertThat(message).isEqualTo(sent);
    }

    @Test
    @DisplayName("A body frame where the header belongs is a protocol error")
    void testMissingHeader() {
        transport.enqueue(body(1, "abc"));

        assertThatThrownBy(() -> assembler.readContent(1))
            .isInstanceOf(AmqpProtocolException.class)
            .hasMessageContaining("content header");
    }

    @Test
    @DisplayName("A method frame inside the body is a protocol error")
    void testInterruptedBody() {
        transport.enqueue(header(1, 10), body(1, "abc"), deliver(1, "ctag", 2));

        assertThatThrownBy(() -> assembler.readContent(1))
            .isInstanceOf(AmqpProtocolException.class)
            .hasMessageContaining("content body");
    }

    @Test
    @DisplayName("More body bytes than declared is a protocol error")
    void testBodyOverrun() {
        transport.enqueue(header(1, 5), body(1, "abcdef"));

        assertThatThrownBy(() -> assembler.readContent(1))
            .isInstanceOf(AmqpProtocolException.class)
            .hasMessageContaining("overrun");
    }

    @Test
    @DisplayName("A complete buffered delivery becomes an envelope right away")
    void testEagerDelivery() {
        transport.enqueue(deliver(2, "ctag-b", 7), header(2, 10), body(2, "abcdef"), body(2, "ghij"), body(1, "a"));

        demux.getNextFrameOnChannel(1, FrameTransport.INFINITE);

        assertThat(assembler.getDeliveredCount()).isEqualTo(1);
        assertThat(demux.hasBufferedFramesOn(2)).isFalse();
        Optional<Envelope> envelope = assembler.pollDelivered("ctag-b");
        assertThat(envelope).isPresent();
        assertThat(envelope.get().getMessage().getBodyAsString()).isEqualTo("abcdefghij");
        assertThat(envelope.get().getChannel()).isEqualTo(2);
        assertThat(envelope.get().getDeliveryTag()).isEqualTo(7);
        assertThat(envelope.get().getExchange()).isEqualTo("amq.direct");
        assertThat(envelope.get().getRoutingKey()).isEqualTo("orders");
    }

    @Test
    @DisplayName("A delivery behind another buffered frame still becomes an envelope")
    void testDeliveryBehindOtherFrame() {
        transport.enqueue(ack(2, 1), deliver(2, "ctag-b", 7), header(2, 2), body(2, "hi"), body(1, "a"));

        demux.getNextFrameOnChannel(1, FrameTransport.INFINITE);

        assertThat(assembler.getDeliveredCount()).isEqualTo(1);
        assertThat(demux.getBufferedFrameCount()).isEqualTo(1);
        assertThat(demux.bufferedFramesOn(2)).singleElement()
            .satisfies(frame -> assertThat(frame.isMethod(AmqpMethod.BASIC_ACK)).isTrue());
        assertThat(assembler.pollDelivered("ctag-b")).hasValueSatisfying(
            envelope -> assertThat(envelope.getMessage().getBodyAsString()).isEqualTo("hi"));
    }

    @Test
    @DisplayName("Content is read for the delivery taken, not for an older buffered return")
    void testReadContentOfBufferedDelivery() {
        transport.enqueue(
            basicReturn(2, 312, "NO_ROUTE", "orders", "nowhere"), header(2, 3), body(2, "xyz"),
            deliver(2, "ctag-b", 1), header(2, 4), body(2, "ab"),
            body(1, "a"));
        demux.getNextFrameOnChannel(1, FrameTransport.INFINITE);
        assertThat(assembler.getDeliveredCount()).isZero();

        demux.getMethodOnChannel(2, EnumSet.of(AmqpMethod.BASIC_DELIVER), 0);
        transport.enqueue(body(2, "cd"));

        assertThat(assembler.readContent(2).getBodyAsString()).isEqualTo("abcd");
        assertThat(demux.getBufferedFrameCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("A short body never becomes an envelope")
    void testIncompleteDelivery() {
        transport.enqueue(deliver(2, "ctag-b", 7), header(2, 10), body(2, "abcdef"), body(2, "ghi"), body(1, "a"));

        demux.getNextFrameOnChannel(1, FrameTransport.INFINITE);

        assertThat(assembler.checkForQueuedMessageOnChannel(2)).isFalse();
        assertThat(assembler.getDeliveredCount()).isZero();
        assertThat(demux.getBufferedFrameCount()).isEqualTo(4);
    }

    @Test
    @DisplayName("An empty body needs only the header")
    void testEmptyBody() {
        transport.enqueue(deliver(2, "ctag-b", 1), header(2, 0), body(1, "a"));

        demux.getNextFrameOnChannel(1, FrameTransport.INFINITE);

        assertThat(assembler.pollDelivered("ctag-b")).hasValueSatisfying(
            envelope -> assertThat(envelope.getMessage().getBody()).isEmpty());
    }

    @Test
    @DisplayName("Envelopes are handed out per consumer in arrival order")
    void testPollPerConsumer() {
        transport.enqueue(
            deliver(2, "ctag-b", 1), header(2, 1), body(2, "1"),
            deliver(3, "ctag-c", 1), header(3, 1), body(3, "x"),
            deliver(2, "ctag-b", 2), header(2, 1), body(2, "2"),
            body(1, "a"));

        demux.getNextFrameOnChannel(1, FrameTransport.INFINITE);

        assertThat(assembler.pollDelivered("ctag-b").map(e -> e.getMessage().getBodyAsString())).contains("1");
        assertThat(assembler.pollDelivered("ctag-b").map(e -> e.getMessage().getBodyAsString())).contains("2");
        assertThat(assembler.pollDelivered("ctag-b")).isEmpty();
        assertThat(assembler.discardDelivered("ctag-c")).isEqualTo(1);
        assertThat(assembler.getDeliveredCount()).isZero();
    }
}
