package com.simpleamqp.session;

import com.simpleamqp.amqp.AmqpFrame;
import com.simpleamqp.amqp.AmqpMethod;
import com.simpleamqp.exception.AmqpProtocolException;
import com.simpleamqp.exception.AmqpTransportException;
import com.simpleamqp.exception.ChannelClosedException;
import com.simpleamqp.exception.ConnectionClosedException;
import com.simpleamqp.transport.FrameTransport;
import com.simpleamqp.transport.ScriptedFrameTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

import static com.simpleamqp.transport.BrokerFrames.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("Frame Demultiplexer Tests")
class FrameDemultiplexerTest {

    private static final int A = 1;
    private static final int B = 2;

    private ScriptedFrameTransport transport;
    private ChannelPool pool;
    private FrameDemultiplexer demux;
    private List<AmqpFrame> bufferedEvents;

    @BeforeEach
    void setUp() {
        transport = new ScriptedFrameTransport();
        pool = new ChannelPool(transport, channel -> { });
        pool.setConnected(true);
        pool.getChannel();
        pool.getChannel();
        demux = new FrameDemultiplexer(transport, pool);
        bufferedEvents = new ArrayList<>();
        demux.setBufferListener(bufferedEvents::add);
    }

    @Nested
    @DisplayName("Routing")
    class RoutingTests {

        @Test
        @DisplayName("An RPC on one channel is not disturbed by frames for another")
        void testInterleavedChannels() {
            AmqpFrame bMethod = deliver(B, "ctag-b", 1);
            AmqpFrame aReply = consumeOk(A, "ctag-a");
            AmqpFrame bHeader = header(B, 5);
            AmqpFrame bBody = body(B, "hello");
            transport.enqueue(bMethod, aReply, bHeader, bBody);

            Optional<AmqpFrame> reply = demux.getMethodOnChannel(A, EnumSet.of(AmqpMethod.BASIC_CONSUME_OK),
                    FrameTransport.INFINITE);

            assertThat(reply).containsSame(aReply);
            assertThat(demux.getNextFrameOnChannel(B, FrameTransport.INFINITE)).containsSame(bMethod);
            assertThat(demux.getNextFrameOnChannel(B, FrameTransport.INFINITE)).containsSame(bHeader);
            assertThat(demux.getNextFrameOnChannel(B, FrameTransport.INFINITE)).containsSame(bBody);
        }

        @Test
        @DisplayName("Buffered frames are replayed in arrival order")
        void testBufferOrder() {
            AmqpFrame first = body(B, "1");
            AmqpFrame second = body(B, "2");
            AmqpFrame target = body(A, "a");
            transport.enqueue(first, second, target);

            assertThat(demux.getNextFrameOnChannel(A, FrameTransport.INFINITE)).containsSame(target);
            assertThat(demux.getBufferedFrameCount()).isEqualTo(2);
            assertThat(bufferedEvents).containsExactly(first, second);
            assertThat(demux.getNextFrameOnChannel(B, 0)).containsSame(first);
            assertThat(demux.getNextFrameOnChannel(B, 0)).containsSame(second);
            assertThat(demux.hasBufferedFramesOn(B)).isFalse();
        }

        @Test
        @DisplayName("A timeout returns nothing and keeps frames for other channels")
        void testTimeout() {
            transport.enqueue(body(B, "x"));

            Optional<AmqpFrame> frame = demux.getNextFrameOnChannel(A, 0);

            assertThat(frame).isEmpty();
            assertThat(demux.hasBufferedFramesOn(B)).isTrue();
            assertThat(pool.stateOf(A)).isEqualTo(ChannelState.USED);
        }

        @Test
        @DisplayName("Heartbeats are absorbed")
        void testHeartbeatSkipped() {
            AmqpFrame target = body(A, "a");
            transport.enqueue(AmqpFrame.heartbeat(), target);

            assertThat(demux.getNextFrameOnChannel(A, FrameTransport.INFINITE)).containsSame(target);
            assertThat(demux.getBufferedFrameCount()).isZero();
        }

        @Test
        @DisplayName("Deliveries on the channel during an RPC are kept for later")
        void testAsyncFramesOnSameChannel() {
            AmqpFrame delivery = deliver(A, "ctag-a", 1);
            AmqpFrame content = header(A, 0);
            AmqpFrame reply = cancelOk(A, "ctag-a");
            transport.enqueue(delivery, content, reply);

            assertThat(demux.getMethodOnChannel(A, EnumSet.of(AmqpMethod.BASIC_CANCEL_OK), FrameTransport.INFINITE))
                .containsSame(reply);
            assertThat(bufferedEvents).containsExactly(delivery, content);
        }

        @Test
        @DisplayName("The buffer is searched before the transport")
        void testExpectedMethodFromBuffer() {
            AmqpFrame reply = consumeOk(B, "ctag-b");
            transport.enqueue(reply, body(A, "a"));
            demux.getNextFrameOnChannel(A, FrameTransport.INFINITE);

            assertThat(demux.getMethodOnChannel(B, EnumSet.of(AmqpMethod.BASIC_CONSUME_OK), 0)).containsSame(reply);
        }

        @Test
        @DisplayName("Confirms arriving while waiting for a delivery are kept for the confirm wait")
        void testConfirmsDeferredOutsideRpc() {
            AmqpFrame confirm = ack(A, 1);
            AmqpFrame brokerCancel = cancel(A, "ctag-a");
            transport.enqueue(confirm, brokerCancel);

            assertThat(demux.getMethodOnChannel(A, EnumSet.of(AmqpMethod.BASIC_DELIVER, AmqpMethod.BASIC_CANCEL),
                    FrameTransport.INFINITE)).containsSame(brokerCancel);
            assertThat(bufferedEvents).containsExactly(confirm);
            assertThat(demux.getMethodOnChannel(A, EnumSet.of(AmqpMethod.BASIC_ACK), 0)).containsSame(confirm);
        }

        @Test
        @DisplayName("A confirm in place of an RPC reply is a protocol error")
        void testConfirmDuringRpc() {
            transport.enqueue(ack(A, 1));

            assertThatThrownBy(() -> demux.getRpcReplyOnChannel(A, EnumSet.of(AmqpMethod.BASIC_CANCEL_OK),
                    FrameTransport.INFINITE))
                .isInstanceOf(AmqpProtocolException.class)
                .hasMessageContaining("Unexpected frame on channel 1");
        }

        @Test
        @DisplayName("Content buffered behind a returned message stays with it")
        void testContentSetAsideWithMethod() {
            AmqpFrame returned = basicReturn(A, 312, "NO_ROUTE", "orders", "nowhere");
            AmqpFrame returnedHeader = header(A, 2);
            AmqpFrame returnedBody = body(A, "hi");
            transport.enqueue(returned, returnedHeader, returnedBody, ack(A, 1), body(B, "b"));
            demux.getNextFrameOnChannel(B, FrameTransport.INFINITE);

            assertThat(demux.getMethodOnChannel(A, EnumSet.of(AmqpMethod.BASIC_RETURN), 0)).containsSame(returned);
            assertThat(demux.getNextContentFrameOnChannel(A, 0)).containsSame(returnedHeader);
            assertThat(demux.getNextContentFrameOnChannel(A, 0)).containsSame(returnedBody);
            assertThat(demux.getNextContentFrameOnChannel(A, 0)).isEmpty();
            assertThat(demux.getBufferedFrameCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Any other method on the channel is a protocol error")
        void testUnexpectedMethod() {
            transport.enqueue(channelOpenOk(A));

            assertThatThrownBy(() -> demux.getMethodOnChannel(A, EnumSet.of(AmqpMethod.BASIC_CONSUME_OK),
                    FrameTransport.INFINITE))
                .isInstanceOf(AmqpProtocolException.class)
                .hasMessageContaining("Unexpected frame on channel 1");
        }
    }

    @Nested
    @DisplayName("Close interception")
    class CloseTests {

        @Test
        @DisplayName("A live channel close finalizes the channel before raising")
        void testLiveChannelClose() {
            transport.enqueue(channelClose(A, 404, "NOT_FOUND - no queue 'q'"));

            assertThatThrownBy(() -> demux.getMethodOnChannel(A, EnumSet.of(AmqpMethod.BASIC_CONSUME_OK),
                    FrameTransport.INFINITE))
                .isInstanceOfSatisfying(ChannelClosedException.class, e -> {
                    assertThat(e.getChannel()).isEqualTo(A);
                    assertThat(e.getReplyCode()).isEqualTo(404);
                    assertThat(e.isHardError()).isFalse();
                });
            assertThat(pool.stateOf(A)).isEqualTo(ChannelState.CLOSED);
            assertThat(transport.lastWritten().isMethodOnChannel(AmqpMethod.CHANNEL_CLOSE_OK, A)).isTrue();
        }

        @Test
        @DisplayName("A buffered channel close is raised when its channel is read")
        void testBufferedChannelClose() {
            AmqpFrame reply = consumeOk(A, "ctag-a");
            transport.enqueue(channelClose(B, 406, "PRECONDITION_FAILED"), reply);

            assertThat(demux.getMethodOnChannel(A, EnumSet.of(AmqpMethod.BASIC_CONSUME_OK), FrameTransport.INFINITE))
                .containsSame(reply);
            assertThat(pool.isChannelOpen(B)).isTrue();

            assertThatThrownBy(() -> demux.getNextFrameOnChannel(B, FrameTransport.INFINITE))
                .isInstanceOf(ChannelClosedException.class);
            assertThat(pool.isChannelOpen(B)).isFalse();
        }

        @Test
        @DisplayName("A buffered channel close is found by a method wait on that channel")
        void testBufferedChannelCloseDuringMethodWait() {
            transport.enqueue(channelClose(B, 406, "PRECONDITION_FAILED"), body(A, "a"));
            demux.getNextFrameOnChannel(A, FrameTransport.INFINITE);

            assertThatThrownBy(() -> demux.getMethodOnChannel(B, EnumSet.of(AmqpMethod.BASIC_ACK), 0))
                .isInstanceOf(ChannelClosedException.class);
        }

        @Test
        @DisplayName("A connection close is intercepted whatever channel is being read")
        void testConnectionClose() {
            transport.enqueue(connectionClose(320, "CONNECTION_FORCED - shutdown"));

            assertThatThrownBy(() -> demux.getNextFrameOnChannel(A, FrameTransport.INFINITE))
                .isInstanceOfSatisfying(ConnectionClosedException.class, e -> {
                    assertThat(e.getReplyCode()).isEqualTo(320);
                    assertThat(e.isHardError()).isTrue();
                });
            assertThat(pool.isConnected()).isFalse();
            assertThat(pool.isChannelOpen(A)).isFalse();
            assertThat(transport.lastWritten().isMethodOnChannel(AmqpMethod.CONNECTION_CLOSE_OK, 0)).isTrue();
        }

        @Test
        @DisplayName("A transport failure is raised as such")
        void testTransportFailure() {
            assertThatThrownBy(() -> demux.getNextFrameOnChannel(A, FrameTransport.INFINITE))
                .isInstanceOf(AmqpTransportException.class)
                .hasCauseInstanceOf(IOException.class);
        }
    }

    @Nested
    @DisplayName("Buffer release")
    class ReleaseTests {

        @Test
        @DisplayName("Frames handed out are released once nothing is buffered for the channel")
        void testMaybeRelease() {
            AmqpFrame first = body(B, "1");
            AmqpFrame second = body(B, "2");
            transport.enqueue(first, second, body(A, "a"));
            demux.getNextFrameOnChannel(A, FrameTransport.INFINITE);
            demux.getNextFrameOnChannel(B, 0);

            demux.maybeReleaseBuffersOnChannel(B);
            assertThat(first.refCnt()).isEqualTo(1);

            demux.getNextFrameOnChannel(B, 0);
            demux.maybeReleaseBuffersOnChannel(B);
            assertThat(first.refCnt()).isZero();
            assertThat(second.refCnt()).isZero();
        }

        @Test
        @DisplayName("Discarding a channel drops its buffered frames")
        void testDiscard() {
            AmqpFrame stale = body(B, "stale");
            transport.enqueue(stale, body(A, "a"));
            demux.getNextFrameOnChannel(A, FrameTransport.INFINITE);

            demux.discardBuffered(B);

            assertThat(demux.hasBufferedFramesOn(B)).isFalse();
            assertThat(stale.refCnt()).isZero();
        }
    }
}
