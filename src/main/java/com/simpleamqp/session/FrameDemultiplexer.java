package com.simpleamqp.session;

import com.simpleamqp.amqp.AmqpFrame;
import com.simpleamqp.amqp.AmqpMethod;
import com.simpleamqp.amqp.MethodArgs;
import com.simpleamqp.exception.AmqpProtocolException;
import com.simpleamqp.exception.AmqpTransportException;
import com.simpleamqp.exception.ChannelClosedException;
import com.simpleamqp.exception.ConnectionClosedException;
import com.simpleamqp.transport.FrameTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Routes the single inbound frame stream to per-channel readers.
 *
 * <p>Frames read while waiting on one channel that belong to another are kept in an
 * ordered buffer and handed out later, oldest first. Every time a frame is buffered the
 * registered {@link BufferListener} is told about it. Close notifications are intercepted
 * wherever they are found, live or in the buffer: the channel table is updated and the
 * close-ok sent before the matching exception reaches the caller.
 *
 * <p>When a delivery or return is taken out of the buffer, the content frames buffered
 * behind it are set aside for that channel, so {@link #getNextContentFrameOnChannel} hands
 * them out ahead of anything read later.
 *
 * <p>Frames handed to callers stay valid until {@link #maybeReleaseBuffersOnChannel(int)}
 * releases them; callers never release frames they got from here.
 */
public class FrameDemultiplexer {
    private static final Logger logger = LoggerFactory.getLogger(FrameDemultiplexer.class);

    /**
     * Invoked after a frame has been appended to the buffer.
     */
    @FunctionalInterface
    public interface BufferListener {
        void onFrameBuffered(AmqpFrame frame);
    }

    private final FrameTransport transport;
    private final ChannelPool pool;
    private final LinkedList<AmqpFrame> frameQueue = new LinkedList<>();
    private final Map<Integer, List<AmqpFrame>> consumedFrames = new HashMap<>();
    private final Map<Integer, Deque<AmqpFrame>> pendingContent = new HashMap<>();
    private BufferListener bufferListener;

    public FrameDemultiplexer(FrameTransport transport, ChannelPool pool) {
        this.transport = transport;
        this.pool = pool;
    }

    public void setBufferListener(BufferListener bufferListener) {
        this.bufferListener = bufferListener;
    }

    /**
     * Next frame for {@code channel}: the oldest buffered one, otherwise the next one
     * read for it from the transport. Frames for other channels read meanwhile are buffered.
     *
     * @param timeoutMillis how long to wait, or {@link FrameTransport#INFINITE}
     * @return the frame, or empty if the timeout elapsed
     * @throws ChannelClosedException if the broker closed this channel
     * @throws ConnectionClosedException if the broker closed the connection
     */
    public Optional<AmqpFrame> getNextFrameOnChannel(int channel, long timeoutMillis) {
        Optional<AmqpFrame> pending = takePendingContent(channel);
        if (pending.isPresent()) {
            return pending;
        }
        Iterator<AmqpFrame> it = frameQueue.iterator();
        while (it.hasNext()) {
            AmqpFrame frame = it.next();
            if (frame.isOnChannel(channel)) {
                it.remove();
                interceptClose(channel, frame);
                return Optional.of(consume(frame));
            }
        }
        return readLiveOnChannel(channel, timeoutMillis);
    }

    /**
     * Next content frame for the method last handed out on {@code channel}. Content set aside
     * when that method came out of the buffer is returned first; otherwise the frame is read
     * live, since anything already buffered for the channel belongs to a later method.
     */
    public Optional<AmqpFrame> getNextContentFrameOnChannel(int channel, long timeoutMillis) {
        Optional<AmqpFrame> pending = takePendingContent(channel);
        if (pending.isPresent()) {
            return pending;
        }
        return readLiveOnChannel(channel, timeoutMillis);
    }

    private Optional<AmqpFrame> takePendingContent(int channel) {
        Deque<AmqpFrame> content = pendingContent.get(channel);
        if (content == null || content.isEmpty()) {
            return Optional.empty();
        }
        AmqpFrame frame = content.poll();
        if (content.isEmpty()) {
            pendingContent.remove(channel);
        }
        return Optional.of(consume(frame));
    }

    private Optional<AmqpFrame> readLiveOnChannel(int channel, long timeoutMillis) {
        long deadline = deadlineFor(timeoutMillis);
        while (true) {
            Optional<AmqpFrame> read = readLive(channel, deadline);
            if (!read.isPresent()) {
                return Optional.empty();
            }
            AmqpFrame frame = read.get();
            if (frame.isOnChannel(channel) || frame.isMethod(AmqpMethod.CONNECTION_CLOSE)) {
                interceptClose(channel, frame);
            }
            if (frame.isOnChannel(channel)) {
                return Optional.of(consume(frame));
            }
            buffer(frame);
        }
    }

    /**
     * Wait for one of {@code expected} on {@code channel}. The buffer is searched first.
     * While reading live, frames the broker may push on the channel at any time (deliveries,
     * broker cancels, confirms, returns and their content) are buffered for later; any other
     * method on the channel is a protocol error.
     *
     * @return the matching method frame, or empty if the timeout elapsed
     * @throws AmqpProtocolException on an unexpected method for the channel
     */
    public Optional<AmqpFrame> getMethodOnChannel(int channel, Set<AmqpMethod> expected, long timeoutMillis) {
        return awaitMethod(channel, expected, timeoutMillis, true);
    }

    /**
     * Wait for the reply to a synchronous request on {@code channel}. Like
     * {@link #getMethodOnChannel}, except that a confirm or return arriving on the channel
     * instead of the reply is a protocol error.
     */
    public Optional<AmqpFrame> getRpcReplyOnChannel(int channel, Set<AmqpMethod> expected, long timeoutMillis) {
        return awaitMethod(channel, expected, timeoutMillis, false);
    }

    private Optional<AmqpFrame> awaitMethod(int channel, Set<AmqpMethod> expected, long timeoutMillis,
                                            boolean deferConfirms) {
        Iterator<AmqpFrame> it = frameQueue.iterator();
        while (it.hasNext()) {
            AmqpFrame frame = it.next();
            if (!frame.isOnChannel(channel) || !frame.isMethod()) {
                continue;
            }
            if (channel != 0 && frame.isMethod(AmqpMethod.CHANNEL_CLOSE)) {
                it.remove();
                interceptClose(channel, frame);
            }
            if (isExpected(frame, expected)) {
                it.remove();
                if (carriesContent(frame)) {
                    setAsideContent(channel, it);
                }
                return Optional.of(consume(frame));
            }
        }

        long deadline = deadlineFor(timeoutMillis);
        while (true) {
            Optional<AmqpFrame> read = readLive(channel, deadline);
            if (!read.isPresent()) {
                return Optional.empty();
            }
            AmqpFrame frame = read.get();
            if (frame.isOnChannel(channel) || frame.isMethod(AmqpMethod.CONNECTION_CLOSE)) {
                interceptClose(channel, frame);
            }
            if (!frame.isOnChannel(channel)) {
                buffer(frame);
            } else if (isExpected(frame, expected)) {
                return Optional.of(consume(frame));
            } else if (isAsynchronous(frame, deferConfirms)) {
                buffer(frame);
            } else {
                String description = frame.toString();
                frame.release();
                throw new AmqpProtocolException("Unexpected frame on channel " + channel
                        + " while waiting for " + expected + ": " + description);
            }
        }
    }

    // Content frames on the channel directly behind a method just taken from the buffer
    private void setAsideContent(int channel, Iterator<AmqpFrame> it) {
        Deque<AmqpFrame> content = null;
        while (it.hasNext()) {
            AmqpFrame frame = it.next();
            if (!frame.isOnChannel(channel)) {
                continue;
            }
            if (frame.getType() != AmqpFrame.FrameType.HEADER && frame.getType() != AmqpFrame.FrameType.BODY) {
                break;
            }
            it.remove();
            if (content == null) {
                content = pendingContent.computeIfAbsent(channel, k -> new ArrayDeque<>());
            }
            content.add(frame);
        }
    }

    private static boolean carriesContent(AmqpFrame frame) {
        return frame.isMethod(AmqpMethod.BASIC_DELIVER) || frame.isMethod(AmqpMethod.BASIC_RETURN);
    }

    /**
     * Classify a reply outcome. Normal replies are returned; a transport failure becomes an
     * {@link AmqpTransportException}; a broker close is finalized in the channel table, then raised.
     */
    public AmqpFrame checkRpcReply(int channel, RpcReply reply) {
        switch (reply.getKind()) {
            case NORMAL:
                return reply.getFrame();
            case LIBRARY_EXCEPTION:
                throw new AmqpTransportException("Transport failure on channel " + channel, reply.getCause());
            case SERVER_EXCEPTION:
                throw finishClose(reply.getFrame());
            default:
                throw new IllegalStateException("Unknown reply kind: " + reply.getKind());
        }
    }

    private RuntimeException finishClose(AmqpFrame frame) {
        boolean connectionClose = frame.isMethod(AmqpMethod.CONNECTION_CLOSE);
        int closed = frame.getChannel();
        MethodArgs.Close close;
        try {
            close = MethodArgs.decodeClose(frame);
        } finally {
            frame.release();
        }
        if (connectionClose) {
            logger.warn("Connection closed by broker: {} {}", close.getReplyCode(), close.getReplyText());
            discardBuffered();
            pool.finishCloseConnection();
            return new ConnectionClosedException(close.getReplyCode(), close.getReplyText(),
                    close.getClassId(), close.getMethodId());
        }
        logger.warn("Channel {} closed by broker: {} {}", closed, close.getReplyCode(), close.getReplyText());
        discardBuffered(closed);
        pool.finishCloseChannel(closed);
        return new ChannelClosedException(closed, close.getReplyCode(), close.getReplyText(),
                close.getClassId(), close.getMethodId());
    }

    private void interceptClose(int channel, AmqpFrame frame) {
        if (frame.isMethod(AmqpMethod.CONNECTION_CLOSE)
                || (frame.getChannel() != 0 && frame.isMethod(AmqpMethod.CHANNEL_CLOSE))) {
            checkRpcReply(channel, RpcReply.serverException(frame));
        }
    }

    private static boolean isExpected(AmqpFrame frame, Set<AmqpMethod> expected) {
        for (AmqpMethod method : expected) {
            if (frame.isMethod(method)) {
                return true;
            }
        }
        return false;
    }

    // Frames the broker may push on a channel at any time
    private static boolean isAsynchronous(AmqpFrame frame, boolean deferConfirms) {
        switch (frame.getType()) {
            case HEADER:
            case BODY:
                return true;
            case METHOD:
                if (frame.isMethod(AmqpMethod.BASIC_DELIVER) || frame.isMethod(AmqpMethod.BASIC_CANCEL)) {
                    return true;
                }
                return deferConfirms && (frame.isMethod(AmqpMethod.BASIC_ACK)
                        || frame.isMethod(AmqpMethod.BASIC_NACK)
                        || frame.isMethod(AmqpMethod.BASIC_RETURN));
            case HEARTBEAT:
            default:
                return false;
        }
    }

    private Optional<AmqpFrame> readLive(int channel, long deadline) {
        while (true) {
            long timeout = deadline < 0
                    ? FrameTransport.INFINITE
                    : Math.max(0, TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime()));
            Optional<AmqpFrame> read;
            try {
                read = transport.readFrame(timeout);
            } catch (IOException e) {
                checkRpcReply(channel, RpcReply.libraryException(e));
                return Optional.empty();
            }
            if (read.isPresent() && read.get().getType() == AmqpFrame.FrameType.HEARTBEAT) {
                logger.trace("Heartbeat received");
                read.get().release();
                continue;
            }
            if (read.isPresent()) {
                logger.debug("Frame received: {}", read.get());
            }
            return read;
        }
    }

    private static long deadlineFor(long timeoutMillis) {
        return timeoutMillis < 0 ? -1 : System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
    }

    private void buffer(AmqpFrame frame) {
        frameQueue.add(frame);
        if (bufferListener != null) {
            bufferListener.onFrameBuffered(frame);
        }
    }

    private AmqpFrame consume(AmqpFrame frame) {
        consumedFrames.computeIfAbsent(frame.getChannel(), k -> new ArrayList<>()).add(frame);
        return frame;
    }

    /**
     * Buffered frames for {@code channel}, oldest first. The returned list is a copy.
     */
    List<AmqpFrame> bufferedFramesOn(int channel) {
        List<AmqpFrame> frames = new ArrayList<>();
        for (AmqpFrame frame : frameQueue) {
            if (frame.isOnChannel(channel)) {
                frames.add(frame);
            }
        }
        return frames;
    }

    /**
     * Remove exactly {@code frames} from the buffer and hand them out, as one complete
     * message found by scanning {@link #bufferedFramesOn(int)}.
     */
    void takeBuffered(List<AmqpFrame> frames) {
        for (AmqpFrame frame : frames) {
            Iterator<AmqpFrame> it = frameQueue.iterator();
            while (it.hasNext()) {
                if (it.next() == frame) {
                    it.remove();
                    consume(frame);
                    break;
                }
            }
        }
    }

    public boolean hasBufferedFramesOn(int channel) {
        if (pendingContent.containsKey(channel)) {
            return true;
        }
        for (AmqpFrame frame : frameQueue) {
            if (frame.isOnChannel(channel)) {
                return true;
            }
        }
        return false;
    }

    public int getBufferedFrameCount() {
        return frameQueue.size();
    }

    /**
     * Release the frames already handed out on {@code channel}, unless frames for it are
     * still waiting in the buffer.
     */
    public void maybeReleaseBuffersOnChannel(int channel) {
        if (hasBufferedFramesOn(channel)) {
            return;
        }
        List<AmqpFrame> consumed = consumedFrames.remove(channel);
        if (consumed != null) {
            for (AmqpFrame frame : consumed) {
                frame.release();
            }
        }
    }

    /**
     * Drop and release the buffered frames of a channel that is gone.
     */
    public void discardBuffered(int channel) {
        Deque<AmqpFrame> content = pendingContent.remove(channel);
        if (content != null) {
            for (AmqpFrame frame : content) {
                frame.release();
            }
        }
        Iterator<AmqpFrame> it = frameQueue.iterator();
        while (it.hasNext()) {
            AmqpFrame frame = it.next();
            if (frame.isOnChannel(channel)) {
                it.remove();
                frame.release();
            }
        }
    }

    /**
     * Drop and release every buffered frame.
     */
    public void discardBuffered() {
        for (AmqpFrame frame : frameQueue) {
            frame.release();
        }
        frameQueue.clear();
        for (Deque<AmqpFrame> content : pendingContent.values()) {
            for (AmqpFrame frame : content) {
                frame.release();
            }
        }
        pendingContent.clear();
    }

    /**
     * Drop and release everything, buffered or handed out.
     */
    public void releaseAll() {
        discardBuffered();
        for (List<AmqpFrame> consumed : consumedFrames.values()) {
            for (AmqpFrame frame : consumed) {
                frame.release();
            }
        }
        consumedFrames.clear();
    }
}
