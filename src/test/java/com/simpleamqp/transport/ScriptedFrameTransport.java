package com.simpleamqp.transport;

import com.simpleamqp.amqp.AmqpFrame;
import com.simpleamqp.amqp.AmqpMethod;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * In-memory transport for tests: hands out pre-scripted broker frames in order and
 * records everything written. Reading past the script without a timeout fails with an
 * IOException instead of blocking forever.
 */
public class ScriptedFrameTransport implements FrameTransport {
    private final Deque<AmqpFrame> inbound = new ArrayDeque<>();
    private final List<AmqpFrame> written = new ArrayList<>();
    private boolean protocolHeaderWritten;
    private boolean open = true;
    private int maxFrameSize;
    private IOException writeFailure;

    public ScriptedFrameTransport enqueue(AmqpFrame... frames) {
        for (AmqpFrame frame : frames) {
            inbound.add(frame);
        }
        return this;
    }

    public void failWrites(IOException failure) {
        this.writeFailure = failure;
    }

    @Override
    public void writeProtocolHeader() throws IOException {
        if (writeFailure != null) {
            throw writeFailure;
        }
        protocolHeaderWritten = true;
    }

    @Override
    public Optional<AmqpFrame> readFrame(long timeoutMillis) throws IOException {
        if (!inbound.isEmpty()) {
            return Optional.of(inbound.poll());
        }
        if (timeoutMillis < 0) {
            throw new IOException("Script exhausted");
        }
        return Optional.empty();
    }

    @Override
    public void writeFrame(AmqpFrame frame) throws IOException {
        if (writeFailure != null) {
            throw writeFailure;
        }
        written.add(frame);
    }

    @Override
    public void setMaxFrameSize(int frameMax) {
        this.maxFrameSize = frameMax;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        open = false;
    }

    public boolean isProtocolHeaderWritten() {
        return protocolHeaderWritten;
    }

    public int getMaxFrameSize() {
        return maxFrameSize;
    }

    public int getPendingFrameCount() {
        return inbound.size();
    }

    public List<AmqpFrame> getWrittenFrames() {
        return written;
    }

    public List<AmqpMethod> getWrittenMethods() {
        List<AmqpMethod> methods = new ArrayList<>();
        for (AmqpFrame frame : written) {
            if (frame.isMethod()) {
                methods.add(frame.getMethod());
            }
        }
        return methods;
    }

    public AmqpFrame lastWritten() {
        return written.get(written.size() - 1);
    }
}
