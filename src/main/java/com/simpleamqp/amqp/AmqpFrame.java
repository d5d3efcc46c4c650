package com.simpleamqp.amqp;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufHolder;
import io.netty.buffer.Unpooled;

/**
 * One AMQP 0-9-1 frame as read from or written to the wire.
 * The payload is reference counted through {@link ByteBufHolder}; readers never move
 * its reader index, so a frame can be inspected any number of times before release.
 */
public class AmqpFrame implements ByteBufHolder {
    public static final int FRAME_HEADER_SIZE = 7;
    public static final int FRAME_END_SIZE = 1;
    public static final byte FRAME_END = (byte) 0xCE;

    private final FrameType type;
    private final int channel;
    private final ByteBuf payload;

    public AmqpFrame(FrameType type, int channel, ByteBuf payload) {
        if (channel < 0 || channel > AmqpConstants.MAX_CHANNEL_ID) {
            throw new IllegalArgumentException("Invalid channel id: " + channel);
        }
        this.type = type;
        this.channel = channel;
        this.payload = payload;
    }

    /**
     * Build a method frame. The argument buffer is copied and released.
     */
    public static AmqpFrame method(int channel, AmqpMethod method, ByteBuf args) {
        ByteBuf payload = Unpooled.buffer(4 + (args != null ? args.readableBytes() : 0));
        payload.writeShort(method.getClassId());
        payload.writeShort(method.getMethodId());
        if (args != null) {
            payload.writeBytes(args);
            args.release();
        }
        return new AmqpFrame(FrameType.METHOD, channel, payload);
    }

    public static AmqpFrame body(int channel, ByteBuf fragment) {
        return new AmqpFrame(FrameType.BODY, channel, fragment);
    }

    public static AmqpFrame heartbeat() {
        return new AmqpFrame(FrameType.HEARTBEAT, 0, Unpooled.EMPTY_BUFFER);
    }

    public FrameType getType() {
        return type;
    }

    public int getChannel() {
        return channel;
    }

    public int getSize() {
        return payload.readableBytes();
    }

    public ByteBuf getPayload() {
        return payload;
    }

    public boolean isOnChannel(int channelId) {
        return channel == channelId;
    }

    public boolean isMethod() {
        return type == FrameType.METHOD && payload.readableBytes() >= 4;
    }

    public boolean isMethod(AmqpMethod method) {
        return isMethod() && getClassId() == method.getClassId() && getMethodId() == method.getMethodId();
    }

    public boolean isMethodOnChannel(AmqpMethod method, int channelId) {
        return isOnChannel(channelId) && isMethod(method);
    }

    public short getClassId() {
        return payload.getShort(payload.readerIndex());
    }

    public short getMethodId() {
        return payload.getShort(payload.readerIndex() + 2);
    }

    /**
     * Resolve the method carried by this frame.
     *
     * @throws IllegalStateException if this is not a method frame
     * @throws com.simpleamqp.exception.AmqpProtocolException if the ids are not known
     */
    public AmqpMethod getMethod() {
        if (!isMethod()) {
            throw new IllegalStateException("Not a method frame: " + this);
        }
        return AmqpMethod.fromIds(getClassId(), getMethodId());
    }

    /**
     * A view of the method arguments, positioned after the class and method ids.
     */
    public ByteBuf methodArguments() {
        ByteBuf args = payload.duplicate();
        args.skipBytes(4);
        return args;
    }

    // ByteBufHolder implementation for proper lifecycle management
    @Override
    public ByteBuf content() {
        return payload;
    }

    @Override
    public AmqpFrame copy() {
        return new AmqpFrame(type, channel, payload.copy());
    }

    @Override
    public AmqpFrame duplicate() {
        return new AmqpFrame(type, channel, payload.duplicate());
    }

    @Override
    public AmqpFrame retainedDuplicate() {
        return new AmqpFrame(type, channel, payload.retainedDuplicate());
    }

    @Override
    public AmqpFrame replace(ByteBuf content) {
        return new AmqpFrame(type, channel, content);
    }

    @Override
    public AmqpFrame retain() {
        payload.retain();
        return this;
    }

    @Override
    public AmqpFrame retain(int increment) {
        payload.retain(increment);
        return this;
    }

    @Override
    public AmqpFrame touch() {
        payload.touch();
        return this;
    }

    @Override
    public AmqpFrame touch(Object hint) {
        payload.touch(hint);
        return this;
    }

    @Override
    public int refCnt() {
        return payload.refCnt();
    }

    @Override
    public boolean release() {
        return payload.release();
    }

    @Override
    public boolean release(int decrement) {
        return payload.release(decrement);
    }

    @Override
    public String toString() {
        if (isMethod()) {
            return String.format("AmqpFrame{type=%s, channel=%d, method=%d.%d}",
                    type, channel, getClassId(), getMethodId());
        }
        return String.format("AmqpFrame{type=%s, channel=%d, size=%d}", type, channel, getSize());
    }

    public enum FrameType {
        METHOD(1),
        HEADER(2),
        BODY(3),
        HEARTBEAT(8);

        private final byte value;

        FrameType(int value) {
            this.value = (byte) value;
        }

        public byte getValue() {
            return value;
        }

        public static FrameType fromValue(byte value) {
            for (FrameType type : values()) {
                if (type.value == value) {
                    return type;
                }
            }
            throw new IllegalArgumentException("Unknown frame type: " + value);
        }
    }
}
