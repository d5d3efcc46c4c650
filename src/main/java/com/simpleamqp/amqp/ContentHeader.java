package com.simpleamqp.amqp;

import com.simpleamqp.model.Message;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import static com.simpleamqp.amqp.AmqpConstants.*;

/**
 * Decoded payload of a content-header frame: the declared body size and the
 * basic-class properties. Only properties whose flag bit is set are copied.
 */
public final class ContentHeader {
    private final short classId;
    private final long bodySize;
    private final Message properties;

    private ContentHeader(short classId, long bodySize, Message properties) {
        this.classId = classId;
        this.bodySize = bodySize;
        this.properties = properties;
    }

    public short getClassId() {
        return classId;
    }

    public long getBodySize() {
        return bodySize;
    }

    /**
     * A message carrying the decoded properties and an empty body.
     */
    public Message getProperties() {
        return properties;
    }

    public static ContentHeader decode(AmqpFrame frame) {
        if (frame.getType() != AmqpFrame.FrameType.HEADER) {
            throw new IllegalArgumentException("Not a content header frame: " + frame);
        }
        ByteBuf payload = frame.getPayload().duplicate();
        short classId = payload.readShort();
        payload.readShort(); // weight (unused)
        long bodySize = payload.readLong();
        int propertyFlags = payload.readUnsignedShort();

        Message message = new Message();

        // Decode properties based on flags (bit 15 is highest)
        if ((propertyFlags & PROPERTY_FLAG_CONTENT_TYPE) != 0) {
            message.setContentType(AmqpCodec.decodeShortString(payload));
        }
        if ((propertyFlags & PROPERTY_FLAG_CONTENT_ENCODING) != 0) {
            message.setContentEncoding(AmqpCodec.decodeShortString(payload));
        }
        if ((propertyFlags & PROPERTY_FLAG_HEADERS) != 0) {
            message.setHeaders(AmqpCodec.decodeTable(payload));
        }
        if ((propertyFlags & PROPERTY_FLAG_DELIVERY_MODE) != 0) {
            message.setDeliveryMode(payload.readUnsignedByte());
        }
        if ((propertyFlags & PROPERTY_FLAG_PRIORITY) != 0) {
            message.setPriority(payload.readUnsignedByte());
        }
        if ((propertyFlags & PROPERTY_FLAG_CORRELATION_ID) != 0) {
            message.setCorrelationId(AmqpCodec.decodeShortString(payload));
        }
        if ((propertyFlags & PROPERTY_FLAG_REPLY_TO) != 0) {
            message.setReplyTo(AmqpCodec.decodeShortString(payload));
        }
        if ((propertyFlags & PROPERTY_FLAG_EXPIRATION) != 0) {
            message.setExpiration(AmqpCodec.decodeShortString(payload));
        }
        if ((propertyFlags & PROPERTY_FLAG_MESSAGE_ID) != 0) {
            message.setMessageId(AmqpCodec.decodeShortString(payload));
        }
        if ((propertyFlags & PROPERTY_FLAG_TIMESTAMP) != 0) {
            message.setTimestamp(payload.readLong());
        }
        if ((propertyFlags & PROPERTY_FLAG_TYPE) != 0) {
            message.setType(AmqpCodec.decodeShortString(payload));
        }
        if ((propertyFlags & PROPERTY_FLAG_USER_ID) != 0) {
            message.setUserId(AmqpCodec.decodeShortString(payload));
        }
        if ((propertyFlags & PROPERTY_FLAG_APP_ID) != 0) {
            message.setAppId(AmqpCodec.decodeShortString(payload));
        }
        if ((propertyFlags & PROPERTY_FLAG_CLUSTER_ID) != 0) {
            message.setClusterId(AmqpCodec.decodeShortString(payload));
        }

        return new ContentHeader(classId, bodySize, message);
    }

    /**
     * Build the content-header frame announcing {@code message} on {@code channel}.
     */
    public static AmqpFrame encode(int channel, Message message) {
        ByteBuf payload = Unpooled.buffer();
        payload.writeShort(AmqpMethod.Class.BASIC.getValue());
        payload.writeShort(0); // weight
        payload.writeLong(message.getBody().length);
        payload.writeShort(message.getPropertyFlags());

        if (message.isPropertySet(PROPERTY_FLAG_CONTENT_TYPE)) {
            AmqpCodec.encodeShortString(payload, message.getContentType());
        }
        if (message.isPropertySet(PROPERTY_FLAG_CONTENT_ENCODING)) {
            AmqpCodec.encodeShortString(payload, message.getContentEncoding());
        }
        if (message.isPropertySet(PROPERTY_FLAG_HEADERS)) {
            AmqpCodec.encodeTable(payload, message.getHeaders());
        }
        if (message.isPropertySet(PROPERTY_FLAG_DELIVERY_MODE)) {
            payload.writeByte(message.getDeliveryMode());
        }
        if (message.isPropertySet(PROPERTY_FLAG_PRIORITY)) {
            payload.writeByte(message.getPriority());
        }
        if (message.isPropertySet(PROPERTY_FLAG_CORRELATION_ID)) {
            AmqpCodec.encodeShortString(payload, message.getCorrelationId());
        }
        if (message.isPropertySet(PROPERTY_FLAG_REPLY_TO)) {
            AmqpCodec.encodeShortString(payload, message.getReplyTo());
        }
        if (message.isPropertySet(PROPERTY_FLAG_EXPIRATION)) {
            AmqpCodec.encodeShortString(payload, message.getExpiration());
        }
        if (message.isPropertySet(PROPERTY_FLAG_MESSAGE_ID)) {
            AmqpCodec.encodeShortString(payload, message.getMessageId());
        }
        if (message.isPropertySet(PROPERTY_FLAG_TIMESTAMP)) {
            payload.writeLong(message.getTimestamp());
        }
        if (message.isPropertySet(PROPERTY_FLAG_TYPE)) {
            AmqpCodec.encodeShortString(payload, message.getType());
        }
        if (message.isPropertySet(PROPERTY_FLAG_USER_ID)) {
            AmqpCodec.encodeShortString(payload, message.getUserId());
        }
        if (message.isPropertySet(PROPERTY_FLAG_APP_ID)) {
            AmqpCodec.encodeShortString(payload, message.getAppId());
        }
        if (message.isPropertySet(PROPERTY_FLAG_CLUSTER_ID)) {
            AmqpCodec.encodeShortString(payload, message.getClusterId());
        }

        return new AmqpFrame(AmqpFrame.FrameType.HEADER, channel, payload);
    }
}
