package com.simpleamqp.model;

import com.simpleamqp.amqp.AmqpConstants;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A message body plus its basic-class content properties.
 * Each property tracks whether it has been set; unset properties read as
 * {@code null} (strings, headers) or zero (numbers) and are omitted on the wire.
 */
public class Message {
    public static final short DELIVERY_MODE_NON_PERSISTENT = 1;
    public static final short DELIVERY_MODE_PERSISTENT = 2;

    private int propertyFlags;
    private String contentType;
    private String contentEncoding;
    private Map<String, Object> headers;
    private short deliveryMode;
    private short priority;
    private String correlationId;
    private String replyTo;
    private String expiration;
    private String messageId;
    private long timestamp;
    private String type;
    private String userId;
    private String appId;
    private String clusterId;
    private byte[] body = new byte[0];

    public Message() {
    }

    public Message(byte[] body) {
        setBody(body);
    }

    public Message(String body) {
        setBody(body);
    }

    public int getPropertyFlags() {
        return propertyFlags;
    }

    public boolean isPropertySet(int flag) {
        return (propertyFlags & flag) != 0;
    }

    private void markSet(int flag) {
        propertyFlags |= flag;
    }

    public String getContentType() {
        return contentType;
    }

    public void setContentType(String contentType) {
        this.contentType = contentType;
        markSet(AmqpConstants.PROPERTY_FLAG_CONTENT_TYPE);
    }

    public String getContentEncoding() {
        return contentEncoding;
    }

    public void setContentEncoding(String contentEncoding) {
        this.contentEncoding = contentEncoding;
        markSet(AmqpConstants.PROPERTY_FLAG_CONTENT_ENCODING);
    }

    public Map<String, Object> getHeaders() {
        return headers;
    }

    public void setHeaders(Map<String, Object> headers) {
        this.headers = headers != null ? new LinkedHashMap<>(headers) : new LinkedHashMap<>();
        markSet(AmqpConstants.PROPERTY_FLAG_HEADERS);
    }

    public short getDeliveryMode() {
        return deliveryMode;
    }

    public void setDeliveryMode(short deliveryMode) {
        this.deliveryMode = deliveryMode;
        markSet(AmqpConstants.PROPERTY_FLAG_DELIVERY_MODE);
    }

    public boolean isPersistent() {
        return deliveryMode == DELIVERY_MODE_PERSISTENT;
    }

    public short getPriority() {
        return priority;
    }

    public void setPriority(short priority) {
        this.priority = priority;
        markSet(AmqpConstants.PROPERTY_FLAG_PRIORITY);
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public void setCorrelationId(String correlationId) {
        this.correlationId = correlationId;
        markSet(AmqpConstants.PROPERTY_FLAG_CORRELATION_ID);
    }

    public String getReplyTo() {
        return replyTo;
    }

    public void setReplyTo(String replyTo) {
        this.replyTo = replyTo;
        markSet(AmqpConstants.PROPERTY_FLAG_REPLY_TO);
    }

    public String getExpiration() {
        return expiration;
    }

    public void setExpiration(String expiration) {
        this.expiration = expiration;
        markSet(AmqpConstants.PROPERTY_FLAG_EXPIRATION);
    }

    public String getMessageId() {
        return messageId;
    }

    public void setMessageId(String messageId) {
        this.messageId = messageId;
        markSet(AmqpConstants.PROPERTY_FLAG_MESSAGE_ID);
    }

    /**
     * Seconds since the epoch, as carried on the wire.
     */
    public long getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(long timestamp) {
        this.timestamp = timestamp;
        markSet(AmqpConstants.PROPERTY_FLAG_TIMESTAMP);
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
        markSet(AmqpConstants.PROPERTY_FLAG_TYPE);
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
        markSet(AmqpConstants.PROPERTY_FLAG_USER_ID);
    }

    public String getAppId() {
        return appId;
    }

    public void setAppId(String appId) {
        this.appId = appId;
        markSet(AmqpConstants.PROPERTY_FLAG_APP_ID);
    }

    public String getClusterId() {
        return clusterId;
    }

    public void setClusterId(String clusterId) {
        this.clusterId = clusterId;
        markSet(AmqpConstants.PROPERTY_FLAG_CLUSTER_ID);
    }

    public byte[] getBody() {
        return body;
    }

    public String getBodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public void setBody(byte[] body) {
        this.body = body != null ? body : new byte[0];
    }

    public void setBody(String body) {
        setBody(body != null ? body.getBytes(StandardCharsets.UTF_8) : null);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Message)) return false;
        Message other = (Message) o;
        return propertyFlags == other.propertyFlags
                && deliveryMode == other.deliveryMode
                && priority == other.priority
                && timestamp == other.timestamp
                && Objects.equals(contentType, other.contentType)
                && Objects.equals(contentEncoding, other.contentEncoding)
                && Objects.equals(headers, other.headers)
                && Objects.equals(correlationId, other.correlationId)
                && Objects.equals(replyTo, other.replyTo)
                && Objects.equals(expiration, other.expiration)
                && Objects.equals(messageId, other.messageId)
                && Objects.equals(type, other.type)
                && Objects.equals(userId, other.userId)
                && Objects.equals(appId, other.appId)
                && Objects.equals(clusterId, other.clusterId)
                && Arrays.equals(body, other.body);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(propertyFlags, contentType, messageId, correlationId) + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        return String.format("Message{contentType='%s', messageId='%s', bodySize=%d}",
                contentType, messageId, body.length);
    }
}
