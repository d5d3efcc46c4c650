package com.simpleamqp.amqp;

/**
 * AMQP 0-9-1 protocol constants used by the client.
 */
public final class AmqpConstants {

    private AmqpConstants() {
        // Utility class
    }

    public static final byte[] PROTOCOL_HEADER = {'A', 'M', 'Q', 'P', 0, 0, 9, 1};

    // ===== Ports =====
    public static final int DEFAULT_PORT = 5672;
    public static final int DEFAULT_TLS_PORT = 5671;

    // ===== Connection/Channel Limits =====
    public static final int MAX_CHANNEL_ID = 65535;
    public static final int DEFAULT_FRAME_MAX = 131072; // 128KB
    public static final int MIN_FRAME_MAX = 4096;
    public static final int FRAME_OVERHEAD = AmqpFrame.FRAME_HEADER_SIZE + AmqpFrame.FRAME_END_SIZE;
    public static final int HEARTBEAT_DISABLED = 0;

    // ===== Well-known names =====
    public static final String DIRECT_REPLY_TO_QUEUE = "amq.rabbitmq.reply-to";
    public static final String SERVER_VERSION_PROPERTY = "version";
    public static final String DEFAULT_LOCALE = "en_US";
    public static final String MECHANISM_PLAIN = "PLAIN";
    public static final String MECHANISM_EXTERNAL = "EXTERNAL";

    // ===== AMQP Reply Codes =====
    public static final int REPLY_SUCCESS = 200;
    public static final int REPLY_CONTENT_TOO_LARGE = 311;
    public static final int REPLY_NO_ROUTE = 312;
    public static final int REPLY_NO_CONSUMERS = 313;
    public static final int REPLY_CONNECTION_FORCED = 320;
    public static final int REPLY_INVALID_PATH = 402;
    public static final int REPLY_ACCESS_REFUSED = 403;
    public static final int REPLY_NOT_FOUND = 404;
    public static final int REPLY_RESOURCE_LOCKED = 405;
    public static final int REPLY_PRECONDITION_FAILED = 406;
    public static final int REPLY_FRAME_ERROR = 501;
    public static final int REPLY_SYNTAX_ERROR = 502;
    public static final int REPLY_COMMAND_INVALID = 503;
    public static final int REPLY_CHANNEL_ERROR = 504;
    public static final int REPLY_UNEXPECTED_FRAME = 505;
    public static final int REPLY_RESOURCE_ERROR = 506;
    public static final int REPLY_NOT_ALLOWED = 530;
    public static final int REPLY_NOT_IMPLEMENTED = 540;
    public static final int REPLY_INTERNAL_ERROR = 541;

    // ===== Property Flags (basic content header) =====
    public static final int PROPERTY_FLAG_CONTENT_TYPE = 1 << 15;
    public static final int PROPERTY_FLAG_CONTENT_ENCODING = 1 << 14;
    public static final int PROPERTY_FLAG_HEADERS = 1 << 13;
    public static final int PROPERTY_FLAG_DELIVERY_MODE = 1 << 12;
    public static final int PROPERTY_FLAG_PRIORITY = 1 << 11;
    public static final int PROPERTY_FLAG_CORRELATION_ID = 1 << 10;
    public static final int PROPERTY_FLAG_REPLY_TO = 1 << 9;
    public static final int PROPERTY_FLAG_EXPIRATION = 1 << 8;
    public static final int PROPERTY_FLAG_MESSAGE_ID = 1 << 7;
    public static final int PROPERTY_FLAG_TIMESTAMP = 1 << 6;
    public static final int PROPERTY_FLAG_TYPE = 1 << 5;
    public static final int PROPERTY_FLAG_USER_ID = 1 << 4;
    public static final int PROPERTY_FLAG_APP_ID = 1 << 3;
    public static final int PROPERTY_FLAG_CLUSTER_ID = 1 << 2;
}
