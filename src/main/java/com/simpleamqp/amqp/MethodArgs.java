package com.simpleamqp.amqp;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.util.Map;

/**
 * Argument encoders for the methods the client sends, and decoded views of the
 * methods it receives. Decoders never move the frame's reader index.
 */
public final class MethodArgs {

    private MethodArgs() {
        // Utility class
    }

    // ===== Requests =====

    public static ByteBuf connectionStartOk(Map<String, Object> clientProperties, String mechanism,
                                            byte[] response, String locale) {
        ByteBuf buf = Unpooled.buffer();
        AmqpCodec.encodeTable(buf, clientProperties);
        AmqpCodec.encodeShortString(buf, mechanism);
        AmqpCodec.encodeLongString(buf, response);
        AmqpCodec.encodeShortString(buf, locale);
        return buf;
    }

    public static ByteBuf connectionTuneOk(int channelMax, int frameMax, int heartbeat) {
        ByteBuf buf = Unpooled.buffer(8);
        buf.writeShort(channelMax);
        buf.writeInt(frameMax);
        buf.writeShort(heartbeat);
        return buf;
    }

    public static ByteBuf connectionOpen(String virtualHost) {
        ByteBuf buf = Unpooled.buffer();
        AmqpCodec.encodeShortString(buf, virtualHost);
        AmqpCodec.encodeShortString(buf, ""); // capabilities (reserved)
        AmqpCodec.encodeBits(buf, false);     // insist (reserved)
        return buf;
    }

    public static ByteBuf close(int replyCode, String replyText, int classId, int methodId) {
        ByteBuf buf = Unpooled.buffer();
        buf.writeShort(replyCode);
        AmqpCodec.encodeShortString(buf, replyText);
        buf.writeShort(classId);
        buf.writeShort(methodId);
        return buf;
    }

    public static ByteBuf channelOpen() {
        ByteBuf buf = Unpooled.buffer(1);
        AmqpCodec.encodeShortString(buf, ""); // out-of-band (reserved)
        return buf;
    }

    public static ByteBuf confirmSelect() {
        return AmqpCodec.encodeBits(Unpooled.buffer(1), false); // no-wait
    }

    public static ByteBuf basicConsume(String queue, String consumerTag, boolean noLocal, boolean noAck,
                                       boolean exclusive, Map<String, Object> arguments) {
        ByteBuf buf = Unpooled.buffer();
        buf.writeShort(0); // ticket (reserved)
        AmqpCodec.encodeShortString(buf, queue);
        AmqpCodec.encodeShortString(buf, consumerTag);
        AmqpCodec.encodeBits(buf, noLocal, noAck, exclusive, false);
        AmqpCodec.encodeTable(buf, arguments);
        return buf;
    }

    public static ByteBuf basicCancel(String consumerTag) {
        ByteBuf buf = Unpooled.buffer();
        AmqpCodec.encodeShortString(buf, consumerTag);
        AmqpCodec.encodeBits(buf, false); // no-wait
        return buf;
    }

    public static ByteBuf basicPublish(String exchange, String routingKey, boolean mandatory, boolean immediate) {
        ByteBuf buf = Unpooled.buffer();
        buf.writeShort(0); // ticket (reserved)
        AmqpCodec.encodeShortString(buf, exchange);
        AmqpCodec.encodeShortString(buf, routingKey);
        AmqpCodec.encodeBits(buf, mandatory, immediate);
        return buf;
    }

    public static ByteBuf basicAck(long deliveryTag, boolean multiple) {
        ByteBuf buf = Unpooled.buffer(9);
        buf.writeLong(deliveryTag);
        AmqpCodec.encodeBits(buf, multiple);
        return buf;
    }

    public static ByteBuf basicReject(long deliveryTag, boolean requeue) {
        ByteBuf buf = Unpooled.buffer(9);
        buf.writeLong(deliveryTag);
        AmqpCodec.encodeBits(buf, requeue);
        return buf;
    }

    // ===== Replies and broker-initiated methods =====

    public static Start decodeStart(AmqpFrame frame) {
        ByteBuf args = frame.methodArguments();
        int major = args.readUnsignedByte();
        int minor = args.readUnsignedByte();
        Map<String, Object> serverProperties = AmqpCodec.decodeTable(args);
        String mechanisms = AmqpCodec.decodeLongString(args);
        String locales = AmqpCodec.decodeLongString(args);
        return new Start(major, minor, serverProperties, mechanisms, locales);
    }

    public static Tune decodeTune(AmqpFrame frame) {
        ByteBuf args = frame.methodArguments();
        return new Tune(args.readUnsignedShort(), args.readInt(), args.readUnsignedShort());
    }

    public static Close decodeClose(AmqpFrame frame) {
        ByteBuf args = frame.methodArguments();
        int replyCode = args.readUnsignedShort();
        String replyText = AmqpCodec.decodeShortString(args);
        short classId = args.readShort();
        short methodId = args.readShort();
        return new Close(replyCode, replyText, classId, methodId);
    }

    /**
     * Consumer tag carried by basic.consume-ok, basic.cancel or basic.cancel-ok.
     */
    public static String decodeConsumerTag(AmqpFrame frame) {
        return AmqpCodec.decodeShortString(frame.methodArguments());
    }

    public static Deliver decodeDeliver(AmqpFrame frame) {
        ByteBuf args = frame.methodArguments();
        String consumerTag = AmqpCodec.decodeShortString(args);
        long deliveryTag = args.readLong();
        boolean redelivered = AmqpCodec.decodeBoolean(args);
        String exchange = AmqpCodec.decodeShortString(args);
        String routingKey = AmqpCodec.decodeShortString(args);
        return new Deliver(consumerTag, deliveryTag, redelivered, exchange, routingKey);
    }

    public static Return decodeReturn(AmqpFrame frame) {
        ByteBuf args = frame.methodArguments();
        int replyCode = args.readUnsignedShort();
        String replyText = AmqpCodec.decodeShortString(args);
        String exchange = AmqpCodec.decodeShortString(args);
        String routingKey = AmqpCodec.decodeShortString(args);
        return new Return(replyCode, replyText, exchange, routingKey);
    }

    /**
     * Decode basic.ack or basic.nack. The requeue bit of a nack is ignored.
     */
    public static Confirm decodeConfirm(AmqpFrame frame) {
        ByteBuf args = frame.methodArguments();
        long deliveryTag = args.readLong();
        boolean multiple = (args.readByte() & 0x01) != 0;
        return new Confirm(deliveryTag, multiple);
    }

    public static final class Start {
        private final int versionMajor;
        private final int versionMinor;
        private final Map<String, Object> serverProperties;
        private final String mechanisms;
        private final String locales;

        Start(int versionMajor, int versionMinor, Map<String, Object> serverProperties,
              String mechanisms, String locales) {
            this.versionMajor = versionMajor;
            this.versionMinor = versionMinor;
            this.serverProperties = serverProperties;
            this.mechanisms = mechanisms;
            this.locales = locales;
        }

        public int getVersionMajor() {
            return versionMajor;
        }

        public int getVersionMinor() {
            return versionMinor;
        }

        public Map<String, Object> getServerProperties() {
            return serverProperties;
        }

        public String getMechanisms() {
            return mechanisms;
        }

        public String getLocales() {
            return locales;
        }

        public boolean supportsMechanism(String mechanism) {
            for (String candidate : mechanisms.split(" ")) {
                if (candidate.equals(mechanism)) {
                    return true;
                }
            }
            return false;
        }
    }

    public static final class Tune {
        private final int channelMax;
        private final int frameMax;
        private final int heartbeat;

        Tune(int channelMax, int frameMax, int heartbeat) {
            this.channelMax = channelMax;
            this.frameMax = frameMax;
            this.heartbeat = heartbeat;
        }

        public int getChannelMax() {
            return channelMax;
        }

        public int getFrameMax() {
            return frameMax;
        }

        public int getHeartbeat() {
            return heartbeat;
        }
    }

    public static final class Close {
        private final int replyCode;
        private final String replyText;
        private final short classId;
        private final short methodId;

        Close(int replyCode, String replyText, short classId, short methodId) {
            this.replyCode = replyCode;
            this.replyText = replyText;
            this.classId = classId;
            this.methodId = methodId;
        }

        public int getReplyCode() {
            return replyCode;
        }

        public String getReplyText() {
            return replyText;
        }

        public short getClassId() {
            return classId;
        }

        public short getMethodId() {
            return methodId;
        }
    }

    public static final class Deliver {
        private final String consumerTag;
        private final long deliveryTag;
        private final boolean redelivered;
        private final String exchange;
        private final String routingKey;

        Deliver(String consumerTag, long deliveryTag, boolean redelivered, String exchange, String routingKey) {
            this.consumerTag = consumerTag;
            this.deliveryTag = deliveryTag;
            this.redelivered = redelivered;
            this.exchange = exchange;
            this.routingKey = routingKey;
        }

        public String getConsumerTag() {
            return consumerTag;
        }

        public long getDeliveryTag() {
            return deliveryTag;
        }

        public boolean isRedelivered() {
            return redelivered;
        }

        public String getExchange() {
            return exchange;
        }

        public String getRoutingKey() {
            return routingKey;
        }
    }

    public static final class Return {
        private final int replyCode;
        private final String replyText;
        private final String exchange;
        private final String routingKey;

        Return(int replyCode, String replyText, String exchange, String routingKey) {
            this.replyCode = replyCode;
            this.replyText = replyText;
            this.exchange = exchange;
            this.routingKey = routingKey;
        }

        public int getReplyCode() {
            return replyCode;
        }

        public String getReplyText() {
            return replyText;
        }

        public String getExchange() {
            return exchange;
        }

        public String getRoutingKey() {
            return routingKey;
        }
    }

    public static final class Confirm {
        private final long deliveryTag;
        private final boolean multiple;

        Confirm(long deliveryTag, boolean multiple) {
            this.deliveryTag = deliveryTag;
            this.multiple = multiple;
        }

        public long getDeliveryTag() {
            return deliveryTag;
        }

        public boolean isMultiple() {
            return multiple;
        }
    }
}
