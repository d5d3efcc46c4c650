package com.simpleamqp.amqp;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.netty.handler.codec.CorruptedFrameException;
import io.netty.handler.codec.MessageToByteEncoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class AmqpCodec {

    public static final int MAX_SHORT_STRING_LENGTH = 255;
    public static final int MAX_LONG_STRING_LENGTH = 256 * 1024; // 256KB max string

    public static class AmqpFrameDecoder extends ByteToMessageDecoder {
        private static final Logger logger = LoggerFactory.getLogger(AmqpFrameDecoder.class);
        private static final int MIN_FRAME_SIZE = AmqpFrame.FRAME_HEADER_SIZE + AmqpFrame.FRAME_END_SIZE;

        private volatile int maxFrameSize;

        public AmqpFrameDecoder() {
            this(AmqpConstants.DEFAULT_FRAME_MAX);
        }

        public AmqpFrameDecoder(int maxFrameSize) {
            this.maxFrameSize = maxFrameSize;
        }

        public void setMaxFrameSize(int maxFrameSize) {
            this.maxFrameSize = maxFrameSize;
        }

        @Override
        protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
            if (in.readableBytes() < MIN_FRAME_SIZE) {
                return;
            }

            int readerIndex = in.readerIndex();

            // A broker that rejects our protocol version answers with its own header
            if (in.getByte(readerIndex) == 'A') {
                throw new CorruptedFrameException("Broker rejected protocol header, unsupported AMQP version");
            }

            byte type = in.readByte();
            int channel = in.readUnsignedShort();
            int size = in.readInt();

            if (size < 0 || size > maxFrameSize) {
                throw new CorruptedFrameException(
                    "Invalid frame size: " + size + " (max: " + maxFrameSize + ")");
            }

            if (in.readableBytes() < size + 1) {
                in.readerIndex(readerIndex);
                return;
            }

            ByteBuf payload = in.readRetainedSlice(size);
            byte frameEnd = in.readByte();

            if (frameEnd != AmqpFrame.FRAME_END) {
                payload.release();
                throw new CorruptedFrameException("Invalid frame end marker");
            }

            AmqpFrame frame = new AmqpFrame(AmqpFrame.FrameType.fromValue(type), channel, payload);
            logger.trace("Decoded {}", frame);
            out.add(frame);
        }
    }

    public static class AmqpFrameEncoder extends MessageToByteEncoder<AmqpFrame> {
        private static final Logger logger = LoggerFactory.getLogger(AmqpFrameEncoder.class);

        @Override
        protected void encode(ChannelHandlerContext ctx, AmqpFrame frame, ByteBuf out) throws Exception {
            logger.trace("Encoding {}", frame);
            out.writeByte(frame.getType().getValue());
            out.writeShort(frame.getChannel());
            out.writeInt(frame.getSize());
            out.writeBytes(frame.getPayload(), frame.getPayload().readerIndex(), frame.getSize());
            out.writeByte(AmqpFrame.FRAME_END);
        }
    }

    public static ByteBuf encodeShortString(ByteBuf buf, String value) {
        if (value == null) value = "";
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        if (bytes.length > MAX_SHORT_STRING_LENGTH) {
            throw new IllegalArgumentException(
                "Short string too long: " + bytes.length + " bytes (max: " + MAX_SHORT_STRING_LENGTH + ")");
        }
        buf.writeByte(bytes.length);
        buf.writeBytes(bytes);
        return buf;
    }

    public static String decodeShortString(ByteBuf buf) {
        int length = buf.readUnsignedByte();
        if (buf.readableBytes() < length) {
            throw new IllegalArgumentException(
                "Buffer underflow: need " + length + " bytes but only " + buf.readableBytes() + " available");
        }
        byte[] bytes = new byte[length];
        buf.readBytes(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    public static ByteBuf encodeLongString(ByteBuf buf, String value) {
        if (value == null) value = "";
        return encodeLongString(buf, value.getBytes(StandardCharsets.UTF_8));
    }

    public static ByteBuf encodeLongString(ByteBuf buf, byte[] bytes) {
        buf.writeInt(bytes.length);
        buf.writeBytes(bytes);
        return buf;
    }

    public static String decodeLongString(ByteBuf buf) {
        int length = buf.readInt();
        if (length < 0 || length > MAX_LONG_STRING_LENGTH) {
            throw new IllegalArgumentException(
                "Invalid long string length: " + length + " (max: " + MAX_LONG_STRING_LENGTH + ")");
        }
        if (buf.readableBytes() < length) {
            throw new IllegalArgumentException(
                "Buffer underflow: need " + length + " bytes but only " + buf.readableBytes() + " available");
        }
        byte[] bytes = new byte[length];
        buf.readBytes(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    /**
     * Write up to eight boolean flags packed into one octet, first flag in the lowest bit.
     */
    public static ByteBuf encodeBits(ByteBuf buf, boolean... bits) {
        if (bits.length > 8) {
            throw new IllegalArgumentException("At most 8 bits fit in one octet: " + bits.length);
        }
        int octet = 0;
        for (int i = 0; i < bits.length; i++) {
            if (bits[i]) {
                octet |= 1 << i;
            }
        }
        buf.writeByte(octet);
        return buf;
    }

    public static boolean decodeBoolean(ByteBuf buf) {
        return buf.readByte() != 0;
    }

    /**
     * Decode an AMQP field table from the buffer.
     * Format: 4-byte length + table entries
     */
    public static Map<String, Object> decodeTable(ByteBuf buf) {
        Map<String, Object> table = new LinkedHashMap<>();

        int tableLength = buf.readInt();
        if (tableLength <= 0) {
            return table;
        }

        if (tableLength > buf.readableBytes()) {
            throw new IllegalArgumentException(
                "Table length exceeds available bytes: " + tableLength + " > " + buf.readableBytes());
        }

        int endIndex = buf.readerIndex() + tableLength;

        while (buf.readerIndex() < endIndex) {
            String key = decodeShortString(buf);
            Object value = decodeFieldValue(buf);
            table.put(key, value);
        }

        return table;
    }

    /**
     * Decode a single field value from the buffer.
     * The first byte is the type indicator.
     */
    public static Object decodeFieldValue(ByteBuf buf) {
        byte type = buf.readByte();

        switch (type) {
            case 't': // Boolean
                return buf.readByte() != 0;
            case 'b': // Signed byte
                return buf.readByte();
            case 'B': // Unsigned byte
                return buf.readUnsignedByte();
            case 's': // Signed short
                return buf.readShort();
            case 'u': // Unsigned short
                return buf.readUnsignedShort();
            case 'I': // Signed 32-bit
                return buf.readInt();
            case 'i': // Unsigned 32-bit (stored as long)
                return buf.readUnsignedInt();
            case 'l': // Signed 64-bit
                return buf.readLong();
            case 'f': // 32-bit float
                return buf.readFloat();
            case 'd': // 64-bit double
                return buf.readDouble();
            case 'D': // Decimal value (scale + unscaled value)
                byte scale = buf.readByte();
                int unscaled = buf.readInt();
                return new BigDecimal(unscaled).scaleByPowerOfTen(-scale);
            case 'S': // Long string
                return decodeLongString(buf);
            case 'A': // Field array
                return decodeFieldArray(buf);
            case 'T': // Timestamp, seconds since epoch
                return new Date(buf.readLong() * 1000);
            case 'F': // Nested table
                return decodeTable(buf);
            case 'V': // Void/null
                return null;
            case 'x': // Byte array
                int len = buf.readInt();
                byte[] bytes = new byte[len];
                buf.readBytes(bytes);
                return bytes;
            default:
                throw new IllegalArgumentException("Unknown field type: " + (char) type);
        }
    }

    public static List<Object> decodeFieldArray(ByteBuf buf) {
        List<Object> array = new ArrayList<>();
        int arrayLength = buf.readInt();

        if (arrayLength <= 0) {
            return array;
        }

        int endIndex = buf.readerIndex() + arrayLength;

        while (buf.readerIndex() < endIndex) {
            array.add(decodeFieldValue(buf));
        }

        return array;
    }

    public static void encodeTable(ByteBuf buf, Map<String, Object> table) {
        if (table == null || table.isEmpty()) {
            buf.writeInt(0);
            return;
        }

        // Write to a temporary buffer to calculate size
        ByteBuf tempBuf = Unpooled.buffer();
        try {
            for (Map.Entry<String, Object> entry : table.entrySet()) {
                encodeShortString(tempBuf, entry.getKey());
                encodeFieldValue(tempBuf, entry.getValue());
            }

            buf.writeInt(tempBuf.readableBytes());
            buf.writeBytes(tempBuf);
        } finally {
            tempBuf.release();
        }
    }

    public static void encodeFieldValue(ByteBuf buf, Object value) {
        if (value == null) {
            buf.writeByte('V');
        } else if (value instanceof Boolean) {
            buf.writeByte('t');
            buf.writeByte((Boolean) value ? 1 : 0);
        } else if (value instanceof Byte) {
            buf.writeByte('b');
            buf.writeByte((Byte) value);
        } else if (value instanceof Short) {
            buf.writeByte('s');
            buf.writeShort((Short) value);
        } else if (value instanceof Integer) {
            buf.writeByte('I');
            buf.writeInt((Integer) value);
        } else if (value instanceof Long) {
            buf.writeByte('l');
            buf.writeLong((Long) value);
        } else if (value instanceof Float) {
            buf.writeByte('f');
            buf.writeFloat((Float) value);
        } else if (value instanceof Double) {
            buf.writeByte('d');
            buf.writeDouble((Double) value);
        } else if (value instanceof String) {
            buf.writeByte('S');
            encodeLongString(buf, (String) value);
        } else if (value instanceof byte[]) {
            buf.writeByte('x');
            byte[] bytes = (byte[]) value;
            buf.writeInt(bytes.length);
            buf.writeBytes(bytes);
        } else if (value instanceof Map) {
            buf.writeByte('F');
            @SuppressWarnings("unchecked")
            Map<String, Object> nestedTable = (Map<String, Object>) value;
            encodeTable(buf, nestedTable);
        } else if (value instanceof List) {
            buf.writeByte('A');
            @SuppressWarnings("unchecked")
            List<Object> list = (List<Object>) value;
            encodeFieldArray(buf, list);
        } else if (value instanceof Date) {
            buf.writeByte('T');
            buf.writeLong(((Date) value).getTime() / 1000); // AMQP timestamp is in seconds
        } else if (value instanceof BigDecimal) {
            buf.writeByte('D');
            BigDecimal decimal = (BigDecimal) value;
            buf.writeByte(decimal.scale());
            buf.writeInt(decimal.unscaledValue().intValueExact());
        } else {
            throw new IllegalArgumentException("Unsupported field value type: " + value.getClass().getName());
        }
    }

    public static void encodeFieldArray(ByteBuf buf, List<Object> array) {
        if (array == null || array.isEmpty()) {
            buf.writeInt(0);
            return;
        }

        ByteBuf tempBuf = Unpooled.buffer();
        try {
            for (Object item : array) {
                encodeFieldValue(tempBuf, item);
            }

            buf.writeInt(tempBuf.readableBytes());
            buf.writeBytes(tempBuf);
        } finally {
            tempBuf.release();
        }
    }
}
