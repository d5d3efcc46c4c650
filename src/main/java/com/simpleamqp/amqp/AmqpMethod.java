package com.simpleamqp.amqp;

import com.simpleamqp.exception.AmqpProtocolException;

/**
 * The AMQP 0-9-1 methods this client sends or expects to receive,
 * identified by their (class-id, method-id) pair.
 */
public enum AmqpMethod {
    CONNECTION_START(Class.CONNECTION, 10),
    CONNECTION_START_OK(Class.CONNECTION, 11),
    CONNECTION_SECURE(Class.CONNECTION, 20),
    CONNECTION_SECURE_OK(Class.CONNECTION, 21),
    CONNECTION_TUNE(Class.CONNECTION, 30),
    CONNECTION_TUNE_OK(Class.CONNECTION, 31),
    CONNECTION_OPEN(Class.CONNECTION, 40),
    CONNECTION_OPEN_OK(Class.CONNECTION, 41),
    CONNECTION_CLOSE(Class.CONNECTION, 50),
    CONNECTION_CLOSE_OK(Class.CONNECTION, 51),
    CONNECTION_BLOCKED(Class.CONNECTION, 60),
    CONNECTION_UNBLOCKED(Class.CONNECTION, 61),

    CHANNEL_OPEN(Class.CHANNEL, 10),
    CHANNEL_OPEN_OK(Class.CHANNEL, 11),
    CHANNEL_FLOW(Class.CHANNEL, 20),
    CHANNEL_FLOW_OK(Class.CHANNEL, 21),
    CHANNEL_CLOSE(Class.CHANNEL, 40),
    CHANNEL_CLOSE_OK(Class.CHANNEL, 41),

    BASIC_QOS(Class.BASIC, 10),
    BASIC_QOS_OK(Class.BASIC, 11),
    BASIC_CONSUME(Class.BASIC, 20),
    BASIC_CONSUME_OK(Class.BASIC, 21),
    BASIC_CANCEL(Class.BASIC, 30),
    BASIC_CANCEL_OK(Class.BASIC, 31),
    BASIC_PUBLISH(Class.BASIC, 40),
    BASIC_RETURN(Class.BASIC, 50),
    BASIC_DELIVER(Class.BASIC, 60),
    BASIC_GET(Class.BASIC, 70),
    BASIC_GET_OK(Class.BASIC, 71),
    BASIC_GET_EMPTY(Class.BASIC, 72),
    BASIC_ACK(Class.BASIC, 80),
    BASIC_REJECT(Class.BASIC, 90),
    BASIC_RECOVER_ASYNC(Class.BASIC, 100),
    BASIC_RECOVER(Class.BASIC, 110),
    BASIC_RECOVER_OK(Class.BASIC, 111),
    BASIC_NACK(Class.BASIC, 120),

    CONFIRM_SELECT(Class.CONFIRM, 10),
    CONFIRM_SELECT_OK(Class.CONFIRM, 11);

    private final Class methodClass;
    private final short methodId;

    AmqpMethod(Class methodClass, int methodId) {
        this.methodClass = methodClass;
        this.methodId = (short) methodId;
    }

    public Class getMethodClass() {
        return methodClass;
    }

    public short getClassId() {
        return methodClass.getValue();
    }

    public short getMethodId() {
        return methodId;
    }

    /**
     * True for methods that carry content (a header frame and body frames follow).
     */
    public boolean hasContent() {
        return this == BASIC_PUBLISH || this == BASIC_RETURN || this == BASIC_DELIVER || this == BASIC_GET_OK;
    }

    public static AmqpMethod fromIds(short classId, short methodId) {
        for (AmqpMethod method : values()) {
            if (method.getClassId() == classId && method.methodId == methodId) {
                return method;
            }
        }
        throw new AmqpProtocolException("Unknown method: class=" + classId + ", method=" + methodId);
    }

    public enum Class {
        CONNECTION(10),
        CHANNEL(20),
        EXCHANGE(40),
        QUEUE(50),
        BASIC(60),
        CONFIRM(85),
        TX(90);

        private final short value;

        Class(int value) {
            this.value = (short) value;
        }

        public short getValue() {
            return value;
        }
    }
}
