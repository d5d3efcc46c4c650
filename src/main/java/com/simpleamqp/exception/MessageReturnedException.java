package com.simpleamqp.exception;

import com.simpleamqp.model.Message;

/**
 * A mandatory or immediate publish could not be routed and came back with basic.return.
 */
public class MessageReturnedException extends AmqpException {
    private final transient Message returnedMessage;
    private final int replyCode;
    private final String replyText;
    private final String exchange;
    private final String routingKey;

    public MessageReturnedException(Message returnedMessage, int replyCode, String replyText,
                                    String exchange, String routingKey) {
        super("Message returned. Reply code: " + replyCode + " " + replyText);
        this.returnedMessage = returnedMessage;
        this.replyCode = replyCode;
        this.replyText = replyText;
        this.exchange = exchange;
        this.routingKey = routingKey;
    }

    public Message getReturnedMessage() {
        return returnedMessage;
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
