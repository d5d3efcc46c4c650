package com.simpleamqp.exception;

public class ChannelClosedException extends AmqpServerException {
    private final int channel;

    public ChannelClosedException(int channel, int replyCode, String replyText, int classId, int methodId) {
        super("Channel " + channel, replyCode, replyText, classId, methodId);
        this.channel = channel;
    }

    public int getChannel() {
        return channel;
    }

    @Override
    public boolean isHardError() {
        return false;
    }
}
