package com.simpleamqp.session;

/**
 * Availability of one slot in the channel table.
 */
public enum ChannelState {
    /** Never opened, reserved, or closed by either end and free for reuse. */
    CLOSED,
    /** Open and idle, ready to be borrowed. */
    OPEN,
    /** Borrowed by an operation in progress. */
    USED
}
