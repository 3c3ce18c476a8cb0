package com.chatwave.model;

/**
 * Delivery state of a message. Ordered: a message only ever moves forward.
 */
public enum MessageStatus {
    SENT,
    DELIVERED,
    READ;

    /** Returns the later of this status and {@code next}. */
    public MessageStatus advanceTo(MessageStatus next) {
        return next.ordinal() > ordinal() ? next : this;
    }
}
