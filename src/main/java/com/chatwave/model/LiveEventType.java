package com.chatwave.model;

/** Outbound event names as seen by clients. */
public enum LiveEventType {
    MESSAGE_NEW,
    MESSAGE_EDITED,
    MESSAGE_DELETED,
    MESSAGE_STATUS,
    REACTION_CHANGED,
    TYPING_CHANGED,
    PRESENCE_CHANGED,
    USER_JOINED,
    HISTORY
}
