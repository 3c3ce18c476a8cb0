package com.chatwave.exception;

import lombok.Getter;

/**
 * Validation failure reported synchronously to the initiating client.
 */
@Getter
public abstract class LiveChatException extends RuntimeException {

    private final ErrorCode code;

    protected LiveChatException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }
}
