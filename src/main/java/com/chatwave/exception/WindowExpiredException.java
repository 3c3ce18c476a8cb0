package com.chatwave.exception;

public class WindowExpiredException extends LiveChatException {

    public WindowExpiredException(String message) {
        super(ErrorCode.WINDOW_EXPIRED, message);
    }
}
