package com.chatwave.exception;

public class InvalidRequestException extends LiveChatException {

    public InvalidRequestException(String message) {
        super(ErrorCode.INVALID_REQUEST, message);
    }
}
