package com.chatwave.exception;

public class NotFoundException extends LiveChatException {

    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }

    public static NotFoundException message(String messageId) {
        return new NotFoundException("Message not found: " + messageId);
    }

    public static NotFoundException chat(String chatId) {
        return new NotFoundException("Chat not found: " + chatId);
    }
}
