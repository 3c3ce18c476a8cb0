package com.chatwave.exception;

public class PermissionDeniedException extends LiveChatException {

    public PermissionDeniedException(String message) {
        super(ErrorCode.PERMISSION_DENIED, message);
    }
}
