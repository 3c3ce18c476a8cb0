package com.chatwave.exception;

public enum ErrorCode {
    NOT_FOUND,
    PERMISSION_DENIED,
    WINDOW_EXPIRED,
    INVALID_REQUEST
}
