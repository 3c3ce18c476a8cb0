package com.chatwave.controller;

import com.chatwave.exception.LiveChatException;
import com.chatwave.model.ChatDTOs;
import com.chatwave.security.AuthenticationFailedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(LiveChatException.class)
    public ResponseEntity<ChatDTOs.ErrorPayload> handleLiveChat(LiveChatException e) {
        HttpStatus status = switch (e.getCode()) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case PERMISSION_DENIED -> HttpStatus.FORBIDDEN;
            case WINDOW_EXPIRED -> HttpStatus.GONE;
            case INVALID_REQUEST -> HttpStatus.BAD_REQUEST;
        };
        return error(status, e.getMessage(), e.getCode().name());
    }

    @ExceptionHandler({AuthenticationFailedException.class, MissingRequestHeaderException.class})
    public ResponseEntity<ChatDTOs.ErrorPayload> handleUnauthenticated(Exception e) {
        return error(HttpStatus.UNAUTHORIZED, "Authentication required", "UNAUTHENTICATED");
    }

    private ResponseEntity<ChatDTOs.ErrorPayload> error(HttpStatus status, String message, String code) {
        return ResponseEntity.status(status)
                .body(ChatDTOs.ErrorPayload.builder().message(message).code(code).build());
    }
}
