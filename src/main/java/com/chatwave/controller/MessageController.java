package com.chatwave.controller;

import com.chatwave.model.ChatDTOs;
import com.chatwave.security.TokenVerifier;
import com.chatwave.service.*;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST mirror of the live operations. Every call carries a bearer token.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class MessageController {

    private final TokenVerifier tokenVerifier;
    private final MessageService messageService;
    private final ReactionStateMachine reactions;
    private final DeletionAuthority deletionAuthority;
    private final StatusTransitionEngine statusEngine;
    private final PresenceTracker presenceTracker;

    /** Viewer-filtered message history, page 0 being the most recent */
    @GetMapping("/chats/{chatId}/messages")
    public ResponseEntity<List<ChatDTOs.MessagePayload>> getMessages(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @PathVariable String chatId,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(required = false) Integer size) {
        String viewerId = tokenVerifier.verifyHeader(authorization).getUserId();
        return ResponseEntity.ok(messageService.getHistory(chatId, viewerId, page, size));
    }

    @PostMapping("/chats/{chatId}/messages")
    public ResponseEntity<ChatDTOs.MessagePayload> sendMessage(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @PathVariable String chatId,
            @RequestBody ChatDTOs.SendMessageRequest request) {
        String senderId = tokenVerifier.verifyHeader(authorization).getUserId();
        return ResponseEntity.ok(messageService.sendMessage(chatId, senderId, request));
    }

    @PutMapping("/messages/{messageId}")
    public ResponseEntity<ChatDTOs.MessagePayload> editMessage(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @PathVariable String messageId,
            @RequestBody ChatDTOs.EditMessageRequest request) {
        String editorId = tokenVerifier.verifyHeader(authorization).getUserId();
        return ResponseEntity.ok(messageService.editMessage(messageId, editorId, request.getContent()));
    }

    @DeleteMapping("/messages/{messageId}")
    public ResponseEntity<ChatDTOs.OperationResult> deleteMessage(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @PathVariable String messageId,
            @RequestParam(defaultValue = "false") boolean forEveryone) {
        String userId = tokenVerifier.verifyHeader(authorization).getUserId();
        return ResponseEntity.ok(forEveryone
                ? deletionAuthority.deleteForEveryone(messageId, userId)
                : deletionAuthority.deleteForMe(messageId, userId));
    }

    @PostMapping("/messages/{messageId}/react")
    public ResponseEntity<ReactionOutcome> react(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @PathVariable String messageId,
            @RequestBody ChatDTOs.ReactionRequest request) {
        String userId = tokenVerifier.verifyHeader(authorization).getUserId();
        return ResponseEntity.ok(reactions.react(messageId, userId, request.getEmoji()));
    }

    @DeleteMapping("/messages/{messageId}/react")
    public ResponseEntity<ReactionOutcome> removeReaction(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @PathVariable String messageId,
            @RequestParam String emoji) {
        String userId = tokenVerifier.verifyHeader(authorization).getUserId();
        return ResponseEntity.ok(reactions.removeReaction(messageId, userId, emoji));
    }

    @PostMapping("/messages/{messageId}/read")
    public ResponseEntity<ChatDTOs.OperationResult> markRead(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @PathVariable String messageId) {
        String readerId = tokenVerifier.verifyHeader(authorization).getUserId();
        return ResponseEntity.ok(statusEngine.markRead(messageId, readerId));
    }

    @PostMapping("/messages/{messageId}/delivered")
    public ResponseEntity<ChatDTOs.OperationResult> markDelivered(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @PathVariable String messageId) {
        String recipientId = tokenVerifier.verifyHeader(authorization).getUserId();
        return ResponseEntity.ok(statusEngine.markDelivered(messageId, recipientId));
    }

    @GetMapping("/presence/{userId}")
    public ResponseEntity<ChatDTOs.PresencePayload> getPresence(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @PathVariable String userId) {
        tokenVerifier.verifyHeader(authorization);
        return ResponseEntity.ok(presenceTracker.presenceOf(userId));
    }
}
