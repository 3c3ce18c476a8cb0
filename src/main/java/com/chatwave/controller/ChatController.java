package com.chatwave.controller;

import com.chatwave.exception.LiveChatException;
import com.chatwave.model.ChatDTOs;
import com.chatwave.security.UserIdentity;
import com.chatwave.service.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

import java.security.Principal;

/**
 * Handles all inbound WebSocket messages from clients.
 *
 * Flow:
 *  Client → /app/chat.join            → join_room
 *  Client → /app/chat.leave           → leave_room
 *  Client → /app/chat.typing          → typing_start / typing_stop
 *  Client → /app/chat.send            → send_message
 *  Client → /app/chat.edit            → edit_message
 *  Client → /app/chat.react           → react
 *  Client → /app/chat.unreact         → remove_reaction
 *  Client → /app/chat.delete          → delete_message
 *  Client → /app/chat.read            → mark_read
 *  Client → /app/chat.delivered       → mark_delivered
 *
 * The acting user is always the session principal bound at CONNECT.
 */
@Slf4j
@Controller
@RequiredArgsConstructor
public class ChatController {

    private final LiveSessionCoordinator sessionCoordinator;
    private final TypingIndicatorTracker typingTracker;
    private final MessageService messageService;
    private final ReactionStateMachine reactions;
    private final DeletionAuthority deletionAuthority;
    private final StatusTransitionEngine statusEngine;
    private final SessionGateway sessionGateway;

    // ── Rooms ──────────────────────────────────────────────────────────────────

    @MessageMapping("/chat.join")
    public void joinRoom(@Payload ChatDTOs.RoomRequest request, Principal principal,
                         SimpMessageHeaderAccessor headerAccessor) {
        sessionCoordinator.joinRoom(headerAccessor.getSessionId(), userId(principal), request.getChatId());
    }

    @MessageMapping("/chat.leave")
    public void leaveRoom(@Payload ChatDTOs.RoomRequest request, Principal principal,
                          SimpMessageHeaderAccessor headerAccessor) {
        sessionCoordinator.leaveRoom(headerAccessor.getSessionId(), userId(principal), request.getChatId());
    }

    // ── Typing Indicator ───────────────────────────────────────────────────────

    @MessageMapping("/chat.typing")
    public void handleTyping(@Payload ChatDTOs.TypingRequest request, Principal principal,
                             SimpMessageHeaderAccessor headerAccessor) {
        typingTracker.setTyping(request.getChatId(), userId(principal), headerAccessor.getSessionId(), request.isTyping());
    }

    // ── Messages ───────────────────────────────────────────────────────────────

    @MessageMapping("/chat.send")
    public void sendMessage(@Payload ChatDTOs.SendMessageRequest request, Principal principal) {
        messageService.sendMessage(request.getChatId(), userId(principal), request);
    }

    @MessageMapping("/chat.edit")
    public void editMessage(@Payload ChatDTOs.EditMessageRequest request, Principal principal) {
        messageService.editMessage(request.getMessageId(), userId(principal), request.getContent());
    }

    @MessageMapping("/chat.react")
    public void react(@Payload ChatDTOs.ReactionRequest request, Principal principal) {
        reactions.react(request.getMessageId(), userId(principal), request.getEmoji());
    }

    @MessageMapping("/chat.unreact")
    public void removeReaction(@Payload ChatDTOs.ReactionRequest request, Principal principal) {
        reactions.removeReaction(request.getMessageId(), userId(principal), request.getEmoji());
    }

    @MessageMapping("/chat.delete")
    public void deleteMessage(@Payload ChatDTOs.DeleteRequest request, Principal principal) {
        if (request.isForEveryone()) {
            deletionAuthority.deleteForEveryone(request.getMessageId(), userId(principal));
        } else {
            deletionAuthority.deleteForMe(request.getMessageId(), userId(principal));
        }
    }

    @MessageMapping("/chat.read")
    public void markRead(@Payload ChatDTOs.ReceiptRequest request, Principal principal) {
        statusEngine.markRead(request.getMessageId(), userId(principal));
    }

    @MessageMapping("/chat.delivered")
    public void markDelivered(@Payload ChatDTOs.ReceiptRequest request, Principal principal) {
        statusEngine.markDelivered(request.getMessageId(), userId(principal));
    }

    // ── Errors ─────────────────────────────────────────────────────────────────

    @MessageExceptionHandler(LiveChatException.class)
    public void handleLiveChatError(LiveChatException e, SimpMessageHeaderAccessor headerAccessor) {
        String sessionId = headerAccessor.getSessionId();
        log.debug("Rejected request from session {}: {} {}", sessionId, e.getCode(), e.getMessage());
        sessionGateway.sendError(sessionId, ChatDTOs.ErrorPayload.builder()
                .message(e.getMessage())
                .code(e.getCode().name())
                .build());
    }

    // ── Helpers ────────────────────────────────────────────────────────────────

    private String userId(Principal principal) {
        if (!(principal instanceof UserIdentity)) {
            throw new IllegalStateException("Session has no verified identity");
        }
        return ((UserIdentity) principal).getUserId();
    }
}
