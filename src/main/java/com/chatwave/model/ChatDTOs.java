package com.chatwave.model;

import lombok.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * All DTOs (Data Transfer Objects) used in WebSocket and REST communication.
 * Identity is never part of an inbound payload: it comes from the authenticated session.
 */
public class ChatDTOs {

    // ── Inbound (Client → Server) ─────────────────────────────────────────────

    /** join_room / leave_room */
    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    public static class RoomRequest {
        private String chatId;
    }

    /** send_message */
    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    public static class SendMessageRequest {
        private String chatId;
        private String content;
        private ChatMessage.MessageType type;
        private String replyTo;
    }

    /** edit_message */
    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    public static class EditMessageRequest {
        private String messageId;
        private String content;
    }

    /** typing_start / typing_stop */
    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    public static class TypingRequest {
        private String chatId;
        private boolean typing;
    }

    /** react / remove_reaction */
    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    public static class ReactionRequest {
        private String messageId;
        private String emoji;
    }

    /** delete_message */
    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    public static class DeleteRequest {
        private String messageId;
        private boolean forEveryone;
    }

    /** mark_read / mark_delivered */
    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    public static class ReceiptRequest {
        private String messageId;
    }

    // ── Outbound (Server → Client) ────────────────────────────────────────────

    /** Full message as seen by a viewer */
    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    public static class MessagePayload {
        private String id;
        private String chatId;
        private String senderId;
        private String content;
        private ChatMessage.MessageType type;
        private String replyTo;
        private MessageStatus status;
        private Set<String> readBy;
        private Set<String> deliveredTo;
        private Map<String, Set<String>> reactions;
        private boolean deleted;
        private Instant createdAt;
        private Instant editedAt;
    }

    /** message_deleted: a global tombstone, never sent for a local hide */
    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    public static class DeletionPayload {
        private String messageId;
        private String chatId;
        private String placeholder;
    }

    /** message_status */
    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    public static class StatusPayload {
        private String messageId;
        private String chatId;
        private MessageStatus status;
        private String userId;
        private Set<String> readBy;
        private Set<String> deliveredTo;
        private boolean readByAll;
    }

    /** reaction_changed: one event per bucket change */
    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    public static class ReactionPayload {
        private String messageId;
        private String chatId;
        private String userId;
        private String emoji;
        private ReactionAction action;
        private Map<String, Set<String>> reactions;
    }

    public enum ReactionAction {
        ADDED,
        REMOVED
    }

    /** typing_changed */
    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    public static class TypingPayload {
        private String chatId;
        private String userId;
        private boolean typing;
        private Instant expiresAt;
    }

    /** presence_changed */
    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    public static class PresencePayload {
        private String userId;
        private boolean online;
        private Instant lastSeen;
    }

    /** user_joined */
    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    public static class MembershipPayload {
        private String chatId;
        private String userId;
    }

    /** Error payload */
    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    public static class ErrorPayload {
        private String message;
        private String code;
    }

    /** History payload: viewer-filtered page of past messages, sent on room join */
    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    public static class HistoryPayload {
        private String chatId;
        private List<MessagePayload> messages;
    }

    /** Result of a per-viewer operation that may be a no-op */
    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    public static class OperationResult {
        private String messageId;
        private boolean changed;
    }
}
