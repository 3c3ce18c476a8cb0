package com.chatwave.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.*;

@Entity
@Table(name = "messages", indexes = @Index(name = "idx_messages_chat_created", columnList = "chatId, createdAt"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChatMessage {

    @Id
    private String id;

    @Column(nullable = false)
    private String chatId;

    @Column(nullable = false)
    private String senderId;

    @Column(nullable = false, length = 4000)
    private String content;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private MessageType type = MessageType.TEXT;

    private String replyTo;

    @Column(nullable = false)
    private Instant createdAt;

    private Instant editedAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private MessageStatus status = MessageStatus.SENT;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "message_read_by", joinColumns = @JoinColumn(name = "message_id"))
    @Column(name = "user_id")
    @Builder.Default
    private Set<String> readBy = new HashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "message_delivered_to", joinColumns = @JoinColumn(name = "message_id"))
    @Column(name = "user_id")
    @Builder.Default
    private Set<String> deliveredTo = new HashSet<>();

    // userId → emoji; one row per user keeps "one reaction per user" structural
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "message_reactions", joinColumns = @JoinColumn(name = "message_id"))
    @MapKeyColumn(name = "user_id")
    @Column(name = "emoji", nullable = false)
    @Builder.Default
    private Map<String, String> reactionsByUser = new HashMap<>();

    @Column(nullable = false)
    private boolean deleted;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "message_deleted_for", joinColumns = @JoinColumn(name = "message_id"))
    @Column(name = "user_id")
    @Builder.Default
    private Set<String> deletedFor = new HashSet<>();

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    /** Reactions grouped by emoji, in a stable order. Empty buckets never appear. */
    public Map<String, Set<String>> reactions() {
        Map<String, Set<String>> grouped = new TreeMap<>();
        reactionsByUser.forEach((userId, emoji) ->
                grouped.computeIfAbsent(emoji, e -> new TreeSet<>()).add(userId));
        return grouped;
    }

    public enum MessageType {
        TEXT,
        IMAGE,
        VIDEO,
        AUDIO,
        FILE,
        VOICE,
        SYSTEM      // generated by the server
    }
}
