package com.chatwave.model;

import lombok.*;

import java.time.Instant;

/**
 * Envelope for everything pushed to a session on {@code /user/queue/events}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LiveEvent {
    private LiveEventType type;
    private String chatId;
    private Object payload;
    private Instant timestamp;

    public static LiveEvent of(LiveEventType type, String chatId, Object payload, Instant timestamp) {
        return new LiveEvent(type, chatId, payload, timestamp);
    }
}
