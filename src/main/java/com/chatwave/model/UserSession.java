package com.chatwave.model;

import lombok.*;

import java.time.Instant;

/** One authenticated live connection. A user may hold several. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserSession {
    private String sessionId;
    private String userId;
    private Instant connectedAt;
}
