package com.chatwave.service;

import com.chatwave.model.ChatDTOs;
import com.chatwave.model.LiveEvent;

/**
 * Transport to one live session. Implementations may throw if the session is gone;
 * callers treat that as a dropped delivery.
 */
public interface SessionGateway {

    void send(String sessionId, LiveEvent event);

    void sendError(String sessionId, ChatDTOs.ErrorPayload error);
}
