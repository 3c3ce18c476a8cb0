package com.chatwave.service;

import lombok.Value;

/** Published when a session stops following a chat, explicitly or by disconnecting. */
@Value
public class RoomLeftEvent {
    String chatId;
    String sessionId;
    String userId;
}
