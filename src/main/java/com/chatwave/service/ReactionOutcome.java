package com.chatwave.service;

import com.chatwave.model.ChatDTOs;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

/** Final reaction state of a message plus the events the change produced, in order. */
@Value
public class ReactionOutcome {
    String messageId;
    String chatId;
    Map<String, Set<String>> reactions;
    List<ChatDTOs.ReactionPayload> events;

    public boolean isChanged() {
        return !events.isEmpty();
    }
}
