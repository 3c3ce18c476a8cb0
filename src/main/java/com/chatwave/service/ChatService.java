package com.chatwave.service;

import com.chatwave.exception.NotFoundException;
import com.chatwave.exception.PermissionDeniedException;
import com.chatwave.model.Chat;
import com.chatwave.model.ChatMessage;
import com.chatwave.repository.ChatRepository;
import com.chatwave.repository.MessageRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Lookups and participation checks against the durable chat store.
 */
@Service
@RequiredArgsConstructor
public class ChatService {

    private final ChatRepository chatRepository;
    private final MessageRepository messageRepository;

    public Chat requireChat(String chatId) {
        return chatRepository.findById(chatId).orElseThrow(() -> NotFoundException.chat(chatId));
    }

    public Chat requireParticipant(String chatId, String userId) {
        Chat chat = requireChat(chatId);
        if (!chat.hasParticipant(userId)) {
            throw new PermissionDeniedException("Not a participant of this chat");
        }
        return chat;
    }

    public ChatMessage requireMessage(String messageId) {
        return messageRepository.findById(messageId).orElseThrow(() -> NotFoundException.message(messageId));
    }

}
