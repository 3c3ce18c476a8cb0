package com.chatwave.service;

import com.chatwave.config.LiveChatProperties;
import com.chatwave.exception.InvalidRequestException;
import com.chatwave.exception.PermissionDeniedException;
import com.chatwave.model.ChatDTOs;
import com.chatwave.model.ChatMessage;
import com.chatwave.model.LiveEventType;
import com.chatwave.repository.MessageRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Sending, editing and reading back messages. Every mutation is committed
 * before it is pushed to live sessions.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MessageService {

    private static final int MAX_CONTENT_LENGTH = 4000;

    private final MessageRepository messageRepository;
    private final ChatService chatService;
    private final MessageDispatcher dispatcher;
    private final MessageLocks messageLocks;
    private final TransactionTemplate transactionTemplate;
    private final LiveChatProperties properties;
    private final Clock clock;

    public ChatDTOs.MessagePayload sendMessage(String chatId, String senderId, ChatDTOs.SendMessageRequest request) {
        String content = requireContent(request.getContent());
        ChatMessage.MessageType type = request.getType() == null ? ChatMessage.MessageType.TEXT : request.getType();

        ChatDTOs.MessagePayload saved = transactionTemplate.execute(tx -> {
            chatService.requireParticipant(chatId, senderId);
            ChatMessage message = ChatMessage.builder()
                    .chatId(chatId)
                    .senderId(senderId)
                    .content(content)
                    .type(type)
                    .replyTo(request.getReplyTo())
                    .createdAt(clock.instant())
                    .build();
            return toPayload(messageRepository.save(message));
        });
        log.info("Message {} persisted in chat {} by {}", saved.getId(), chatId, senderId);

        dispatcher.dispatch(saved);
        return saved;
    }

    public ChatDTOs.MessagePayload editMessage(String messageId, String editorId, String newContent) {
        String content = requireContent(newContent);

        ChatDTOs.MessagePayload edited = messageLocks.withLock(messageId, () -> transactionTemplate.execute(tx -> {
            ChatMessage message = chatService.requireMessage(messageId);
            if (!message.getSenderId().equals(editorId)) {
                throw new PermissionDeniedException("Can only edit your own messages");
            }
            if (message.isDeleted()) {
                throw new InvalidRequestException("Message was deleted");
            }
            message.setContent(content);
            message.setEditedAt(clock.instant());
            return toPayload(message);
        }));
        log.info("Message {} edited by {}", messageId, editorId);

        dispatcher.publishToChat(edited.getChatId(), LiveEventType.MESSAGE_EDITED, edited);
        return edited;
    }

    /**
     * A page of the chat as the viewer sees it, oldest first. Page 0 is the most recent.
     * Messages the viewer deleted for themselves are left out entirely.
     */
    public List<ChatDTOs.MessagePayload> getHistory(String chatId, String viewerId, int page, Integer size) {
        int pageSize = size == null ? properties.getHistoryPageSize() : size;
        if (page < 0 || pageSize < 1 || pageSize > properties.getHistoryMaxPageSize()) {
            throw new InvalidRequestException("Page size must be between 1 and " + properties.getHistoryMaxPageSize());
        }
        if ((long) page * pageSize > Integer.MAX_VALUE) {
            throw new InvalidRequestException("Page " + page + " is out of range");
        }
        return transactionTemplate.execute(tx -> {
            chatService.requireParticipant(chatId, viewerId);
            List<ChatDTOs.MessagePayload> newestFirst = messageRepository
                    .findVisibleForViewer(chatId, viewerId, PageRequest.of(page, pageSize))
                    .stream()
                    .map(this::toPayload)
                    .collect(Collectors.toCollection(ArrayList::new));
            Collections.reverse(newestFirst);
            return newestFirst;
        });
    }

    public ChatDTOs.MessagePayload toPayload(ChatMessage message) {
        return ChatDTOs.MessagePayload.builder()
                .id(message.getId())
                .chatId(message.getChatId())
                .senderId(message.getSenderId())
                .content(message.getContent())
                .type(message.getType())
                .replyTo(message.getReplyTo())
                .status(message.getStatus())
                .readBy(new HashSet<>(message.getReadBy()))
                .deliveredTo(new HashSet<>(message.getDeliveredTo()))
                .reactions(message.reactions())
                .deleted(message.isDeleted())
                .createdAt(message.getCreatedAt())
                .editedAt(message.getEditedAt())
                .build();
    }

    private String requireContent(String raw) {
        String content = sanitize(raw);
        if (content == null || content.isBlank()) {
            throw new InvalidRequestException("Message content is required");
        }
        if (content.length() > MAX_CONTENT_LENGTH) {
            throw new InvalidRequestException("Message content is too long");
        }
        return content;
    }

    private String sanitize(String input) {
        if (input == null) return null;
        // Basic XSS prevention
        return input.trim()
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;");
    }
}
