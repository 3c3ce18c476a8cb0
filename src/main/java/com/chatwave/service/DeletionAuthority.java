package com.chatwave.service;

import com.chatwave.config.LiveChatProperties;
import com.chatwave.exception.PermissionDeniedException;
import com.chatwave.exception.WindowExpiredException;
import com.chatwave.model.ChatDTOs;
import com.chatwave.model.ChatMessage;
import com.chatwave.model.LiveEventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * Two kinds of delete that never mix:
 * <ul>
 * <li>delete for me: a silent, per-viewer hide with no time limit;</li>
 * <li>delete for everyone: sender only, within the delete window, replaces the
 * content with a placeholder and is announced to the chat.</li>
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeletionAuthority {

    private final ChatService chatService;
    private final MessageDispatcher dispatcher;
    private final MessageLocks messageLocks;
    private final TransactionTemplate transactionTemplate;
    private final LiveChatProperties properties;
    private final Clock clock;

    /** Hides the message from {@code userId} only. Never broadcast. */
    public ChatDTOs.OperationResult deleteForMe(String messageId, String userId) {
        boolean changed = messageLocks.withLock(messageId, () -> transactionTemplate.execute(tx -> {
            ChatMessage message = chatService.requireMessage(messageId);
            chatService.requireParticipant(message.getChatId(), userId);
            return message.getDeletedFor().add(userId);
        }));
        if (changed) {
            log.info("Message {} hidden for {}", messageId, userId);
        }
        return new ChatDTOs.OperationResult(messageId, changed);
    }

    /**
     * @throws PermissionDeniedException unless {@code requesterId} sent the message
     * @throws WindowExpiredException    once the delete window has passed
     */
    public ChatDTOs.OperationResult deleteForEveryone(String messageId, String requesterId) {
        Duration window = properties.getDeleteWindow();
        String placeholder = properties.getDeletedPlaceholder();

        ChatMessage deleted = messageLocks.withLock(messageId, () -> transactionTemplate.execute(tx -> {
            ChatMessage message = chatService.requireMessage(messageId);
            if (!message.getSenderId().equals(requesterId)) {
                throw new PermissionDeniedException("Only the sender can delete a message for everyone");
            }
            if (Duration.between(message.getCreatedAt(), clock.instant()).compareTo(window) > 0) {
                throw new WindowExpiredException("Messages can only be deleted for everyone within " + window.toHours() + "h");
            }
            if (message.isDeleted()) {
                return null;
            }
            message.setDeleted(true);
            message.setContent(placeholder);
            return message;
        }));
        if (deleted == null) {
            log.debug("Message {} already deleted for everyone", messageId);
            return new ChatDTOs.OperationResult(messageId, false);
        }
        log.info("Message {} deleted for everyone by {}", messageId, requesterId);

        ChatDTOs.DeletionPayload payload = ChatDTOs.DeletionPayload.builder()
                .messageId(messageId)
                .chatId(deleted.getChatId())
                .placeholder(placeholder)
                .build();
        dispatcher.publishToChat(deleted.getChatId(), LiveEventType.MESSAGE_DELETED, payload);
        return new ChatDTOs.OperationResult(messageId, true);
    }
}
