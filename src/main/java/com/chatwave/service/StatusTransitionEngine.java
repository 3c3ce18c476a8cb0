package com.chatwave.service;

import com.chatwave.exception.InvalidRequestException;
import com.chatwave.model.Chat;
import com.chatwave.model.ChatDTOs;
import com.chatwave.model.ChatMessage;
import com.chatwave.model.LiveEventType;
import com.chatwave.model.MessageStatus;
import lombok.Value;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Read receipts and delivery acknowledgements.
 *
 * Status only moves forward (sent → delivered → read). The read-by set is the
 * ground truth; {@code readByAll} tells group clients whether every other
 * participant has read the message. Changes are pushed to the sender only.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StatusTransitionEngine {

    private final ChatService chatService;
    private final MessageDispatcher dispatcher;
    private final MessageLocks messageLocks;
    private final TransactionTemplate transactionTemplate;

    public ChatDTOs.OperationResult markRead(String messageId, String readerId) {
        return acknowledge(messageId, readerId, MessageStatus.READ);
    }

    public ChatDTOs.OperationResult markDelivered(String messageId, String recipientId) {
        return acknowledge(messageId, recipientId, MessageStatus.DELIVERED);
    }

    private ChatDTOs.OperationResult acknowledge(String messageId, String userId, MessageStatus signal) {
        Transition transition = messageLocks.withLock(messageId, () -> transactionTemplate.execute(tx -> {
            ChatMessage message = chatService.requireMessage(messageId);
            if (message.getSenderId().equals(userId)) {
                throw new InvalidRequestException("Senders do not acknowledge their own messages");
            }
            Chat chat = chatService.requireParticipant(message.getChatId(), userId);

            // reading implies delivery
            boolean changed = message.getDeliveredTo().add(userId);
            if (signal == MessageStatus.READ) {
                changed = message.getReadBy().add(userId) || changed;
            }
            if (!changed) {
                return null;
            }
            MessageStatus next = message.getReadBy().isEmpty() ? MessageStatus.DELIVERED : MessageStatus.READ;
            message.setStatus(message.getStatus().advanceTo(next));
            return new Transition(message.getSenderId(), toPayload(message, chat, userId));
        }));

        if (transition == null) {
            log.debug("{} already recorded for {} on message {}", signal, userId, messageId);
            return new ChatDTOs.OperationResult(messageId, false);
        }
        ChatDTOs.StatusPayload update = transition.getPayload();
        log.info("Message {} is {} after {} from {}", messageId, update.getStatus(), signal, userId);
        dispatcher.publishToUsers(List.of(transition.getSenderId()), LiveEventType.MESSAGE_STATUS, update.getChatId(), update);
        return new ChatDTOs.OperationResult(messageId, true);
    }

    private ChatDTOs.StatusPayload toPayload(ChatMessage message, Chat chat, String userId) {
        Set<String> others = new HashSet<>(chat.getParticipants());
        others.remove(message.getSenderId());
        return ChatDTOs.StatusPayload.builder()
                .messageId(message.getId())
                .chatId(message.getChatId())
                .status(message.getStatus())
                .userId(userId)
                .readBy(new HashSet<>(message.getReadBy()))
                .deliveredTo(new HashSet<>(message.getDeliveredTo()))
                .readByAll(!others.isEmpty() && message.getReadBy().containsAll(others))
                .build();
    }

    @Value
    private static class Transition {
        String senderId;
        ChatDTOs.StatusPayload payload;
    }
}
