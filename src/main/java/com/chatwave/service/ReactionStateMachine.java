package com.chatwave.service;

import com.chatwave.exception.InvalidRequestException;
import com.chatwave.model.ChatDTOs;
import com.chatwave.model.ChatMessage;
import com.chatwave.model.LiveEventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;

/**
 * At most one reaction per user per message, with toggle and replace semantics.
 *
 * A replace is announced as two events, removed(old) then added(new).
 * Work is serialized per message, so concurrent reactions from different users
 * to the same message both land and reactions on different messages never wait
 * on each other.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReactionStateMachine {

    private static final int MAX_EMOJI_LENGTH = 32;

    private final ChatService chatService;
    private final MessageDispatcher dispatcher;
    private final MessageLocks messageLocks;
    private final TransactionTemplate transactionTemplate;

    /**
     * Toggles {@code emoji} for the user: same emoji again removes it, a different
     * emoji replaces the previous one.
     */
    public ReactionOutcome react(String messageId, String userId, String emoji) {
        String wanted = requireEmoji(emoji);
        ReactionOutcome outcome = messageLocks.withLock(messageId, () -> transactionTemplate.execute(tx -> {
            ChatMessage message = loadReactable(messageId, userId);
            List<ChatDTOs.ReactionPayload> events = new ArrayList<>();

            String previous = message.getReactionsByUser().remove(userId);
            if (previous != null) {
                events.add(event(message, userId, previous, ChatDTOs.ReactionAction.REMOVED));
            }
            if (!wanted.equals(previous)) {
                message.getReactionsByUser().put(userId, wanted);
                events.add(event(message, userId, wanted, ChatDTOs.ReactionAction.ADDED));
            }
            return new ReactionOutcome(messageId, message.getChatId(), message.reactions(), events);
        }));
        publish(outcome);
        return outcome;
    }

    /**
     * Removes the user's reaction if it is {@code emoji}. Anything else is a successful no-op.
     */
    public ReactionOutcome removeReaction(String messageId, String userId, String emoji) {
        String target = requireEmoji(emoji);
        ReactionOutcome outcome = messageLocks.withLock(messageId, () -> transactionTemplate.execute(tx -> {
            ChatMessage message = loadReactable(messageId, userId);
            List<ChatDTOs.ReactionPayload> events = new ArrayList<>();
            if (target.equals(message.getReactionsByUser().get(userId))) {
                message.getReactionsByUser().remove(userId);
                events.add(event(message, userId, target, ChatDTOs.ReactionAction.REMOVED));
            } else {
                log.debug("No {} reaction from {} on message {}, nothing to remove", target, userId, messageId);
            }
            return new ReactionOutcome(messageId, message.getChatId(), message.reactions(), events);
        }));
        publish(outcome);
        return outcome;
    }

    private ChatMessage loadReactable(String messageId, String userId) {
        ChatMessage message = chatService.requireMessage(messageId);
        chatService.requireParticipant(message.getChatId(), userId);
        if (message.isDeleted()) {
            throw new InvalidRequestException("Message was deleted");
        }
        return message;
    }

    private void publish(ReactionOutcome outcome) {
        for (ChatDTOs.ReactionPayload event : outcome.getEvents()) {
            dispatcher.publishToChat(outcome.getChatId(), LiveEventType.REACTION_CHANGED, event);
        }
    }

    private ChatDTOs.ReactionPayload event(ChatMessage message, String userId, String emoji,
                                           ChatDTOs.ReactionAction action) {
        return ChatDTOs.ReactionPayload.builder()
                .messageId(message.getId())
                .chatId(message.getChatId())
                .userId(userId)
                .emoji(emoji)
                .action(action)
                .reactions(message.reactions())
                .build();
    }

    private String requireEmoji(String emoji) {
        if (emoji == null || emoji.isBlank()) {
            throw new InvalidRequestException("Emoji is required");
        }
        String trimmed = emoji.trim();
        if (trimmed.length() > MAX_EMOJI_LENGTH) {
            throw new InvalidRequestException("Emoji is too long");
        }
        return trimmed;
    }
}
