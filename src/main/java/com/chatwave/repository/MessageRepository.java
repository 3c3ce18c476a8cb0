package com.chatwave.repository;

import com.chatwave.model.ChatMessage;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface MessageRepository extends JpaRepository<ChatMessage, String> {

    /**
     * Fetch a page of a chat's messages visible to one viewer, newest first.
     * Messages the viewer deleted for themselves are excluded entirely.
     */
    @Query("SELECT m FROM ChatMessage m WHERE m.chatId = :chatId "
            + "AND :viewerId NOT MEMBER OF m.deletedFor ORDER BY m.createdAt DESC, m.id DESC")
    List<ChatMessage> findVisibleForViewer(@Param("chatId") String chatId,
                                           @Param("viewerId") String viewerId,
                                           Pageable pageable);

    long countByChatId(String chatId);
}
