package com.chatwave.repository;

import com.chatwave.model.Chat;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ChatRepository extends JpaRepository<Chat, String> {

    @Query("SELECT p FROM Chat c JOIN c.participants p WHERE c.id = :chatId")
    List<String> findParticipantIds(@Param("chatId") String chatId);
}
