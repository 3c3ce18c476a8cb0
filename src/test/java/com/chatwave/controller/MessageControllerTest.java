package com.chatwave.controller;

import com.chatwave.model.Chat;
import com.chatwave.support.LiveChatIntegrationTest;
import com.chatwave.support.TestTokens;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class MessageControllerTest extends LiveChatIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    private String alice;
    private String bob;
    private String chatId;

    @BeforeEach
    void setUp() {
        alice = createUser("alice");
        bob = createUser("bob");
        chatId = createChat(Chat.ChatType.DIRECT, alice, bob);
    }

    @Test
    void missingTokenIsUnauthorized() throws Exception {
        mockMvc.perform(get("/api/chats/{chatId}/messages", chatId))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHENTICATED"));
    }

    @Test
    void tokenFromAnotherIssuerIsUnauthorized() throws Exception {
        String forged = TestTokens.issue(alice, clock.instant(), Duration.ofHours(1), "elsewhere", TestTokens.SECRET);

        mockMvc.perform(get("/api/chats/{chatId}/messages", chatId)
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + forged))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void sendThenReadHistory() throws Exception {
        mockMvc.perform(post("/api/chats/{chatId}/messages", chatId)
                        .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(alice, clock.instant()))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"hello over rest\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.senderId").value(alice))
                .andExpect(jsonPath("$.status").value("SENT"));

        mockMvc.perform(get("/api/chats/{chatId}/messages", chatId)
                        .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(bob, clock.instant())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].content").value("hello over rest"));
    }

    @Test
    void outsiderIsForbidden() throws Exception {
        String eve = createUser("eve");

        mockMvc.perform(get("/api/chats/{chatId}/messages", chatId)
                        .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(eve, clock.instant())))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("PERMISSION_DENIED"));
    }

    @Test
    void lateDeleteForEveryoneIsGone() throws Exception {
        String messageId = send(chatId, alice, "too late");
        clock.advance(Duration.ofHours(25));

        mockMvc.perform(delete("/api/messages/{messageId}", messageId)
                        .param("forEveryone", "true")
                        .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(alice, clock.instant())))
                .andExpect(status().isGone())
                .andExpect(jsonPath("$.code").value("WINDOW_EXPIRED"));
    }

    @Test
    void unknownMessageIsNotFound() throws Exception {
        mockMvc.perform(post("/api/messages/{messageId}/read", "missing")
                        .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(bob, clock.instant())))
                .andExpect(status().isNotFound());
    }

    @Test
    void reactAndReadOverRest() throws Exception {
        String messageId = send(chatId, alice, "vote");

        mockMvc.perform(post("/api/messages/{messageId}/react", messageId)
                        .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(bob, clock.instant()))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"emoji\":\"👍\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.changed").value(true));

        mockMvc.perform(post("/api/messages/{messageId}/read", messageId)
                        .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(bob, clock.instant())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.changed").value(true));
    }

    @Test
    void blankMessageIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/chats/{chatId}/messages", chatId)
                        .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(alice, clock.instant()))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));
    }

    @Test
    void pageBeyondAnyOffsetIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/chats/{chatId}/messages", chatId)
                        .param("page", "50000000")
                        .param("size", "100")
                        .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(bob, clock.instant())))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));
    }
}
