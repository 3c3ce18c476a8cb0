package com.chatwave.config;

import com.chatwave.model.AppUser;
import com.chatwave.model.Chat;
import com.chatwave.repository.AppUserRepository;
import com.chatwave.repository.ChatRepository;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Seeds two demo users who are contacts of each other and a direct chat between them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DataInitializer {

    public static final String DEMO_CHAT_ID = "demo-direct";

    private final AppUserRepository userRepository;
    private final ChatRepository chatRepository;
    private final LiveChatProperties properties;

    @PostConstruct
    public void seed() {
        if (!properties.isSeedDemoData() || chatRepository.existsById(DEMO_CHAT_ID)) return;

        List<AppUser> users = List.of(
            buildUser("alice", "Alice", "bob"),
            buildUser("bob", "Bob", "alice")
        );
        userRepository.saveAll(users);

        chatRepository.save(Chat.builder()
                .id(DEMO_CHAT_ID)
                .type(Chat.ChatType.DIRECT)
                .createdBy("alice")
                .participants(new HashSet<>(Set.of("alice", "bob")))
                .build());
        log.info("Seeded {} demo users and chat '{}'", users.size(), DEMO_CHAT_ID);
    }

    private AppUser buildUser(String id, String displayName, String contact) {
        return AppUser.builder()
                .id(id)
                .username(id)
                .displayName(displayName)
                .contacts(new HashSet<>(Set.of(contact)))
                .build();
    }
}
