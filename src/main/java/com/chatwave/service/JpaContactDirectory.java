package com.chatwave.service;

import com.chatwave.repository.AppUserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class JpaContactDirectory implements ContactDirectory {

    private final AppUserRepository userRepository;

    @Override
    @Transactional(readOnly = true)
    public Set<String> contactsOf(String userId) {
        return userRepository.findById(userId)
                .map(user -> Set.copyOf(user.getContacts()))
                .orElse(Set.of());
    }

    @Override
    @Transactional
    public void recordPresence(String userId, boolean online, Instant at) {
        userRepository.findById(userId).ifPresentOrElse(user -> {
            user.setOnline(online);
            user.setLastSeen(at);
        }, () -> log.debug("No user record for {}, presence not stored", userId));
    }

    @Override
    @Transactional(readOnly = true)
    public Presence presenceOf(String userId) {
        return userRepository.findById(userId)
                .map(user -> new Presence(user.getId(), user.isOnline(), user.getLastSeen()))
                .orElse(new Presence(userId, false, null));
    }
}
