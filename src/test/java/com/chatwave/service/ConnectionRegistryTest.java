package com.chatwave.service;

import com.chatwave.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConnectionRegistryTest {

    private MutableClock clock;
    private ConnectionRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        registry = new ConnectionRegistry(clock);
    }

    @Test
    void registerIsIdempotent() {
        assertThat(registry.register("s1", "alice")).isTrue();
        assertThat(registry.register("s1", "alice")).isFalse();

        assertThat(registry.sessionsOf("alice")).containsExactly("s1");
        assertThat(registry.getSession("s1")).hasValueSatisfying(s ->
                assertThat(s.getConnectedAt()).isEqualTo(MutableClock.EPOCH));
    }

    @Test
    void sessionCannotBeRebound() {
        registry.register("s1", "alice");

        assertThatThrownBy(() -> registry.register("s1", "mallory"))
                .isInstanceOf(IllegalStateException.class);
        assertThat(registry.userOf("s1")).contains("alice");
    }

    @Test
    void unregisterReportsOnlyTheLastSession() {
        registry.register("phone", "alice");
        registry.register("laptop", "alice");

        assertThat(registry.unregister("phone")).isFalse();
        assertThat(registry.isOnline("alice")).isTrue();

        assertThat(registry.unregister("laptop")).isTrue();
        assertThat(registry.isOnline("alice")).isFalse();
        assertThat(registry.sessionsOf("alice")).isEmpty();
    }

    @Test
    void unregisterOfUnknownSessionIsHarmless() {
        assertThat(registry.unregister("ghost")).isFalse();
    }

    @Test
    void sessionsOfReturnsSnapshot() {
        registry.register("s1", "alice");
        var snapshot = registry.sessionsOf("alice");

        registry.register("s2", "alice");

        assertThat(snapshot).containsExactly("s1");
    }

    @Test
    void massDisconnectLeavesNobodyOnline() throws Exception {
        int users = 50;
        int sessionsPerUser = 4;
        for (int u = 0; u < users; u++) {
            for (int s = 0; s < sessionsPerUser; s++) {
                registry.register("u" + u + "-s" + s, "u" + u);
            }
        }

        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<java.util.concurrent.Future<Boolean>> results = new ArrayList<>();
        for (String sessionId : registry.sessionIds()) {
            results.add(pool.submit(() -> {
                start.await();
                return registry.unregister(sessionId);
            }));
        }
        start.countDown();

        int lastSessionReports = 0;
        for (var result : results) {
            if (result.get(10, TimeUnit.SECONDS)) {
                lastSessionReports++;
            }
        }
        pool.shutdown();

        assertThat(lastSessionReports).isEqualTo(users);
        for (int u = 0; u < users; u++) {
            assertThat(registry.isOnline("u" + u)).isFalse();
        }
        assertThat(registry.sessionIds()).isEmpty();
    }
}
