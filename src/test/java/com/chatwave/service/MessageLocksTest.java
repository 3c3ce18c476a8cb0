package com.chatwave.service;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class MessageLocksTest {

    private final MessageLocks locks = new MessageLocks();

    @Test
    void differentMessagesDoNotBlockEachOther() throws Exception {
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);

        Future<?> holder = pool.submit(() -> locks.withLock("m1", () -> {
            holding.countDown();
            await(release);
            return null;
        }));
        holding.await(5, TimeUnit.SECONDS);

        Future<String> other = pool.submit(() -> locks.withLock("m2", () -> "done"));
        assertThat(other.get(5, TimeUnit.SECONDS)).isEqualTo("done");

        release.countDown();
        holder.get(5, TimeUnit.SECONDS);
        pool.shutdown();
    }

    @Test
    void sameMessageIsSerialized() throws Exception {
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            futures.add(pool.submit(() -> locks.withLock("m1", () -> {
                int now = inside.incrementAndGet();
                maxInside.accumulateAndGet(now, Math::max);
                inside.decrementAndGet();
                return null;
            })));
        }
        for (Future<?> f : futures) {
            f.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertThat(maxInside.get()).isEqualTo(1);
        assertThat(locks.size()).isZero();
    }

    @Test
    void lockIsReleasedWhenActionThrows() {
        try {
            locks.withLock("m1", () -> {
                throw new IllegalStateException("boom");
            });
        } catch (IllegalStateException expected) {
            // fall through
        }

        assertThat(locks.withLock("m1", () -> "again")).isEqualTo("again");
        assertThat(locks.size()).isZero();
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
