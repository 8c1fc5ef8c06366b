package com.mender.core.scheduler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ClaimTableTest {

    private final ClaimTable table = new ClaimTable();
    private final Instant now = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    @DisplayName("a key can be claimed once until released")
    void claimOnce() {
        assertTrue(table.tryClaim("healing_mission:a", now).isPresent());
        assertTrue(table.tryClaim("healing_mission:a", now).isEmpty());
        assertEquals(1, table.size());

        table.release("healing_mission:a");

        assertFalse(table.contains("healing_mission:a"));
        assertTrue(table.tryClaim("healing_mission:a", now).isPresent());
    }

    @Test
    @DisplayName("attach records the task on a live claim only")
    void attach() {
        var claim = table.tryClaim("healing_mission:a", now).orElseThrow();
        var task = CompletableFuture.completedFuture(null);

        table.attach("healing_mission:a", task);
        table.attach("healing_mission:b", task);

        assertSame(task, claim.getTask().orElseThrow());
        assertEquals(now, claim.getClaimedAt());
        assertEquals(1, table.claims().size());
    }

    @Test
    @DisplayName("concurrent claims of one key admit exactly one")
    void concurrentClaims() throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        var start = new CountDownLatch(1);
        var winners = new AtomicInteger();
        try {
            for (int i = 0; i < 32; i++) {
                pool.submit(() -> {
                    start.await();
                    if (table.tryClaim("healing_mission:a", now).isPresent()) {
                        winners.incrementAndGet();
                    }
                    return null;
                });
            }
            start.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, winners.get());
    }
}
