package org.example.ratelimit.config;

import org.example.ratelimit.model.RateLimitSnapshot;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryRateLimitStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

    @Test
    void upsert_countsWithinWindowAndRestartsAfterIt() {
        InMemoryRateLimitStore store = new InMemoryRateLimitStore();

        store.upsert("user", NOW, NOW.plusSeconds(1));
        RateLimitSnapshot second = store.upsert("user", NOW, NOW.plusSeconds(5));
        RateLimitSnapshot restarted = store.upsert("user", NOW.plusSeconds(1), NOW.plusSeconds(2));

        assertEquals(2, second.count());
        assertEquals(NOW.plusSeconds(1), second.resetTime());
        assertEquals(1, restarted.count());
        assertEquals(NOW.plusSeconds(2), restarted.resetTime());
    }

    @Test
    void findActive_ignoresClosedWindows() {
        InMemoryRateLimitStore store = new InMemoryRateLimitStore();
        store.upsert("user", NOW, NOW.plusSeconds(1));

        assertTrue(store.findActive("user", NOW).isPresent());
        assertTrue(store.findActive("user", NOW.plusSeconds(1)).isEmpty());
    }

    @Test
    void purgeExpired_removesRowsBeforeCutoff() {
        InMemoryRateLimitStore store = new InMemoryRateLimitStore();
        store.upsert("old", NOW, NOW.plusSeconds(1));
        store.upsert("new", NOW, NOW.plusSeconds(10));

        assertEquals(1, store.purgeExpired(NOW.plusSeconds(5)));
        assertEquals(1, store.size());
        assertEquals("in-memory", store.name());
    }
}
