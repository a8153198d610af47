package org.example.ratelimit.service;

import org.example.ratelimit.model.RateLimitDecision;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class LocalRateLimitCacheTest {

    private static final long NOW = Instant.parse("2026-03-01T09:00:00Z").toEpochMilli();

    @Mock
    private ScheduledExecutorService executor;

    @Mock
    private ScheduledFuture<Object> sweepTask;

    private LocalRateLimitCache cache;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC);
        cache = new LocalRateLimitCache(clock, Duration.ofSeconds(30), 2, executor);
    }

    @Test
    void tryConsume_withoutEntry_returnsEmpty() {
        assertTrue(cache.tryConsume("missing", 5, NOW).isEmpty());
        assertEquals(0, cache.size());
    }

    @Test
    void tryConsume_countsRequestWithinOpenWindow() {
        cache.put("user", 2, NOW + 1000);

        Optional<RateLimitDecision> decision = cache.tryConsume("user", 5, NOW + 10);

        assertTrue(decision.isPresent());
        assertTrue(decision.get().success());
        assertEquals(2, decision.get().remaining());
        assertEquals(NOW + 1000, decision.get().resetTime());
        assertEquals(3, cache.get("user").orElseThrow().count());
    }

    @Test
    void tryConsume_atLimit_deniesWithoutCounting() {
        cache.put("user", 3, NOW + 1000);

        RateLimitDecision decision = cache.tryConsume("user", 3, NOW).orElseThrow();

        assertFalse(decision.success());
        assertEquals(0, decision.remaining());
        assertEquals(3, cache.get("user").orElseThrow().count());
    }

    @Test
    void tryConsume_afterWindowCloses_returnsEmpty() {
        cache.put("user", 1, NOW + 1000);

        assertTrue(cache.tryConsume("user", 5, NOW + 1000).isEmpty());
        assertEquals(1, cache.get("user").orElseThrow().count());
    }

    @Test
    void consumeOrStartWindow_opensWindowThenCounts() {
        RateLimitDecision first = cache.consumeOrStartWindow("fallback", 2, NOW, 5000);
        RateLimitDecision second = cache.consumeOrStartWindow("fallback", 2, NOW + 100, 5000);
        RateLimitDecision third = cache.consumeOrStartWindow("fallback", 2, NOW + 200, 5000);

        assertTrue(first.success());
        assertEquals(1, first.remaining());
        assertEquals(NOW + 5000, first.resetTime());
        assertTrue(second.success());
        assertEquals(0, second.remaining());
        assertEquals(NOW + 5000, second.resetTime());
        assertFalse(third.success());
    }

    @Test
    void consumeOrStartWindow_restartsClosedWindow() {
        cache.put("fallback", 9, NOW);

        RateLimitDecision decision = cache.consumeOrStartWindow("fallback", 2, NOW, 5000);

        assertTrue(decision.success());
        assertEquals(1, decision.remaining());
        assertEquals(NOW + 5000, decision.resetTime());
    }

    @Test
    void evictExpired_removesEntriesOnceResetTimeReached() {
        cache.put("closing", 1, NOW);
        cache.put("open", 1, NOW + 1);

        assertEquals(1, cache.evictExpired(NOW));
        assertTrue(cache.get("closing").isEmpty());
        assertTrue(cache.get("open").isPresent());
        assertEquals(1, cache.evictExpired(NOW + 1));
        assertTrue(cache.isEmpty());
    }

    @Test
    void put_keepsHigherCountForSameWindow() {
        cache.put("user", 5, NOW + 1000);
        cache.put("user", 3, NOW + 1000);

        assertEquals(5, cache.get("user").orElseThrow().count());

        cache.put("user", 6, NOW + 1000);

        assertEquals(6, cache.get("user").orElseThrow().count());
    }

    @Test
    void put_laterWindowReplacesEarlierOne() {
        cache.put("user", 5, NOW);
        cache.put("user", 1, NOW + 1000);
        cache.put("user", 9, NOW);

        LocalRateLimitCache.CacheEntry entry = cache.get("user").orElseThrow();
        assertEquals(1, entry.count());
        assertEquals(NOW + 1000, entry.resetTime());
    }

    @Test
    void evictExpired_isBoundedPerPass() {
        for (int i = 0; i < 5; i++) {
            cache.put("expired-" + i, 1, NOW - 1);
        }

        assertEquals(2, cache.evictExpired(NOW));
        assertEquals(3, cache.size());
        assertEquals(2, cache.evictExpired(NOW));
        assertEquals(1, cache.evictExpired(NOW));
        assertTrue(cache.isEmpty());
    }

    @Test
    void put_startsSweepOnlyOnce() {
        doReturn(sweepTask).when(executor)
                .scheduleWithFixedDelay(any(Runnable.class), anyLong(), anyLong(), any(TimeUnit.class));

        cache.put("a", 1, NOW + 1000);
        cache.put("b", 1, NOW + 1000);
        cache.consumeOrStartWindow("c", 5, NOW, 1000);

        assertTrue(cache.isSweepRunning());
        verify(executor, times(1)).scheduleWithFixedDelay(
                any(Runnable.class), eq(30_000L), eq(30_000L), eq(TimeUnit.MILLISECONDS));
    }

    @Test
    void tryConsume_doesNotStartSweep() {
        cache.tryConsume("missing", 5, NOW);

        assertFalse(cache.isSweepRunning());
        verifyNoInteractions(executor);
    }

    @Test
    void shutdown_clearsEntriesAndStopsExecutor() {
        doReturn(sweepTask).when(executor)
                .scheduleWithFixedDelay(any(Runnable.class), anyLong(), anyLong(), any(TimeUnit.class));
        cache.put("a", 1, NOW + 1000);

        cache.shutdown();

        assertTrue(cache.isEmpty());
        assertFalse(cache.isSweepRunning());
        verify(sweepTask).cancel(false);
        verify(executor).shutdownNow();
    }
}
