package org.example.ratelimit.service;

import org.example.ratelimit.model.RateLimitDecision;

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-process mirror of fixed-window counters. Entries are never shared with other
 * processes; the durable store is re-read only once an entry's window has closed.
 */
public class LocalRateLimitCache {

    private final ConcurrentHashMap<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final int maxEvictionsPerSweep;
    private final CacheSweepScheduler sweepScheduler;

    public LocalRateLimitCache(Clock clock, Duration sweepInterval, int maxEvictionsPerSweep) {
        this.clock = clock;
        this.maxEvictionsPerSweep = Math.max(1, maxEvictionsPerSweep);
        this.sweepScheduler = new CacheSweepScheduler(sweepInterval, this::sweep, () -> !entries.isEmpty());
    }

    LocalRateLimitCache(
            Clock clock,
            Duration sweepInterval,
            int maxEvictionsPerSweep,
            ScheduledExecutorService sweepExecutor) {
        this.clock = clock;
        this.maxEvictionsPerSweep = Math.max(1, maxEvictionsPerSweep);
        this.sweepScheduler = new CacheSweepScheduler(
                sweepExecutor, sweepInterval, this::sweep, () -> !entries.isEmpty());
    }

    /**
     * Decides against the cached window when one is still open at {@code nowMillis},
     * counting the request when it is admitted. Returns empty when there is no open window.
     */
    public Optional<RateLimitDecision> tryConsume(String identifier, int maxRequests, long nowMillis) {
        AtomicReference<RateLimitDecision> decision = new AtomicReference<>();
        entries.computeIfPresent(identifier, (key, entry) -> {
            if (nowMillis >= entry.resetTime()) {
                return entry;
            }
            if (entry.count() >= maxRequests) {
                decision.set(RateLimitDecision.denied(entry.resetTime()));
                return entry;
            }
            CacheEntry next = entry.increment();
            decision.set(RateLimitDecision.admitted(maxRequests - next.count(), next.resetTime()));
            return next;
        });
        return Optional.ofNullable(decision.get());
    }

    /**
     * Like {@link #tryConsume} but opens a fresh window of {@code windowMillis} with a count
     * of 1 when no window is open.
     */
    public RateLimitDecision consumeOrStartWindow(String identifier, int maxRequests, long nowMillis, long windowMillis) {
        AtomicReference<RateLimitDecision> decision = new AtomicReference<>();
        entries.compute(identifier, (key, entry) -> {
            if (entry == null || nowMillis >= entry.resetTime()) {
                CacheEntry started = new CacheEntry(1, nowMillis + windowMillis);
                decision.set(RateLimitDecision.admitted(maxRequests - 1, started.resetTime()));
                return started;
            }
            if (entry.count() >= maxRequests) {
                decision.set(RateLimitDecision.denied(entry.resetTime()));
                return entry;
            }
            CacheEntry next = entry.increment();
            decision.set(RateLimitDecision.admitted(maxRequests - next.count(), next.resetTime()));
            return next;
        });
        sweepScheduler.ensureRunning();
        return decision.get();
    }

    /**
     * Records the store's view of a window. For the same window the higher count wins, so a
     * slower thread cannot lower a count another thread already cached; a later window
     * replaces an earlier one.
     */
    public void put(String identifier, int count, long resetTime) {
        entries.merge(identifier, new CacheEntry(count, resetTime), CacheEntry::newer);
        sweepScheduler.ensureRunning();
    }

    public Optional<CacheEntry> get(String identifier) {
        return Optional.ofNullable(entries.get(identifier));
    }

    /**
     * Removes entries whose window has closed at {@code nowMillis}, at most
     * {@code maxEvictionsPerSweep} per call.
     *
     * @return number of evicted entries
     */
    public int evictExpired(long nowMillis) {
        int evicted = 0;
        Iterator<Map.Entry<String, CacheEntry>> iterator = entries.entrySet().iterator();
        while (iterator.hasNext() && evicted < maxEvictionsPerSweep) {
            Map.Entry<String, CacheEntry> candidate = iterator.next();
            if (nowMillis >= candidate.getValue().resetTime()
                    && entries.remove(candidate.getKey(), candidate.getValue())) {
                evicted++;
            }
        }
        return evicted;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public boolean isSweepRunning() {
        return sweepScheduler.isRunning();
    }

    public void shutdown() {
        sweepScheduler.shutdown();
        entries.clear();
    }

    private void sweep() {
        evictExpired(clock.millis());
    }

    public record CacheEntry(int count, long resetTime) {

        CacheEntry increment() {
            return new CacheEntry(count + 1, resetTime);
        }

        static CacheEntry newer(CacheEntry existing, CacheEntry incoming) {
            if (existing.resetTime() != incoming.resetTime()) {
                return incoming.resetTime() > existing.resetTime() ? incoming : existing;
            }
            return incoming.count() > existing.count() ? incoming : existing;
        }
    }
}
