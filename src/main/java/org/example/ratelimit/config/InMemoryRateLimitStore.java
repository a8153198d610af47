package org.example.ratelimit.config;

import org.example.ratelimit.model.RateLimitSnapshot;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-local counter store for single-instance deployments and local development.
 * Counters are not shared with other processes.
 */
@Component
@ConditionalOnProperty(name = "rate-limit.store", havingValue = "in-memory")
public class InMemoryRateLimitStore implements RateLimitStore {

    private final AtomicInteger cleanupTicker = new AtomicInteger();
    private final ConcurrentHashMap<String, RateLimitSnapshot> counters = new ConcurrentHashMap<>();

    @Override
    public Optional<RateLimitSnapshot> findActive(String identifier, Instant now) {
        RateLimitSnapshot snapshot = counters.get(identifier);
        if (snapshot == null || !snapshot.resetTime().isAfter(now)) {
            return Optional.empty();
        }
        return Optional.of(snapshot);
    }

    @Override
    public RateLimitSnapshot upsert(String identifier, Instant now, Instant resetTime) {
        int tick = cleanupTicker.incrementAndGet();
        if ((tick & 0xFF) == 0) {
            purgeExpired(now);
        }

        return counters.compute(identifier, (key, existing) -> {
            if (existing == null || !existing.resetTime().isAfter(now)) {
                return new RateLimitSnapshot(key, 1, resetTime);
            }
            return new RateLimitSnapshot(key, existing.count() + 1, existing.resetTime());
        });
    }

    @Override
    public int purgeExpired(Instant cutoff) {
        int removed = 0;
        for (Map.Entry<String, RateLimitSnapshot> entry : counters.entrySet()) {
            if (entry.getValue().resetTime().isBefore(cutoff)
                    && counters.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public String name() {
        return "in-memory";
    }

    int size() {
        return counters.size();
    }
}
