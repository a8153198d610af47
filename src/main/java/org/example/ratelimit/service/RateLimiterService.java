package org.example.ratelimit.service;

import jakarta.annotation.PreDestroy;
import org.example.ratelimit.config.RateLimitStore;
import org.example.ratelimit.config.RateLimiterProperties;
import org.example.ratelimit.model.RateLimitDecision;
import org.example.ratelimit.model.RateLimitSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Fixed-window admission control shared across application instances.
 * <p>
 * A check is answered from the local cache while the identifier's window is open in this
 * process. Otherwise the durable store is read, the decision is taken from that read, the
 * counter is upserted, and the result is cached locally. When the store is unavailable the
 * check is answered from the local cache alone, so the limit then holds per process only.
 * <p>
 * The read and the upsert are separate steps: concurrent callers that both read a count
 * just below the limit are both admitted, and the stored count can end above the limit.
 */
@Service
public class RateLimiterService {

    private static final Logger log = LoggerFactory.getLogger(RateLimiterService.class);
    private static final Duration DEGRADED_WINDOW = Duration.ofMinutes(1);

    private final RateLimitStore store;
    private final LocalRateLimitCache cache;
    private final RateLimitMetricsService metrics;
    private final Clock clock;

    @Autowired
    public RateLimiterService(
            RateLimitStore store,
            RateLimitMetricsService metrics,
            RateLimiterProperties properties,
            Clock clock) {
        this(store, metrics, clock, new LocalRateLimitCache(
                clock,
                Duration.ofMillis(Math.max(1, properties.getCache().getSweepIntervalMs())),
                properties.getCache().getMaxEvictionsPerSweep()));
    }

    RateLimiterService(
            RateLimitStore store,
            RateLimitMetricsService metrics,
            Clock clock,
            LocalRateLimitCache cache) {
        this.store = store;
        this.metrics = metrics;
        this.clock = clock;
        this.cache = cache;
    }

    public RateLimitDecision checkAndConsume(String identifier, int maxRequests, Duration window) {
        if (window == null) {
            throw new IllegalArgumentException("window must not be null");
        }
        return checkAndConsume(identifier, maxRequests, window.toMillis());
    }

    /**
     * Counts one request for {@code identifier} against a limit of {@code maxRequests} per
     * window of {@code windowMs} milliseconds.
     *
     * @throws IllegalArgumentException if the identifier is null or a bound is not positive
     */
    public RateLimitDecision checkAndConsume(String identifier, int maxRequests, long windowMs) {
        if (identifier == null) {
            throw new IllegalArgumentException("identifier must not be null");
        }
        if (maxRequests <= 0) {
            throw new IllegalArgumentException("maxRequests must be positive: " + maxRequests);
        }
        if (windowMs <= 0) {
            throw new IllegalArgumentException("windowMs must be positive: " + windowMs);
        }

        long nowMillis = clock.millis();

        Optional<RateLimitDecision> cached = cache.tryConsume(identifier, maxRequests, nowMillis);
        if (cached.isPresent()) {
            metrics.recordCacheHit();
            return record(cached.get());
        }

        try {
            return record(consumeFromStore(identifier, maxRequests, nowMillis, windowMs));
        } catch (DataAccessException | TransactionException e) {
            log.warn("Rate limit store query failed, using local fallback for identifier {}: {}",
                    identifier, e.getMessage());
            metrics.recordFallback(nowMillis);
            return record(cache.consumeOrStartWindow(identifier, maxRequests, nowMillis, windowMs));
        }
    }

    public String getStoreName() {
        return store.name();
    }

    public int getLocalCacheSize() {
        return cache.size();
    }

    public boolean isSweepRunning() {
        return cache.isSweepRunning();
    }

    /**
     * True when a check fell back to the local cache within the last minute.
     */
    public boolean isDegraded() {
        long lastFallback = metrics.getLastFallbackAtMillis();
        return lastFallback >= 0 && clock.millis() - lastFallback < DEGRADED_WINDOW.toMillis();
    }

    @PreDestroy
    public void shutdown() {
        cache.shutdown();
        log.info("Rate limiter shut down");
    }

    private RateLimitDecision consumeFromStore(String identifier, int maxRequests, long nowMillis, long windowMs) {
        Instant now = Instant.ofEpochMilli(nowMillis);
        metrics.recordStoreRead();

        Optional<RateLimitSnapshot> active = store.findActive(identifier, now);
        if (active.isPresent() && active.get().count() >= maxRequests) {
            RateLimitSnapshot blocking = active.get();
            long resetTime = blocking.resetTime().toEpochMilli();
            cache.put(identifier, blocking.count(), resetTime);
            return RateLimitDecision.denied(resetTime);
        }

        RateLimitSnapshot updated = store.upsert(identifier, now, now.plusMillis(windowMs));
        long resetTime = updated.resetTime().toEpochMilli();
        cache.put(identifier, updated.count(), resetTime);
        return RateLimitDecision.admitted(maxRequests - updated.count(), resetTime);
    }

    private RateLimitDecision record(RateLimitDecision decision) {
        metrics.recordDecision(decision.success());
        return decision;
    }
}
