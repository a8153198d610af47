package org.example.ratelimit.config;

import org.example.ratelimit.model.RateLimitSnapshot;

import java.time.Instant;
import java.util.Optional;

/**
 * Cross-process source of truth for fixed-window counters.
 * <p>
 * Implementations report storage failures as Spring {@code DataAccessException} or
 * {@code TransactionException} so callers can treat them as an availability signal.
 */
public interface RateLimitStore {

    /**
     * Returns the counter for {@code identifier} whose window is still open at {@code now}.
     */
    Optional<RateLimitSnapshot> findActive(String identifier, Instant now);

    /**
     * Atomically creates the counter with a count of 1 and the given reset time, restarts
     * it the same way when its window has already closed, or otherwise increments it
     * leaving the reset time untouched. Returns the state after the write.
     */
    RateLimitSnapshot upsert(String identifier, Instant now, Instant resetTime);

    /**
     * Deletes counters whose window closed before {@code cutoff}.
     */
    int purgeExpired(Instant cutoff);

    String name();
}
