package org.example.ratelimit.model;

import java.time.Instant;

/**
 * Counter state of one identifier as seen by a store at a point in time.
 */
public record RateLimitSnapshot(
        String identifier,
        int count,
        Instant resetTime
) {
}
