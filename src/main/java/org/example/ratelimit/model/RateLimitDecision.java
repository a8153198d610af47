package org.example.ratelimit.model;

/**
 * Outcome of a single admission check.
 *
 * @param success   whether the request is admitted
 * @param remaining requests still allowed in the current window, never negative
 * @param resetTime end of the current window in epoch milliseconds
 */
public record RateLimitDecision(
        boolean success,
        int remaining,
        long resetTime
) {

    public static RateLimitDecision admitted(int remaining, long resetTime) {
        return new RateLimitDecision(true, Math.max(0, remaining), resetTime);
    }

    public static RateLimitDecision denied(long resetTime) {
        return new RateLimitDecision(false, 0, resetTime);
    }
}
