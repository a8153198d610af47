package org.example.ratelimit.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.example.ratelimit.model.RateLimitDecision;
import org.example.ratelimit.service.RateLimiterService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.time.Clock;

/**
 * Admits or rejects guarded requests through {@link RateLimiterService}, keyed by the
 * caller's user id header when present and by client IP otherwise.
 */
@Component
@ConditionalOnProperty(name = "rate-limit.guard.enabled", havingValue = "true", matchIfMissing = true)
public class RateLimitGuardInterceptor implements HandlerInterceptor {

    static final String USER_ID_HEADER = "X-User-Id";

    private final RateLimiterService rateLimiterService;
    private final Clock clock;
    private final int maxRequests;
    private final long windowMs;

    public RateLimitGuardInterceptor(
            RateLimiterService rateLimiterService,
            @Nullable Clock clock,
            @Value("${rate-limit.guard.max-requests:10}") int maxRequests,
            @Value("${rate-limit.guard.window-ms:60000}") long windowMs) {
        this.rateLimiterService = rateLimiterService;
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.maxRequests = Math.max(1, maxRequests);
        this.windowMs = Math.max(1, windowMs);
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) throws Exception {
        String identifier = resolveIdentifier(request);
        RateLimitDecision decision = rateLimiterService.checkAndConsume(identifier, maxRequests, windowMs);

        response.setHeader("X-RateLimit-Limit", String.valueOf(maxRequests));
        response.setHeader("X-RateLimit-Remaining", String.valueOf(decision.remaining()));
        response.setHeader("X-RateLimit-Reset", String.valueOf(Math.floorDiv(decision.resetTime() + 999, 1000)));
        if (decision.success()) {
            return true;
        }

        long retryAfterSeconds = retryAfterSeconds(decision);
        response.setHeader("Retry-After", String.valueOf(retryAfterSeconds));
        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write(
                "{\"error\":\"Rate limit exceeded\",\"retryAfterSeconds\":" + retryAfterSeconds + "}");
        return false;
    }

    String resolveIdentifier(HttpServletRequest request) {
        String userId = request.getHeader(USER_ID_HEADER);
        if (userId != null && !userId.isBlank()) {
            return "user:" + userId.trim();
        }
        return "ip:" + resolveClientIp(request);
    }

    private long retryAfterSeconds(RateLimitDecision decision) {
        long millisUntilReset = decision.resetTime() - clock.millis();
        return Math.max(1, (millisUntilReset + 999) / 1000);
    }

    private String resolveClientIp(HttpServletRequest request) {
        String xForwardedFor = request.getHeader("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.isBlank()) {
            int commaIndex = xForwardedFor.indexOf(',');
            String candidate = commaIndex >= 0 ? xForwardedFor.substring(0, commaIndex) : xForwardedFor;
            if (!candidate.isBlank()) {
                return candidate.trim();
            }
        }

        String xRealIp = request.getHeader("X-Real-IP");
        if (xRealIp != null && !xRealIp.isBlank()) {
            return xRealIp.trim();
        }

        String remoteAddr = request.getRemoteAddr();
        return remoteAddr != null ? remoteAddr : "unknown";
    }
}
