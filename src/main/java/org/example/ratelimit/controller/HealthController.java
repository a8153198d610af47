package org.example.ratelimit.controller;

import org.example.ratelimit.service.RateLimitMetricsService;
import org.example.ratelimit.service.RateLimiterService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class HealthController {

    private final RateLimiterService rateLimiterService;
    private final RateLimitMetricsService rateLimitMetricsService;

    public HealthController(
            RateLimiterService rateLimiterService,
            RateLimitMetricsService rateLimitMetricsService) {
        this.rateLimiterService = rateLimiterService;
        this.rateLimitMetricsService = rateLimitMetricsService;
    }

    @GetMapping("/health")
    public Health health() {
        return new Health("ok");
    }

    @GetMapping("/health/rate-limit")
    public RateLimitHealth rateLimitHealth() {
        boolean degraded = rateLimiterService.isDegraded();
        return new RateLimitHealth(
                degraded ? "degraded" : "ok",
                rateLimiterService.getStoreName(),
                rateLimiterService.getLocalCacheSize(),
                rateLimiterService.isSweepRunning(),
                rateLimitMetricsService.snapshot()
        );
    }

    public record Health(String status) {}

    public record RateLimitHealth(
            String status,
            String store,
            int localCacheSize,
            boolean sweepRunning,
            Map<String, Object> metrics
    ) {
    }
}
