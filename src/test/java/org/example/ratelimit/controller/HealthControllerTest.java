package org.example.ratelimit.controller;

import org.example.ratelimit.service.RateLimitMetricsService;
import org.example.ratelimit.service.RateLimiterService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.hamcrest.Matchers.is;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(HealthController.class)
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private RateLimiterService rateLimiterService;

    @MockitoBean
    private RateLimitMetricsService rateLimitMetricsService;

    @Test
    void health_returnsOk() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("ok")));

        verifyNoInteractions(rateLimiterService);
    }

    @Test
    void rateLimitHealth_reportsStoreAndMetrics() throws Exception {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("admitted", 12L);
        metrics.put("denied", 3L);
        metrics.put("fallbacks", 0L);
        when(rateLimiterService.isDegraded()).thenReturn(false);
        when(rateLimiterService.getStoreName()).thenReturn("database");
        when(rateLimiterService.getLocalCacheSize()).thenReturn(4);
        when(rateLimiterService.isSweepRunning()).thenReturn(true);
        when(rateLimitMetricsService.snapshot()).thenReturn(metrics);

        mockMvc.perform(get("/health/rate-limit"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("ok")))
                .andExpect(jsonPath("$.store", is("database")))
                .andExpect(jsonPath("$.localCacheSize", is(4)))
                .andExpect(jsonPath("$.sweepRunning", is(true)))
                .andExpect(jsonPath("$.metrics.admitted", is(12)))
                .andExpect(jsonPath("$.metrics.denied", is(3)));
    }

    @Test
    void rateLimitHealth_reportsDegradedAfterFallback() throws Exception {
        when(rateLimiterService.isDegraded()).thenReturn(true);
        when(rateLimiterService.getStoreName()).thenReturn("database");
        when(rateLimitMetricsService.snapshot()).thenReturn(Map.of("fallbacks", 2L));

        mockMvc.perform(get("/health/rate-limit"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("degraded")))
                .andExpect(jsonPath("$.metrics.fallbacks", is(2)));
    }
}
