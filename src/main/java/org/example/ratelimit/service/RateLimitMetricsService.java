package org.example.ratelimit.service;

import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

@Service
public class RateLimitMetricsService {

    private final LongAdder admitted = new LongAdder();
    private final LongAdder denied = new LongAdder();
    private final LongAdder cacheHits = new LongAdder();
    private final LongAdder storeReads = new LongAdder();
    private final LongAdder fallbacks = new LongAdder();
    private final AtomicLong lastFallbackAtMillis = new AtomicLong(-1);

    public void recordDecision(boolean success) {
        if (success) {
            admitted.increment();
        } else {
            denied.increment();
        }
    }

    public void recordCacheHit() {
        cacheHits.increment();
    }

    public void recordStoreRead() {
        storeReads.increment();
    }

    public void recordFallback(long nowMillis) {
        fallbacks.increment();
        lastFallbackAtMillis.set(nowMillis);
    }

    /**
     * @return epoch millis of the most recent fallback, or -1 if none happened
     */
    public long getLastFallbackAtMillis() {
        return lastFallbackAtMillis.get();
    }

    public Map<String, Object> snapshot() {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("admitted", admitted.sum());
        metrics.put("denied", denied.sum());
        metrics.put("cacheHits", cacheHits.sum());
        metrics.put("storeReads", storeReads.sum());
        metrics.put("fallbacks", fallbacks.sum());
        metrics.put("lastFallbackAtMillis", lastFallbackAtMillis.get());
        return metrics;
    }
}
