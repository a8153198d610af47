package org.example.ratelimit.config;

import org.example.ratelimit.entity.RateLimitRecordEntity;
import org.example.ratelimit.model.RateLimitSnapshot;
import org.example.ratelimit.repository.RateLimitRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

@Component
@ConditionalOnProperty(name = "rate-limit.store", havingValue = "database", matchIfMissing = true)
public class DatabaseRateLimitStore implements RateLimitStore {

    private static final Logger log = LoggerFactory.getLogger(DatabaseRateLimitStore.class);

    static final int MAX_KEY_LENGTH = 512;
    private static final String DIGEST_KEY_PREFIX = "sha256:";

    private final RateLimitRecordRepository repository;
    private final AtomicInteger cleanupTicker = new AtomicInteger();
    private final int cleanupInterval;
    private final Duration retention;

    @Autowired
    public DatabaseRateLimitStore(RateLimitRecordRepository repository, RateLimiterProperties properties) {
        this(repository,
                properties.getDatabase().getCleanupInterval(),
                Duration.ofMinutes(properties.getSchema().getRetentionMinutes()));
    }

    DatabaseRateLimitStore(RateLimitRecordRepository repository, int cleanupInterval, Duration retention) {
        this.repository = repository;
        this.cleanupInterval = Math.max(1, cleanupInterval);
        this.retention = retention == null || retention.isNegative() ? Duration.ZERO : retention;
    }

    @Override
    public Optional<RateLimitSnapshot> findActive(String identifier, Instant now) {
        return repository.findActive(storageKey(identifier), now)
                .map(entity -> toSnapshot(identifier, entity));
    }

    @Override
    public RateLimitSnapshot upsert(String identifier, Instant now, Instant resetTime) {
        maybeCleanup(now);

        String key = storageKey(identifier);
        int updated = repository.incrementOrReset(key, now, resetTime);
        if (updated == 0) {
            try {
                repository.insertFirstRequest(key, now, resetTime);
            } catch (DataIntegrityViolationException e) {
                // Another instance may have created the row between our update and insert.
                if (repository.incrementOrReset(key, now, resetTime) == 0) {
                    throw e;
                }
                log.debug("Concurrent create for rate limit identifier {}, applied update instead", identifier);
            }
        }

        return repository.findById(key)
                .map(entity -> toSnapshot(identifier, entity))
                .orElseThrow(() -> new EmptyResultDataAccessException(
                        "Rate limit record missing after upsert: " + identifier, 1));
    }

    @Override
    public int purgeExpired(Instant cutoff) {
        int deleted = repository.deleteExpired(cutoff);
        if (deleted > 0) {
            log.info("Purged {} stale rate limit rows older than {}", deleted, cutoff);
        }
        return deleted;
    }

    @Override
    public String name() {
        return "database";
    }

    private void maybeCleanup(Instant now) {
        int tick = cleanupTicker.incrementAndGet();
        if (tick % cleanupInterval != 0) {
            return;
        }
        purgeExpired(now.minus(retention));
    }

    /**
     * Identifiers longer than the key column are stored under a SHA-256 digest.
     */
    static String storageKey(String identifier) {
        if (identifier.length() <= MAX_KEY_LENGTH) {
            return identifier;
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(identifier.getBytes(StandardCharsets.UTF_8));
            return DIGEST_KEY_PREFIX + HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private RateLimitSnapshot toSnapshot(String identifier, RateLimitRecordEntity entity) {
        return new RateLimitSnapshot(identifier, entity.getRequestCount(), entity.getResetTime());
    }
}
