package org.example.ratelimit.config;

import org.example.ratelimit.repository.RateLimitSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Provisions the {@code rate_limits} table on startup so the first request in a fresh
 * environment does not fail. A provisioning failure is logged and startup continues;
 * the limiter then serves from its local fallback until the table exists.
 */
@Component
@Order(1)
@ConditionalOnProperty(name = "rate-limit.store", havingValue = "database", matchIfMissing = true)
public class RateLimitSchemaInitializer implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(RateLimitSchemaInitializer.class);

    private final DataSource dataSource;
    private final RateLimiterProperties properties;
    private final Clock clock;

    public RateLimitSchemaInitializer(DataSource dataSource, RateLimiterProperties properties, Clock clock) {
        this.dataSource = dataSource;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public void run(String... args) {
        if (!properties.getSchema().isInitialize()) {
            log.info("Rate limit schema initialization is disabled");
            return;
        }
        initialize();
    }

    boolean initialize() {
        Duration retention = Duration.ofMinutes(Math.max(0, properties.getSchema().getRetentionMinutes()));
        Instant cutoff = clock.instant().minus(retention);
        try (Connection connection = dataSource.getConnection()) {
            int purged = RateLimitSchema.provision(connection, cutoff);
            log.info("Rate limit table '{}' ready; purged {} stale rows", RateLimitSchema.TABLE_NAME, purged);
            return true;
        } catch (SQLException e) {
            log.error("Failed to initialize rate limit table: {}", e.getMessage(), e);
            return false;
        }
    }
}
