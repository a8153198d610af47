package org.example.ratelimit.repository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Calendar;
import java.util.TimeZone;

/**
 * Idempotent DDL for the {@code rate_limits} table, shared by the startup initializer and
 * the command line runner. Statements stay within the subset understood by H2, PostgreSQL
 * and MariaDB.
 */
public final class RateLimitSchema {

    public static final String TABLE_NAME = "rate_limits";

    static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS rate_limits (
                identifier VARCHAR(512) NOT NULL PRIMARY KEY,
                request_count INTEGER NOT NULL DEFAULT 1,
                reset_time TIMESTAMP NOT NULL,
                created_at TIMESTAMP NOT NULL DEFAULT CURRENT_TIMESTAMP,
                updated_at TIMESTAMP NOT NULL DEFAULT CURRENT_TIMESTAMP
            )
            """;

    static final String CREATE_INDEX_SQL =
            "CREATE INDEX IF NOT EXISTS idx_rate_limits_reset_time ON rate_limits (reset_time)";

    static final String PURGE_SQL = "DELETE FROM rate_limits WHERE reset_time < ?";

    private RateLimitSchema() {
    }

    /**
     * Creates the table and its reset-time index when absent, then deletes rows whose
     * window closed before {@code purgeCutoff}.
     *
     * @return number of purged rows
     */
    public static int provision(Connection connection, Instant purgeCutoff) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute(CREATE_TABLE_SQL);
            statement.execute(CREATE_INDEX_SQL);
        }
        return purgeExpired(connection, purgeCutoff);
    }

    public static int purgeExpired(Connection connection, Instant cutoff) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(PURGE_SQL)) {
            // Timestamps are stored as UTC wall-clock values.
            statement.setTimestamp(1, Timestamp.from(cutoff), Calendar.getInstance(TimeZone.getTimeZone("UTC")));
            return statement.executeUpdate();
        }
    }
}
