package org.example.ratelimit.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "rate-limit")
public class RateLimiterProperties {

    private String store = "database";
    private Cache cache = new Cache();
    private Schema schema = new Schema();
    private Database database = new Database();

    public String getStore() {
        return store;
    }

    public void setStore(String store) {
        this.store = store;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache == null ? new Cache() : cache;
    }

    public Schema getSchema() {
        return schema;
    }

    public void setSchema(Schema schema) {
        this.schema = schema == null ? new Schema() : schema;
    }

    public Database getDatabase() {
        return database;
    }

    public void setDatabase(Database database) {
        this.database = database == null ? new Database() : database;
    }

    public static class Cache {
        private long sweepIntervalMs = 30_000;
        private int maxEvictionsPerSweep = 1000;

        public long getSweepIntervalMs() {
            return sweepIntervalMs;
        }

        public void setSweepIntervalMs(long sweepIntervalMs) {
            this.sweepIntervalMs = sweepIntervalMs;
        }

        public int getMaxEvictionsPerSweep() {
            return maxEvictionsPerSweep;
        }

        public void setMaxEvictionsPerSweep(int maxEvictionsPerSweep) {
            this.maxEvictionsPerSweep = maxEvictionsPerSweep;
        }
    }

    public static class Schema {
        private boolean initialize = true;
        private long retentionMinutes = 60;

        public boolean isInitialize() {
            return initialize;
        }

        public void setInitialize(boolean initialize) {
            this.initialize = initialize;
        }

        public long getRetentionMinutes() {
            return retentionMinutes;
        }

        public void setRetentionMinutes(long retentionMinutes) {
            this.retentionMinutes = retentionMinutes;
        }
    }

    public static class Database {
        private int cleanupInterval = 256;

        public int getCleanupInterval() {
            return cleanupInterval;
        }

        public void setCleanupInterval(int cleanupInterval) {
            this.cleanupInterval = cleanupInterval;
        }
    }
}
