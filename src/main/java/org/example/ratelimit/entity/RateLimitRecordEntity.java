package org.example.ratelimit.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import java.time.Instant;

@Entity
@Table(
        name = "rate_limits",
        indexes = @Index(name = "idx_rate_limits_reset_time", columnList = "reset_time")
)
public class RateLimitRecordEntity {

    @Id
    @Column(name = "identifier", nullable = false, length = 512)
    private String identifier;

    @Column(name = "request_count", nullable = false)
    private int requestCount;

    @Column(name = "reset_time", nullable = false)
    private Instant resetTime;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public RateLimitRecordEntity() {
    }

    public RateLimitRecordEntity(String identifier, int requestCount, Instant resetTime, Instant now) {
        this.identifier = identifier;
        this.requestCount = requestCount;
        this.resetTime = resetTime;
        this.createdAt = now;
        this.updatedAt = now;
    }

    public String getIdentifier() {
        return identifier;
    }

    public void setIdentifier(String identifier) {
        this.identifier = identifier;
    }

    public int getRequestCount() {
        return requestCount;
    }

    public void setRequestCount(int requestCount) {
        this.requestCount = requestCount;
    }

    public Instant getResetTime() {
        return resetTime;
    }

    public void setResetTime(Instant resetTime) {
        this.resetTime = resetTime;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
