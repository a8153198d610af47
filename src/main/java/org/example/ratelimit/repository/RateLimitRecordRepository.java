package org.example.ratelimit.repository;

import org.example.ratelimit.entity.RateLimitRecordEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

@Repository
public interface RateLimitRecordRepository extends JpaRepository<RateLimitRecordEntity, String> {

    @Query("""
            SELECT r
            FROM RateLimitRecordEntity r
            WHERE r.identifier = :identifier
              AND r.resetTime > :now
            """)
    Optional<RateLimitRecordEntity> findActive(
            @Param("identifier") String identifier,
            @Param("now") Instant now);

    /**
     * Increments the counter of an existing row, or restarts its window when the stored
     * reset time has already passed. Returns 0 when no row exists for the identifier.
     * <p>
     * The request count is assigned before the reset time so engines that evaluate SET
     * clauses left to right still compare against the stored window end.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("""
            UPDATE RateLimitRecordEntity r
            SET r.requestCount = CASE WHEN r.resetTime <= :now THEN 1 ELSE r.requestCount + 1 END,
                r.resetTime = CASE WHEN r.resetTime <= :now THEN :resetTime ELSE r.resetTime END,
                r.updatedAt = :now
            WHERE r.identifier = :identifier
            """)
    int incrementOrReset(
            @Param("identifier") String identifier,
            @Param("now") Instant now,
            @Param("resetTime") Instant resetTime);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query(value = """
            INSERT INTO rate_limits (identifier, request_count, reset_time, created_at, updated_at)
            VALUES (:identifier, 1, :resetTime, :now, :now)
            """, nativeQuery = true)
    int insertFirstRequest(
            @Param("identifier") String identifier,
            @Param("now") Instant now,
            @Param("resetTime") Instant resetTime);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("delete from RateLimitRecordEntity r where r.resetTime < :cutoff")
    int deleteExpired(@Param("cutoff") Instant cutoff);
}
