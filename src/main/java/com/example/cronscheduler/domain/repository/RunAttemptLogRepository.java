package com.example.cronscheduler.domain.repository;

import com.example.cronscheduler.domain.entity.RunAttemptLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Repository for RunAttemptLog entity
 */
@Repository
public interface RunAttemptLogRepository extends JpaRepository<RunAttemptLog, UUID> {

    List<RunAttemptLog> findByRunIdOrderByAttemptNumberAsc(UUID runId);

    long countByRunId(UUID runId);

    /**
     * Error types of failed attempts since a point in time, most frequent first
     */
    @Query("""
            SELECT l.errorType, COUNT(l)
            FROM RunAttemptLog l
            WHERE l.success = false
              AND l.startedAt >= :since
              AND l.errorType IS NOT NULL
            GROUP BY l.errorType
            ORDER BY COUNT(l) DESC
            """)
    List<Object[]> getErrorDistribution(@Param("since") Instant since);

    /**
     * Delete attempt logs whose run no longer exists
     */
    @Transactional
    @Modifying
    @Query("""
            DELETE FROM RunAttemptLog l
            WHERE l.startedAt < :cutoff
              AND NOT EXISTS (SELECT r.id FROM JobRun r WHERE r.id = l.runId)
            """)
    int deleteOrphanedBefore(@Param("cutoff") Instant cutoff);
}
