package com.example.cronscheduler.domain.repository;

import com.example.cronscheduler.domain.entity.Job;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for Job entity.
 * <p>
 * Cross-instance coordination goes through {@link #claimOccurrence}: a conditional
 * update on the job version that only one scheduler instance can win per occurrence.
 */
@Repository
public interface JobRepository extends JpaRepository<Job, UUID> {

    Optional<Job> findByName(String name);

    boolean existsByName(String name);

    Page<Job> findByEnabled(Boolean enabled, Pageable pageable);

    long countByEnabledTrue();

    /**
     * Enabled jobs whose next occurrence is due and which have no active run.
     * Oldest due first.
     */
    @Query("""
            SELECT j FROM Job j
            WHERE j.enabled = true
              AND j.nextRunAt IS NOT NULL
              AND j.nextRunAt <= :now
              AND NOT EXISTS (
                  SELECT r.id FROM JobRun r
                  WHERE r.jobId = j.id
                    AND r.status IN (
                        com.example.cronscheduler.domain.enums.RunStatus.PENDING,
                        com.example.cronscheduler.domain.enums.RunStatus.CLAIMED,
                        com.example.cronscheduler.domain.enums.RunStatus.EXECUTING,
                        com.example.cronscheduler.domain.enums.RunStatus.RETRY_SCHEDULED))
            ORDER BY j.nextRunAt ASC
            """)
    List<Job> findDueJobs(@Param("now") Instant now, Pageable pageable);

    /**
     * Claim one occurrence of a job: advance its schedule if, and only if, nobody
     * else changed the job since it was read and it still has no active run.
     *
     * @return 1 if this caller won the claim, 0 otherwise
     */
    @Transactional
    @Modifying
    @Query("""
            UPDATE Job j
            SET j.nextRunAt = :nextRunAt,
                j.lastRunAt = :scheduledFor,
                j.version = j.version + 1,
                j.updatedAt = :now
            WHERE j.id = :jobId
              AND j.version = :version
              AND j.enabled = true
              AND NOT EXISTS (
                  SELECT r.id FROM JobRun r
                  WHERE r.jobId = :jobId
                    AND r.status IN (
                        com.example.cronscheduler.domain.enums.RunStatus.PENDING,
                        com.example.cronscheduler.domain.enums.RunStatus.CLAIMED,
                        com.example.cronscheduler.domain.enums.RunStatus.EXECUTING,
                        com.example.cronscheduler.domain.enums.RunStatus.RETRY_SCHEDULED))
            """)
    int claimOccurrence(
            @Param("jobId") UUID jobId,
            @Param("version") Long version,
            @Param("scheduledFor") Instant scheduledFor,
            @Param("nextRunAt") Instant nextRunAt,
            @Param("now") Instant now);
}
