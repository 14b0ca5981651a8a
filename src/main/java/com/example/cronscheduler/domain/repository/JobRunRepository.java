package com.example.cronscheduler.domain.repository;

import com.example.cronscheduler.domain.entity.JobRun;
import com.example.cronscheduler.domain.enums.RunStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Repository for JobRun entity.
 * <p>
 * Every state change is a conditional update guarded by the state the caller expects
 * (status plus version, attempt or lease owner). A return value of 0 means another
 * instance got there first and the caller must back off.
 */
@Repository
public interface JobRunRepository extends JpaRepository<JobRun, UUID> {

    Page<JobRun> findByJobNameOrderByScheduledForDesc(String jobName, Pageable pageable);

    Page<JobRun> findByJobNameAndStatusOrderByScheduledForDesc(String jobName, RunStatus status, Pageable pageable);

    long countByJobIdAndStatusIn(UUID jobId, Collection<RunStatus> statuses);

    long countByStatus(RunStatus status);

    /**
     * Runs waiting for a scheduler to claim them: recovered runs, and retries whose
     * backoff has elapsed.
     */
    @Query("""
            SELECT r FROM JobRun r
            WHERE r.status = com.example.cronscheduler.domain.enums.RunStatus.PENDING
               OR (r.status = com.example.cronscheduler.domain.enums.RunStatus.RETRY_SCHEDULED
                   AND r.nextAttemptAt <= :now)
            ORDER BY r.scheduledFor ASC
            """)
    List<JobRun> findClaimableRuns(@Param("now") Instant now, Pageable pageable);

    /**
     * Re-claim a pending or retry-scheduled run for dispatch.
     */
    @Transactional
    @Modifying
    @Query("""
            UPDATE JobRun r
            SET r.status = com.example.cronscheduler.domain.enums.RunStatus.CLAIMED,
                r.leaseOwner = :owner,
                r.leaseExpiresAt = :leaseUntil,
                r.nextAttemptAt = NULL,
                r.version = r.version + 1,
                r.updatedAt = :now
            WHERE r.id = :runId
              AND r.version = :version
              AND r.status = :expectedStatus
            """)
    int claimRun(
            @Param("runId") UUID runId,
            @Param("version") Long version,
            @Param("expectedStatus") RunStatus expectedStatus,
            @Param("owner") String owner,
            @Param("leaseUntil") Instant leaseUntil,
            @Param("now") Instant now);

    /**
     * Move a claimed run to executing for attempt {@code attempt}. Fails for stale or
     * redelivered tasks whose attempt was already started.
     */
    @Transactional
    @Modifying
    @Query("""
            UPDATE JobRun r
            SET r.status = com.example.cronscheduler.domain.enums.RunStatus.EXECUTING,
                r.attempt = :attempt,
                r.leaseOwner = :owner,
                r.leaseExpiresAt = :leaseUntil,
                r.version = r.version + 1,
                r.updatedAt = :now
            WHERE r.id = :runId
              AND r.status = com.example.cronscheduler.domain.enums.RunStatus.CLAIMED
              AND r.attempt = :previousAttempt
            """)
    int beginAttempt(
            @Param("runId") UUID runId,
            @Param("attempt") int attempt,
            @Param("previousAttempt") int previousAttempt,
            @Param("owner") String owner,
            @Param("leaseUntil") Instant leaseUntil,
            @Param("now") Instant now);

    /**
     * Record the outcome of an attempt. Only the worker still holding the lease for
     * that attempt can write it; the lease is released.
     */
    @Transactional
    @Modifying
    @Query("""
            UPDATE JobRun r
            SET r.status = :status,
                r.nextAttemptAt = :nextAttemptAt,
                r.lastError = :lastError,
                r.lastHttpStatus = :httpStatus,
                r.completedAt = :completedAt,
                r.leaseOwner = NULL,
                r.leaseExpiresAt = NULL,
                r.version = r.version + 1,
                r.updatedAt = :now
            WHERE r.id = :runId
              AND r.status = com.example.cronscheduler.domain.enums.RunStatus.EXECUTING
              AND r.leaseOwner = :owner
              AND r.attempt = :attempt
            """)
    int completeAttempt(
            @Param("runId") UUID runId,
            @Param("attempt") int attempt,
            @Param("owner") String owner,
            @Param("status") RunStatus status,
            @Param("nextAttemptAt") Instant nextAttemptAt,
            @Param("lastError") String lastError,
            @Param("httpStatus") Integer httpStatus,
            @Param("completedAt") Instant completedAt,
            @Param("now") Instant now);

    /**
     * Claimed or executing runs whose lease has run out
     */
    @Query("""
            SELECT r FROM JobRun r
            WHERE r.status IN (
                    com.example.cronscheduler.domain.enums.RunStatus.CLAIMED,
                    com.example.cronscheduler.domain.enums.RunStatus.EXECUTING)
              AND r.leaseExpiresAt < :now
            ORDER BY r.leaseExpiresAt ASC
            """)
    List<JobRun> findExpiredLeases(@Param("now") Instant now, Pageable pageable);

    /**
     * Take back a run whose lease expired. Guarded on version so a worker that
     * finishes concurrently wins or loses cleanly.
     */
    @Transactional
    @Modifying
    @Query("""
            UPDATE JobRun r
            SET r.status = :status,
                r.lastError = :lastError,
                r.completedAt = :completedAt,
                r.leaseOwner = NULL,
                r.leaseExpiresAt = NULL,
                r.version = r.version + 1,
                r.updatedAt = :now
            WHERE r.id = :runId
              AND r.version = :version
              AND r.status IN (
                    com.example.cronscheduler.domain.enums.RunStatus.CLAIMED,
                    com.example.cronscheduler.domain.enums.RunStatus.EXECUTING)
              AND r.leaseExpiresAt < :now
            """)
    int recoverExpiredLease(
            @Param("runId") UUID runId,
            @Param("version") Long version,
            @Param("status") RunStatus status,
            @Param("lastError") String lastError,
            @Param("completedAt") Instant completedAt,
            @Param("now") Instant now);

    /**
     * Run counts grouped by status, as (RunStatus, Long) pairs
     */
    @Query("""
            SELECT r.status, COUNT(r)
            FROM JobRun r
            GROUP BY r.status
            """)
    List<Object[]> countGroupedByStatus();

    /**
     * Delete finished runs older than the cutoff
     */
    @Transactional
    @Modifying
    @Query("""
            DELETE FROM JobRun r
            WHERE r.status IN (
                    com.example.cronscheduler.domain.enums.RunStatus.SUCCEEDED,
                    com.example.cronscheduler.domain.enums.RunStatus.FAILED_TERMINAL)
              AND r.completedAt < :cutoff
            """)
    int deleteFinishedBefore(@Param("cutoff") Instant cutoff);
}
