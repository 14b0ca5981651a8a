package com.example.cronscheduler.domain.repository;

import com.example.cronscheduler.domain.entity.DispatchMessage;
import org.springframework.data.domain.Pageable;
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
 * Repository backing the store-based dispatch queue
 */
@Repository
public interface DispatchMessageRepository extends JpaRepository<DispatchMessage, UUID> {

    @Query("""
            SELECT m FROM DispatchMessage m
            WHERE m.visibleAt <= :now
            ORDER BY m.visibleAt ASC
            """)
    List<DispatchMessage> findVisible(@Param("now") Instant now, Pageable pageable);

    /**
     * Take a visible message: hide it until {@code invisibleUntil} and bump the receipt
     *
     * @return 1 if this consumer received the message
     */
    @Transactional
    @Modifying
    @Query("""
            UPDATE DispatchMessage m
            SET m.visibleAt = :invisibleUntil,
                m.deliveryCount = m.deliveryCount + 1,
                m.lastReceivedBy = :consumerId
            WHERE m.id = :id
              AND m.deliveryCount = :deliveryCount
              AND m.visibleAt <= :now
            """)
    int receive(
            @Param("id") UUID id,
            @Param("deliveryCount") int deliveryCount,
            @Param("consumerId") String consumerId,
            @Param("invisibleUntil") Instant invisibleUntil,
            @Param("now") Instant now);

    /**
     * Delete a message if the receipt is still current
     */
    @Transactional
    @Modifying
    @Query("""
            DELETE FROM DispatchMessage m
            WHERE m.id = :id
              AND m.deliveryCount = :deliveryCount
            """)
    int acknowledge(@Param("id") UUID id, @Param("deliveryCount") int deliveryCount);

    /**
     * Delete messages for runs that are gone or finished
     */
    @Transactional
    @Modifying
    @Query("""
            DELETE FROM DispatchMessage m
            WHERE m.enqueuedAt < :cutoff
              AND NOT EXISTS (
                  SELECT r.id FROM JobRun r
                  WHERE r.id = m.runId
                    AND r.status IN (
                        com.example.cronscheduler.domain.enums.RunStatus.PENDING,
                        com.example.cronscheduler.domain.enums.RunStatus.CLAIMED,
                        com.example.cronscheduler.domain.enums.RunStatus.EXECUTING,
                        com.example.cronscheduler.domain.enums.RunStatus.RETRY_SCHEDULED))
            """)
    int deleteOrphanedBefore(@Param("cutoff") Instant cutoff);
}
