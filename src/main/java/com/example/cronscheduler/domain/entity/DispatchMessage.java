package com.example.cronscheduler.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * A dispatch task parked in the store-backed queue.
 * <p>
 * {@code visibleAt} is when the message may next be received; receiving pushes it
 * forward by the visibility timeout. {@code deliveryCount} doubles as the receipt:
 * an acknowledgement only deletes the message if no one received it since.
 */
@Entity
@Table(name = "dispatch_queue", indexes = {
        @Index(name = "idx_dispatch_visible_at", columnList = "visible_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DispatchMessage {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "job_id", nullable = false)
    private UUID jobId;

    @Column(name = "run_id", nullable = false)
    private UUID runId;

    @Column(name = "attempt", nullable = false)
    private Integer attempt;

    @Column(name = "enqueued_at", nullable = false)
    private Instant enqueuedAt;

    @Column(name = "visible_at", nullable = false)
    private Instant visibleAt;

    @Column(name = "delivery_count", nullable = false)
    @Builder.Default
    private Integer deliveryCount = 0;

    @Column(name = "last_received_by", length = 100)
    private String lastReceivedBy;
}
