package com.example.cronscheduler.queue;

import com.example.cronscheduler.domain.entity.DispatchMessage;
import com.example.cronscheduler.domain.repository.DispatchMessageRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Dispatch queue kept in the {@code dispatch_queue} table of the job store.
 * <p>
 * Receiving is a conditional update per message, so concurrent consumers on any
 * number of instances never get the same delivery twice within a visibility window.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DatabaseDispatchQueue implements DispatchQueue {

    private final DispatchMessageRepository messageRepository;
    private final Clock clock;

    @Override
    public void enqueue(DispatchTask task) {
        enqueue(task, Duration.ZERO);
    }

    @Override
    public void enqueue(DispatchTask task, Duration delay) {
        var now = clock.instant();
        var message = DispatchMessage.builder()
                .jobId(task.getJobId())
                .runId(task.getRunId())
                .attempt(task.getAttempt())
                .enqueuedAt(now)
                .visibleAt(now.plus(delay))
                .deliveryCount(0)
                .build();
        messageRepository.save(message);
        log.debug("Enqueued dispatch task for run {} attempt {} (visible at {})",
                task.getRunId(), task.getAttempt(), message.getVisibleAt());
    }

    @Override
    public List<DispatchDelivery> receive(String consumerId, int maxMessages, Duration visibilityTimeout) {
        var now = clock.instant();
        // Over-fetch a little: some candidates will be taken by other consumers
        var candidates = messageRepository.findVisible(now, PageRequest.of(0, maxMessages * 2));
        var deliveries = new ArrayList<DispatchDelivery>(Math.min(candidates.size(), maxMessages));

        for (var message : candidates) {
            if (deliveries.size() >= maxMessages) {
                break;
            }
            var seen = message.getDeliveryCount();
            var updated = messageRepository.receive(message.getId(), seen, consumerId, now.plus(visibilityTimeout), now);
            if (updated == 0) {
                log.debug("Message {} was received by another consumer", message.getId());
                continue;
            }
            var task = DispatchTask.builder()
                    .jobId(message.getJobId())
                    .runId(message.getRunId())
                    .attempt(message.getAttempt())
                    .build();
            deliveries.add(new DispatchDelivery(message.getId(), task, seen + 1));
        }
        return deliveries;
    }

    @Override
    public boolean acknowledge(DispatchDelivery delivery) {
        var deleted = messageRepository.acknowledge(delivery.getMessageId(), delivery.getReceipt()) > 0;
        if (!deleted) {
            log.debug("Stale receipt for message {} (receipt {})", delivery.getMessageId(), delivery.getReceipt());
        }
        return deleted;
    }

    @Override
    public long depth() {
        return messageRepository.count();
    }
}
