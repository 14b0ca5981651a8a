package com.example.cronscheduler.queue;

import java.time.Duration;
import java.util.List;

/**
 * At-least-once channel from the scheduler to the workers.
 * <p>
 * No ordering guarantee. A received task stays invisible for the visibility timeout;
 * if it is not acknowledged by then it is delivered again.
 */
public interface DispatchQueue {

    void enqueue(DispatchTask task);

    /**
     * Enqueue a task that becomes visible only after {@code delay}
     */
    void enqueue(DispatchTask task, Duration delay);

    /**
     * Receive up to {@code maxMessages} visible tasks and hide them for {@code visibilityTimeout}
     */
    List<DispatchDelivery> receive(String consumerId, int maxMessages, Duration visibilityTimeout);

    /**
     * Remove a delivered task for good.
     *
     * @return false if the receipt is stale (the task was redelivered meanwhile)
     */
    boolean acknowledge(DispatchDelivery delivery);

    long depth();
}
