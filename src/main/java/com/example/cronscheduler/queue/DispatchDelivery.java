package com.example.cronscheduler.queue;

import lombok.Value;

import java.util.UUID;

/**
 * A received task plus the receipt needed to acknowledge it.
 * A receipt becomes stale when the message is redelivered to someone else.
 */
@Value
public class DispatchDelivery {
    UUID messageId;
    DispatchTask task;
    int receipt;

    /**
     * How many times the message has been handed out, this delivery included
     */
    public int getDeliveryCount() {
        return receipt;
    }
}
