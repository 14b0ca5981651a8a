package com.example.cronscheduler.support;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;

/**
 * Identity of this process as a lease owner and queue consumer.
 */
@Getter
@EqualsAndHashCode
public final class InstanceIdentity {

    private final String id;

    public InstanceIdentity(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Instance id must not be blank");
        }
        this.id = id;
    }

    /**
     * Use the configured id if present, otherwise {@code host-pid}
     */
    public static InstanceIdentity resolve(String configured, String fallbackHostname) {
        if (configured != null && !configured.isBlank()) {
            return new InstanceIdentity(configured);
        }
        try {
            var host = InetAddress.getLocalHost().getHostName();
            return new InstanceIdentity(host + "-" + ProcessHandle.current().pid());
        } catch (UnknownHostException e) {
            return new InstanceIdentity(fallbackHostname + "-" + UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public String toString() {
        return id;
    }
}
