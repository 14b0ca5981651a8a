package com.example.cronscheduler.config;

import com.example.cronscheduler.service.retry.BackoffPolicy;
import com.example.cronscheduler.service.retry.ExponentialBackoffPolicy;
import com.example.cronscheduler.service.retry.JitteredBackoffPolicy;
import com.example.cronscheduler.service.retry.LinearBackoffPolicy;
import com.example.cronscheduler.support.InstanceIdentity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Core collaborators shared by the scheduler and the worker: the clock,
 * this instance's identity and the backoff policy.
 */
@Slf4j
@Configuration
public class CoreConfig {

    /**
     * System UTC clock. Tests replace it with a controllable one.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public InstanceIdentity instanceIdentity(CronSchedulerProperties properties,
                                             @Value("${HOSTNAME:unknown}") String hostname) {
        var identity = InstanceIdentity.resolve(properties.getInstanceId(), hostname);
        log.info("Cron scheduler instance id: {}", identity.getId());
        return identity;
    }

    @Bean
    public BackoffPolicy backoffPolicy(CronSchedulerProperties properties) {
        var retry = properties.getRetry();
        log.info("Using {} backoff policy (ceiling {} ms)", retry.getPolicy(), retry.getMaxBackoffMs());
        return switch (retry.getPolicy()) {
            case EXPONENTIAL -> new ExponentialBackoffPolicy(retry.getMaxBackoffMs());
            case LINEAR -> new LinearBackoffPolicy(retry.getMaxBackoffMs());
            case JITTERED -> new JitteredBackoffPolicy(retry.getMaxBackoffMs());
        };
    }
}
