package com.example.cronscheduler.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Thread pools for callback execution and {@code @Async} work.
 * <p>
 * Callbacks are blocking I/O bounded by the callback timeout, so the callback pool
 * is sized by {@code cron-scheduler.worker.concurrency}; the worker never receives
 * more messages than it has free threads.
 */
@Slf4j
@EnableAsync
@Configuration
public class AsyncConfig {

    /**
     * Fixed pool that runs dispatch tasks (one callback per thread at a time)
     */
    @Bean(name = "callbackExecutor", destroyMethod = "shutdown")
    public ExecutorService callbackExecutor(CronSchedulerProperties properties) {
        var concurrency = properties.getWorker().getConcurrency();
        log.info("Creating callback executor with {} threads", concurrency);
        return Executors.newFixedThreadPool(concurrency, new CustomizableThreadFactory("callback-worker-"));
    }

    /**
     * Task executor for Spring's @Async annotation (alerts)
     */
    @Bean(name = "taskExecutor")
    public TaskExecutor taskExecutor() {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("async-task-");
        executor.setRejectedExecutionHandler((r, e) -> {
            log.warn("Task rejected from async executor, running in caller thread");
            if (!e.isShutdown()) {
                r.run();
            }
        });
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();

        return executor;
    }
}
