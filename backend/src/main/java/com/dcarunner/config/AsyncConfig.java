package com.dcarunner.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Named worker pool for fires. Distinct jobs run in parallel; the same job never runs twice at once
 * (enforced by the fire handler, not by the pool).
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String FIRE_EXECUTOR = "fire-executor";

    @Bean(name = FIRE_EXECUTOR)
    public ThreadPoolTaskExecutor fireExecutor(
            @Value("${dcarunner.scheduler.worker-pool-size:4}") int workerPoolSize,
            @Value("${dcarunner.scheduler.batch-size:50}") int batchSize) {
        int workers = Math.max(1, workerPoolSize);
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(workers);
        e.setMaxPoolSize(workers);
        e.setQueueCapacity(Math.max(1, batchSize) * 2);
        e.setThreadNamePrefix("fire-");
        e.setWaitForTasksToCompleteOnShutdown(true);
        e.setAwaitTerminationSeconds(60);
        e.initialize();
        return e;
    }
}
