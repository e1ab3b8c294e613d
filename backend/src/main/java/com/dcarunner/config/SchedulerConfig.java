package com.dcarunner.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Single-thread scheduler that drives the due-operation poll loop. Fires themselves run on the fire executor
 * ({@link AsyncConfig}); this thread only claims due jobs and hands them off, so one is enough and two ticks of
 * the loop never overlap.
 * <p>
 * A tick that throws is logged and the loop keeps its fixed delay. On shutdown the scheduler waits for the
 * current tick so that jobs it already claimed are handed to the fire executor.
 */
@Slf4j
@Configuration
@EnableScheduling
public class SchedulerConfig {

    public static final String SCHEDULER_POOL = "scheduler-pool";

    @Bean(name = SCHEDULER_POOL)
    public ThreadPoolTaskScheduler schedulerPool(
            @Value("${dcarunner.scheduler.shutdown-await-seconds:30}") int shutdownAwaitSeconds) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("scheduler-");
        scheduler.setErrorHandler(e -> log.error("Due-operation poll tick failed; next tick keeps its schedule", e));
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(shutdownAwaitSeconds);
        scheduler.initialize();
        return scheduler;
    }
}
