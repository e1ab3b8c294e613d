package com.dcarunner.scheduling.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Poll loop and fire worker settings. Documented in application.yml under dcarunner.scheduler.
 */
@ConfigurationProperties(prefix = "dcarunner.scheduler")
@NoArgsConstructor
@Getter
@Setter
public class SchedulerProperties {

    /** When false the poll loop does nothing (fires can still be triggered directly). */
    private boolean enabled = true;

    /** Delay between the end of one poll and the start of the next. */
    private long pollIntervalMs = 15_000;

    /** Fire worker threads. */
    private int workerPoolSize = 4;

    /** Max due jobs dispatched per poll. */
    private int batchSize = 50;

    /** Shortest accepted schedule interval. */
    private long minIntervalSeconds = 60;
}
