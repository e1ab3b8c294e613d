package com.dcarunner.scheduling;

import com.dcarunner.config.AsyncConfig;
import com.dcarunner.domain.ScheduledOperation;
import com.dcarunner.failure.ConcurrentFireException;
import com.dcarunner.scheduling.config.SchedulerProperties;
import com.dcarunner.store.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Delivers fires: each poll dispatches enabled jobs whose nextRunAt has passed to the fire worker pool.
 * A job already queued or running is not dispatched again.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DueOperationPoller {

    private final Set<String> dispatched = ConcurrentHashMap.newKeySet();

    private final JobStore jobStore;
    private final OperationFireHandler fireHandler;
    private final SchedulerProperties properties;
    @Qualifier(AsyncConfig.FIRE_EXECUTOR)
    private final Executor fireExecutor;

    @Scheduled(fixedDelayString = "${dcarunner.scheduler.poll-interval-ms:15000}",
            initialDelayString = "${dcarunner.scheduler.poll-interval-ms:15000}")
    public void pollDue() {
        if (!properties.isEnabled()) {
            return;
        }
        List<ScheduledOperation> due = jobStore.listDue(Instant.now(), Math.max(1, properties.getBatchSize()));
        int count = 0;
        for (ScheduledOperation job : due) {
            String jobId = job.getId();
            if (fireHandler.isInFlight(jobId) || !dispatched.add(jobId)) {
                log.debug("Job {} still running; not dispatched", jobId);
                continue;
            }
            try {
                fireExecutor.execute(() -> fire(jobId));
                count++;
            } catch (RejectedExecutionException e) {
                dispatched.remove(jobId);
                log.warn("Fire pool saturated; job {} and the rest of this batch wait for the next poll", jobId);
                break;
            }
        }
        if (count > 0) {
            log.info("Dispatched {} due job(s)", count);
        }
    }

    void fire(String jobId) {
        try {
            fireHandler.fire(jobId);
        } catch (ConcurrentFireException e) {
            log.warn("Job {} fire skipped: {}", jobId, e.getMessage());
        } catch (RuntimeException e) {
            // outcome already recorded on the job and logged by the fire handler
            log.debug("Job {} fire ended with {}", jobId, e.toString());
        } finally {
            dispatched.remove(jobId);
        }
    }
}
