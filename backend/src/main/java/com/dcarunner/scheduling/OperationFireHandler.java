package com.dcarunner.scheduling;

import com.dcarunner.common.CallTimeoutException;
import com.dcarunner.domain.OperationKind;
import com.dcarunner.domain.ScheduledOperation;
import com.dcarunner.execution.ExecutionOutcome;
import com.dcarunner.execution.OperationExecutor;
import com.dcarunner.execution.OperationRun;
import com.dcarunner.failure.AmbiguousOutcomeException;
import com.dcarunner.failure.ConcurrentFireException;
import com.dcarunner.failure.Disposition;
import com.dcarunner.failure.FailureClassifier;
import com.dcarunner.failure.OperationException;
import com.dcarunner.failure.ScheduleDisabledException;
import com.dcarunner.store.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Boundary of a single fire. Enforces at most one running fire per job, runs the kind's executor, classifies a
 * failure exactly once, and records the fire on the job. Every failure is rethrown to the caller: a disabling one
 * as {@link ScheduleDisabledException}, a transient one as-is.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OperationFireHandler {

    private final Set<String> inFlightJobs = ConcurrentHashMap.newKeySet();

    private final JobStore jobStore;
    private final List<OperationExecutor> executors;
    private final FailureClassifier failureClassifier;

    public boolean isInFlight(String jobId) {
        return inFlightJobs.contains(jobId);
    }

    /**
     * @return the outcome, or empty when the job was removed or disabled before this fire started
     * @throws ConcurrentFireException when a fire of the same job is still running (this fire is skipped)
     */
    public Optional<ExecutionOutcome> fire(String jobId) {
        if (!inFlightJobs.add(jobId)) {
            throw new ConcurrentFireException(jobId);
        }
        try {
            return fireExclusive(jobId);
        } finally {
            inFlightJobs.remove(jobId);
        }
    }

    private Optional<ExecutionOutcome> fireExclusive(String jobId) {
        Optional<ScheduledOperation> loaded = jobStore.load(jobId);
        if (loaded.isEmpty()) {
            log.info("Job {} no longer exists; fire ignored", jobId);
            return Optional.empty();
        }
        ScheduledOperation job = loaded.get();
        if (!job.isEnabled()) {
            log.info("Job {} is disabled ({}); fire ignored", jobId, job.getDisabledReason());
            return Optional.empty();
        }
        OperationExecutor executor = executorFor(job.getKind());

        Instant startedAt = Instant.now();
        Instant nextRunAt = startedAt.plusSeconds(job.getIntervalSeconds());
        jobStore.markStarted(jobId, startedAt);
        log.info("Job {} ({}) fire started for {}", jobId, job.getKind(), job.getOwnerAddress());
        OperationRun run = new OperationRun(job, startedAt);

        ExecutionOutcome outcome;
        try {
            outcome = executor.execute(run);
        } catch (RuntimeException e) {
            throw onFailure(run, e, nextRunAt);
        }
        jobStore.recordSuccess(jobId, Instant.now(), nextRunAt);
        if (outcome.status() == ExecutionOutcome.Status.SKIPPED) {
            log.info("Job {} ({}) fire skipped: {}", jobId, job.getKind(), outcome.skipReason());
        } else {
            log.info("Job {} ({}) fire executed {} (recorded={})", jobId, job.getKind(), outcome.txHash(),
                    outcome.record() != null);
        }
        return Optional.of(outcome);
    }

    private RuntimeException onFailure(OperationRun run, RuntimeException failure, Instant nextRunAt) {
        ScheduledOperation job = run.getJob();
        RuntimeException effective = failure;
        // after submission only typed failures describe the on-chain outcome; anything else leaves it unknown
        if (run.isSubmitted() && !(failure instanceof OperationException)) {
            String what = failure instanceof CallTimeoutException ? "timed out" : "failed";
            effective = new AmbiguousOutcomeException(job.getKind(),
                    what + " after submitting " + run.getTxHash(),
                    Map.of("txHash", String.valueOf(run.getTxHash())), failure);
        }
        Disposition disposition = failureClassifier.classify(job.getKind(), effective);
        String reason = reasonOf(effective);
        jobStore.recordFailure(job.getId(), Instant.now(), reason, nextRunAt);
        if (disposition.disablesJob()) {
            jobStore.disable(job.getId(), reason);
            log.error("Job {} ({}) disabled after {} failure in state {}", job.getId(), job.getKind(),
                    disposition, run.getState(), effective);
            return new ScheduleDisabledException(job.getId(), job.getKind(), disposition, effective);
        }
        log.error("Job {} ({}) failed in state {}; stays enabled, next fire at {}", job.getId(), job.getKind(),
                run.getState(), nextRunAt, effective);
        return effective;
    }

    private OperationExecutor executorFor(OperationKind kind) {
        return executors.stream()
                .filter(e -> e.supports(kind))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No executor for " + kind));
    }

    private static String reasonOf(Throwable failure) {
        return failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
    }
}
