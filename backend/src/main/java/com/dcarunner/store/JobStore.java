package com.dcarunner.store;

import com.dcarunner.domain.ScheduledOperation;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Recurring-job store. Every mutation except {@link #save} is a targeted update of the named fields on an existing
 * job: it never recreates a removed job and never overwrites fields changed concurrently by the owner.
 * Each returns false when no job matched.
 */
public interface JobStore {

    Optional<ScheduledOperation> load(String jobId);

    /** Insert a new job or replace it wholesale. Used on creation only. */
    ScheduledOperation save(ScheduledOperation job);

    boolean disable(String jobId, String reason);

    /** Re-enable after an explicit owner action. Clears the disabled reason. */
    boolean enable(String jobId, Instant nextRunAt);

    boolean remove(String jobId);

    /** Enabled jobs with nextRunAt at or before now, oldest first. */
    List<ScheduledOperation> listDue(Instant now, int limit);

    /** Raises app.version to the given value; a stored version at or above it is left alone. */
    boolean advanceAppVersion(String jobId, int version);

    boolean markStarted(String jobId, Instant startedAt);

    boolean recordSuccess(String jobId, Instant finishedAt, Instant nextRunAt);

    boolean recordFailure(String jobId, Instant failedAt, String reason, Instant nextRunAt);
}
