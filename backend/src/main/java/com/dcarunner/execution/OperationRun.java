package com.dcarunner.execution;

import com.dcarunner.domain.ScheduledOperation;
import lombok.Getter;

import java.time.Instant;

/**
 * Mutable state of a single fire of one job. Owned by one worker thread.
 */
@Getter
public class OperationRun {

    private final ScheduledOperation job;
    private final Instant startedAt;
    private ExecutionState state = ExecutionState.LOADED;
    private int versionToRun;
    private String txHash;

    public OperationRun(ScheduledOperation job, Instant startedAt) {
        this.job = job;
        this.startedAt = startedAt;
    }

    /**
     * @throws IllegalStateException when next is not the state directly after the current one
     */
    public void advance(ExecutionState next) {
        if (next.ordinal() != state.ordinal() + 1) {
            throw new IllegalStateException("job " + job.getId() + " cannot move from " + state + " to " + next);
        }
        state = next;
    }

    public void authorized(int version) {
        advance(ExecutionState.AUTHORIZATION_CHECKED);
        this.versionToRun = version;
    }

    public void executed(String submittedTxHash) {
        advance(ExecutionState.EXECUTED);
        this.txHash = submittedTxHash;
    }

    /** True once the chain operation was acknowledged; a failure from here on has an unknown or committed outcome. */
    public boolean isSubmitted() {
        return state.compareTo(ExecutionState.EXECUTED) >= 0;
    }
}
