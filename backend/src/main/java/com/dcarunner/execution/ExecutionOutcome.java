package com.dcarunner.execution;

import com.dcarunner.domain.ExecutionRecord;
import com.dcarunner.failure.PersistenceFailureException;

/**
 * Terminal success of a fire. An executed outcome always has a txHash; its record is null only when persisting
 * failed, in which case persistenceFailure says why. A record with a persistenceFailure means a later update of it
 * (the receipt status) was lost.
 */
public record ExecutionOutcome(
        Status status,
        String txHash,
        ExecutionRecord record,
        PersistenceFailureException persistenceFailure,
        String skipReason
) {

    public enum Status {
        EXECUTED,
        SKIPPED
    }

    public static ExecutionOutcome executed(String txHash, ExecutionRecord record) {
        return new ExecutionOutcome(Status.EXECUTED, txHash, record, null, null);
    }

    public static ExecutionOutcome executedWithoutRecord(String txHash, PersistenceFailureException failure) {
        return new ExecutionOutcome(Status.EXECUTED, txHash, null, failure, null);
    }

    public static ExecutionOutcome skipped(String reason) {
        return new ExecutionOutcome(Status.SKIPPED, null, null, null, reason);
    }

    /** Same outcome, reporting a persistence failure that happened after the record was written. */
    public ExecutionOutcome withPersistenceFailure(PersistenceFailureException failure) {
        return new ExecutionOutcome(status, txHash, record, failure, skipReason);
    }
}
