package com.dcarunner.execution;

import com.dcarunner.domain.OperationKind;

/**
 * Runs one fire of a job of a single operation kind, from authorization to persistence.
 */
public interface OperationExecutor {

    /**
     * Whether this executor handles the given kind.
     */
    boolean supports(OperationKind kind);

    /**
     * Runs the fire. Failures propagate unclassified; {@code run.getState()} tells how far the fire got.
     */
    ExecutionOutcome execute(OperationRun run);
}
