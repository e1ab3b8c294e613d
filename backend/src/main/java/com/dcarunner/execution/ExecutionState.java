package com.dcarunner.execution;

/**
 * Progress of one fire. States are passed strictly in declaration order.
 */
public enum ExecutionState {
    LOADED,
    AUTHORIZATION_CHECKED,
    NORMALIZED,
    PRECHECKED,
    /** Relay acknowledged the submission with a transaction hash; nothing from here on may be retried. */
    EXECUTED,
    PERSISTED
}
