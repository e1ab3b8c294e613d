package com.dcarunner.failure;

import com.dcarunner.domain.OperationKind;

import java.util.Map;

/**
 * Execution record could not be written after a successful submission. Reported next to the success, never retried.
 */
public class PersistenceFailureException extends OperationException {

    public static final String CODE = "PERSISTENCE_FAILURE";

    public PersistenceFailureException(OperationKind kind, String txHash, Throwable cause) {
        super(CODE, kind, "failed to persist execution record for " + txHash,
                Map.of("txHash", String.valueOf(txHash)), cause);
    }
}
