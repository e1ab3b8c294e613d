package com.dcarunner.failure;

import com.dcarunner.domain.OperationKind;

import java.util.Map;

/**
 * Execute returned success=false, the relay call failed before acknowledging, or the mined transaction reverted.
 * Transient unless the payload names a fatal condition.
 */
public class ExecutionRejectedException extends OperationException {

    public static final String CODE = "EXECUTION_REJECTED";

    public ExecutionRejectedException(OperationKind kind, String ability, String error,
                                      Map<String, ?> payload, Throwable cause) {
        super(CODE, kind, "execute " + ability + " rejected: " + error, payload, cause);
    }
}
