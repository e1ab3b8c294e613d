package com.dcarunner.failure;

import com.dcarunner.domain.OperationKind;

import java.util.Map;

/**
 * Precheck returned success=false, or the relay could not be reached for the precheck.
 * Transient unless the payload names a fatal condition.
 */
public class PrecheckRejectedException extends OperationException {

    public static final String CODE = "PRECHECK_REJECTED";

    public PrecheckRejectedException(OperationKind kind, String ability, String error,
                                     Map<String, ?> payload, Throwable cause) {
        super(CODE, kind, "precheck " + ability + " rejected: " + error, payload, cause);
    }
}
