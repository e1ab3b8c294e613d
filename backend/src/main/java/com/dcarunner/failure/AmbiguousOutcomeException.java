package com.dcarunner.failure;

import com.dcarunner.domain.OperationKind;

import java.util.Map;

/**
 * The submission may or may not be on-chain (acknowledged without a transaction hash, or no receipt in time).
 * Never retried automatically; the job is disabled for manual reconciliation.
 */
public class AmbiguousOutcomeException extends OperationException {

    public static final String CODE = "AMBIGUOUS_OUTCOME";

    public AmbiguousOutcomeException(OperationKind kind, String message, Map<String, ?> context, Throwable cause) {
        super(CODE, kind, message, context, cause);
    }
}
