package com.dcarunner.failure;

import com.dcarunner.domain.OperationKind;

import java.util.Map;

/**
 * A human-entered quantity or token precision that cannot be represented on-chain. Fatal: the same parameters fail
 * on every fire. Kind is null when raised by the normalizer itself, outside a kind-specific step.
 */
public class InvalidAmountException extends OperationException {

    public static final String CODE = "INVALID_AMOUNT";

    public InvalidAmountException(OperationKind kind, String message, Map<String, ?> context, Throwable cause) {
        super(CODE, kind, message, context, cause);
    }

    public InvalidAmountException(String message, Map<String, ?> context, Throwable cause) {
        this(null, message, context, cause);
    }

    public InvalidAmountException(String message, Map<String, ?> context) {
        this(null, message, context, null);
    }

    public InvalidAmountException(String message) {
        this(null, message, null, null);
    }
}
