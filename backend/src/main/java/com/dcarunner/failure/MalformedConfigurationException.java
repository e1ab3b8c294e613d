package com.dcarunner.failure;

import com.dcarunner.domain.OperationKind;

import java.util.Map;

/**
 * Job parameters or vault/token configuration that can never produce a valid submission
 * (malformed address, missing amount, unusable decimals). Fatal.
 */
public class MalformedConfigurationException extends OperationException {

    public static final String CODE = "MALFORMED_CONFIGURATION";

    public MalformedConfigurationException(OperationKind kind, String message, Map<String, ?> context) {
        super(CODE, kind, message, context, null);
    }

    public MalformedConfigurationException(OperationKind kind, String message, Throwable cause) {
        super(CODE, kind, message, null, cause);
    }
}
