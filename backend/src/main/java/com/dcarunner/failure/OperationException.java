package com.dcarunner.failure;

import com.dcarunner.domain.OperationKind;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base of every failure raised while firing a scheduled operation. Carries a stable error code, the operation kind
 * (null when raised outside a kind-specific step) and the diagnostic context of the failing step
 * (normalized parameters, collaborator payload). Inner layers attach context here instead of logging.
 */
@Getter
public class OperationException extends RuntimeException {

    private final String errorCode;
    private final OperationKind kind;
    private final Map<String, Object> context;

    public OperationException(String errorCode, OperationKind kind, String message,
                              Map<String, ?> context, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.kind = kind;
        this.context = context == null || context.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public OperationException(String errorCode, OperationKind kind, String message) {
        this(errorCode, kind, message, null, null);
    }
}
