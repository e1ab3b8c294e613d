package com.dcarunner.failure;

import java.util.Map;

/**
 * An auxiliary read (token decimals, vault configuration, spot price, premium quote) failed and that read
 * has no documented fallback. Fatal.
 */
public class AuxiliaryLookupException extends OperationException {

    public static final String CODE = "AUXILIARY_LOOKUP_FAILED";

    public AuxiliaryLookupException(String lookup, String message, Throwable cause) {
        super(CODE, null, lookup + ": " + message, Map.of("lookup", lookup), cause);
    }
}
