package com.dcarunner.ability;

/**
 * Transport-level failure talking to the signing relay (connection refused, non-protocol error response).
 */
public class AbilityClientException extends RuntimeException {

    public AbilityClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
