package com.dcarunner.authorization;

/**
 * The permitted-version registry could not be reached or answered with an error. Transient.
 */
public class PermittedVersionLookupException extends RuntimeException {

    public PermittedVersionLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
