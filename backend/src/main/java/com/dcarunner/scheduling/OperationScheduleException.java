package com.dcarunner.scheduling;

import lombok.Getter;

/**
 * Thrown by OperationScheduleService when a request is invalid or names a job the caller does not own.
 */
@Getter
public class OperationScheduleException extends RuntimeException {

    public static final String INVALID_ADDRESS = "INVALID_ADDRESS";
    public static final String INVALID_AMOUNT = "INVALID_AMOUNT";
    public static final String INVALID_FREQUENCY = "INVALID_FREQUENCY";
    public static final String INVALID_REQUEST = "INVALID_REQUEST";
    public static final String JOB_NOT_FOUND = "JOB_NOT_FOUND";

    /** One of the constants above. */
    private final String errorCode;

    public OperationScheduleException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
