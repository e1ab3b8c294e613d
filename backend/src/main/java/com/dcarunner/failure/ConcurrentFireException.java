package com.dcarunner.failure;

import java.util.Map;

/**
 * A fire was delivered while another fire of the same job is still running. The second fire is skipped.
 */
public class ConcurrentFireException extends OperationException {

    public static final String CODE = "CONCURRENT_FIRE";

    public ConcurrentFireException(String jobId) {
        super(CODE, null, "job " + jobId + " is already running", Map.of("jobId", jobId), null);
    }
}
