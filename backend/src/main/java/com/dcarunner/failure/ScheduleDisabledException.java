package com.dcarunner.failure;

import com.dcarunner.domain.OperationKind;

import java.util.Map;

/**
 * Terminal error of a fire whose failure disabled the job. No further automatic fire will happen until the owner
 * re-enables it. The classified failure is the cause.
 */
public class ScheduleDisabledException extends OperationException {

    public static final String CODE = "SCHEDULE_DISABLED";

    private final Disposition disposition;

    public ScheduleDisabledException(String jobId, OperationKind kind, Disposition disposition, Throwable cause) {
        super(CODE, kind, "job " + jobId + " disabled due to " + disposition.name().toLowerCase()
                        + " failure: " + cause.getMessage(),
                Map.of("jobId", jobId, "disposition", disposition.name()), cause);
        this.disposition = disposition;
    }

    public Disposition getDisposition() {
        return disposition;
    }
}
