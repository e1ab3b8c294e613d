package com.dcarunner.failure;

import com.dcarunner.domain.OperationKind;

import java.util.Map;

/**
 * The live permitted version is lower than the one recorded on the job. Fatal: the recorded version never regresses.
 */
public class PermittedVersionDowngradeException extends OperationException {

    public static final String CODE = "PERMITTED_VERSION_DOWNGRADE";

    public PermittedVersionDowngradeException(OperationKind kind, int storedVersion, int currentVersion) {
        super(CODE, kind, "permitted version moved backwards from " + storedVersion + " to " + currentVersion,
                Map.of("storedVersion", storedVersion, "currentVersion", currentVersion), null);
    }
}
