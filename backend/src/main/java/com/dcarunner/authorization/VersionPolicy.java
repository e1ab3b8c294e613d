package com.dcarunner.authorization;

import com.dcarunner.domain.OperationKind;

/**
 * Decides which app version a fire runs under, given the version stored on the job and the owner's live version.
 */
@FunctionalInterface
public interface VersionPolicy {

    int versionToRun(OperationKind kind, int storedVersion, int currentVersion);
}
