package com.dcarunner.authorization;

import com.dcarunner.domain.OperationKind;
import com.dcarunner.failure.PermittedVersionDowngradeException;
import org.springframework.stereotype.Component;

/**
 * Runs the owner's live version when it is the same or newer than the stored one; a lower live version is fatal.
 */
@Component
public class UpgradeOnlyVersionPolicy implements VersionPolicy {

    @Override
    public int versionToRun(OperationKind kind, int storedVersion, int currentVersion) {
        if (currentVersion < storedVersion) {
            throw new PermittedVersionDowngradeException(kind, storedVersion, currentVersion);
        }
        return currentVersion;
    }
}
