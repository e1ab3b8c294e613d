package com.dcarunner.authorization;

import com.dcarunner.domain.AppReference;
import com.dcarunner.domain.ScheduledOperation;
import com.dcarunner.failure.AuthorizationRevokedException;
import com.dcarunner.store.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Re-validates delegated authorization at fire time. Fails closed: no permitted version means the fire stops
 * before anything touches the chain. A changed version is persisted on the job before the fire continues.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AuthorizationGate {

    private final PermittedVersionStore permittedVersionStore;
    private final VersionPolicy versionPolicy;
    private final JobStore jobStore;

    /**
     * Reconciles the job's stored app version with the owner's live one. On advance the job instance passed in is
     * updated as well, so the rest of the fire sees the new version.
     *
     * @throws AuthorizationRevokedException when the owner holds no permitted version
     */
    public AuthorizationDecision reconcile(ScheduledOperation job) {
        AppReference app = job.getApp();
        Optional<Integer> current = permittedVersionStore.getCurrentPermittedVersion(job.getOwnerAddress(), app.getAppId());
        if (current.isEmpty()) {
            throw new AuthorizationRevokedException(job.getKind(), job.getOwnerAddress(), app.getAppId());
        }
        int stored = app.getVersion();
        int versionToRun = versionPolicy.versionToRun(job.getKind(), stored, current.get());
        if (versionToRun == stored) {
            return new AuthorizationDecision(stored, false);
        }
        boolean persisted = jobStore.advanceAppVersion(job.getId(), versionToRun);
        app.setVersion(versionToRun);
        log.info("Job {} app {} version {} -> {} (persisted={})", job.getId(), app.getAppId(), stored, versionToRun,
                persisted);
        return new AuthorizationDecision(versionToRun, true);
    }
}
