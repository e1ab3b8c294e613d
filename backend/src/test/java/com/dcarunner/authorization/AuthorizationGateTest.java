package com.dcarunner.authorization;

import com.dcarunner.domain.AppReference;
import com.dcarunner.domain.OperationKind;
import com.dcarunner.domain.ScheduledOperation;
import com.dcarunner.failure.AuthorizationRevokedException;
import com.dcarunner.failure.PermittedVersionDowngradeException;
import com.dcarunner.store.JobStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AuthorizationGateTest {

    private static final String OWNER = "0x1111111111111111111111111111111111111111";

    @Mock
    private PermittedVersionStore permittedVersionStore;
    @Mock
    private JobStore jobStore;

    private AuthorizationGate gate;
    private ScheduledOperation job;

    @BeforeEach
    void setUp() {
        gate = new AuthorizationGate(permittedVersionStore, new UpgradeOnlyVersionPolicy(), jobStore);
        job = new ScheduledOperation();
        job.setId("job-1");
        job.setKind(OperationKind.TRANSFER);
        job.setOwnerAddress(OWNER);
        job.setApp(new AppReference("dca-app", 3));
    }

    @Test
    @DisplayName("unchanged version runs as stored without touching the job store")
    void sameVersion() {
        when(permittedVersionStore.getCurrentPermittedVersion(OWNER, "dca-app")).thenReturn(Optional.of(3));

        AuthorizationDecision decision = gate.reconcile(job);

        assertThat(decision.versionToRun()).isEqualTo(3);
        assertThat(decision.advanced()).isFalse();
        verify(jobStore, never()).advanceAppVersion(anyString(), anyInt());
    }

    @Test
    @DisplayName("newer live version is persisted before the fire continues")
    void upgrade() {
        when(permittedVersionStore.getCurrentPermittedVersion(OWNER, "dca-app")).thenReturn(Optional.of(5));
        when(jobStore.advanceAppVersion("job-1", 5)).thenReturn(true);

        AuthorizationDecision decision = gate.reconcile(job);

        assertThat(decision.versionToRun()).isEqualTo(5);
        assertThat(decision.advanced()).isTrue();
        assertThat(job.getApp().getVersion()).isEqualTo(5);
        verify(jobStore).advanceAppVersion("job-1", 5);
    }

    @Test
    @DisplayName("no permitted version fails closed")
    void revoked() {
        when(permittedVersionStore.getCurrentPermittedVersion(OWNER, "dca-app")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> gate.reconcile(job)).isInstanceOf(AuthorizationRevokedException.class);
        verify(jobStore, never()).advanceAppVersion(anyString(), anyInt());
    }

    @Test
    @DisplayName("lower live version never regresses the stored one")
    void downgrade() {
        when(permittedVersionStore.getCurrentPermittedVersion(OWNER, "dca-app")).thenReturn(Optional.of(2));

        assertThatThrownBy(() -> gate.reconcile(job)).isInstanceOf(PermittedVersionDowngradeException.class);
        assertThat(job.getApp().getVersion()).isEqualTo(3);
        verify(jobStore, never()).advanceAppVersion(anyString(), anyInt());
    }
}
