package com.dcarunner.authorization;

import com.dcarunner.domain.OperationKind;
import com.dcarunner.failure.PermittedVersionDowngradeException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UpgradeOnlyVersionPolicyTest {

    private final UpgradeOnlyVersionPolicy policy = new UpgradeOnlyVersionPolicy();

    @Test
    void runsLiveVersionWhenSameOrNewer() {
        assertThat(policy.versionToRun(OperationKind.DCA_SWAP, 2, 2)).isEqualTo(2);
        assertThat(policy.versionToRun(OperationKind.DCA_SWAP, 2, 4)).isEqualTo(4);
    }

    @Test
    void rejectsDowngrade() {
        assertThatThrownBy(() -> policy.versionToRun(OperationKind.DCA_SWAP, 4, 2))
                .isInstanceOf(PermittedVersionDowngradeException.class)
                .hasMessageContaining("from 4 to 2");
    }
}
