package com.dcarunner.execution;

import com.dcarunner.ability.AbilityResult;
import com.dcarunner.domain.AppReference;
import com.dcarunner.domain.OperationKind;
import com.dcarunner.domain.ScheduledOperation;
import org.mockito.stubbing.Answer;

import java.time.Instant;
import java.util.Map;

/**
 * Shared jobs and relay answers for executor tests.
 */
final class ExecutionFixtures {

    static final String OWNER = "0x1111111111111111111111111111111111111111";
    static final String RECIPIENT = "0x3333333333333333333333333333333333333333";
    static final String WETH = "0x4200000000000000000000000000000000000006";
    static final String USDC = "0x833589fcd6edb6e08f4c7c32d4f71b54bda02913";
    static final String VAULT = "0x2222222222222222222222222222222222222222";
    static final Instant STARTED_AT = Instant.parse("2026-10-01T12:00:00Z");

    private ExecutionFixtures() {
    }

    static ScheduledOperation job(OperationKind kind) {
        ScheduledOperation job = new ScheduledOperation();
        job.setId("job-" + kind.name().toLowerCase());
        job.setKind(kind);
        job.setOwnerAddress(OWNER);
        job.setApp(new AppReference("dca-app", 3));
        job.setEnabled(true);
        job.setIntervalSeconds(86_400);
        return job;
    }

    static OperationRun run(ScheduledOperation job) {
        return new OperationRun(job, STARTED_AT);
    }

    /** Relay answer: runs the post-precheck callback and acknowledges with the given hash. */
    static Answer<AbilityResult> acknowledged(String txHash) {
        return invocation -> {
            Runnable onPrechecked = invocation.getArgument(4);
            onPrechecked.run();
            return AbilityResult.ok(Map.of("txHash", txHash));
        };
    }
}
