package com.dcarunner.execution;

import com.dcarunner.ability.AbilityContext;
import com.dcarunner.common.AmountNormalizer;
import com.dcarunner.common.EvmAddress;
import com.dcarunner.domain.OperationKind;
import com.dcarunner.domain.ScheduledOperation;
import com.dcarunner.failure.MalformedConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.Map;

/**
 * Fire skeleton shared by all kinds: authorize, normalize ({@link #prepare}), precheck + execute, persist, confirm.
 * Nothing reaches the relay before authorization and normalization succeed; nothing is persisted before the relay
 * acknowledged the submission.
 */
@Slf4j
public abstract class AbstractOperationExecutor implements OperationExecutor {

    protected final SubmissionPipeline pipeline;

    protected AbstractOperationExecutor(SubmissionPipeline pipeline) {
        this.pipeline = pipeline;
    }

    protected abstract OperationKind kind();

    /**
     * Reads auxiliary data and normalizes every amount. Must not submit anything on-chain.
     */
    protected abstract PreparedOperation prepare(OperationRun run);

    /**
     * Hook for side submissions that must land before the main one (token approvals). Default: none.
     */
    protected void beforeSubmission(OperationRun run, PreparedOperation prepared, AbilityContext context) {
    }

    @Override
    public boolean supports(OperationKind kind) {
        return kind() == kind;
    }

    @Override
    public final ExecutionOutcome execute(OperationRun run) {
        ScheduledOperation job = run.getJob();
        pipeline.authorize(run);

        PreparedOperation prepared = prepare(run);
        run.advance(ExecutionState.NORMALIZED);
        if (prepared.isSkipped()) {
            log.info("Job {} ({}) skipped: {}", job.getId(), job.getKind(), prepared.getSkipReason());
            return ExecutionOutcome.skipped(prepared.getSkipReason());
        }

        AbilityContext context = new AbilityContext(job.getOwnerAddress());
        beforeSubmission(run, prepared, context);
        pipeline.submit(run, prepared, context);

        ExecutionOutcome outcome = pipeline.persist(run, prepared);
        return pipeline.confirm(run, outcome);
    }

    /** Parameter block of this kind, or a fatal configuration error when the job has none. */
    protected <T> T requireParams(T params) {
        if (params == null) {
            throw new MalformedConfigurationException(kind(), "job has no " + kind() + " parameters", Map.of());
        }
        return params;
    }

    /** Lowercase address, or a fatal configuration error naming the field. */
    protected String requireAddress(String field, String value) {
        if (!EvmAddress.isValid(value)) {
            throw new MalformedConfigurationException(kind(), "malformed " + field + " address: " + value,
                    Map.of(field, String.valueOf(value)));
        }
        return EvmAddress.normalize(value);
    }

    /**
     * Normalizes a human amount at the given precision and records both forms on the prepared operation.
     */
    protected BigInteger normalizeInto(PreparedOperation prepared, String field, String human, int decimals) {
        if (human == null || human.isBlank()) {
            throw new MalformedConfigurationException(kind(), "missing " + field, Map.of("field", field));
        }
        BigInteger normalized = AmountNormalizer.normalize(human, decimals);
        prepared.amount(field, AmountNormalizer.truncate(human, decimals), normalized);
        return normalized;
    }
}
