package com.dcarunner.execution;

import com.dcarunner.ability.AbilityContext;
import com.dcarunner.ability.AbilityInvoker;
import com.dcarunner.ability.AbilityResult;
import com.dcarunner.ability.config.AbilityProperties;
import com.dcarunner.authorization.AuthorizationDecision;
import com.dcarunner.authorization.AuthorizationGate;
import com.dcarunner.chain.TransactionReceiptWatcher;
import com.dcarunner.domain.ExecutionRecord;
import com.dcarunner.domain.OperationKind;
import com.dcarunner.domain.ReceiptStatus;
import com.dcarunner.domain.ScheduledOperation;
import com.dcarunner.failure.ExecutionRejectedException;
import com.dcarunner.failure.PersistenceFailureException;
import com.dcarunner.records.ExecutionRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Steps shared by every operation kind: authorization, relay submission, record persistence and optional receipt
 * confirmation. Each step advances the run's state.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SubmissionPipeline {

    private final AuthorizationGate authorizationGate;
    private final AbilityInvoker abilityInvoker;
    private final ExecutionRecordStore recordStore;
    private final TransactionReceiptWatcher receiptWatcher;
    private final AbilityProperties abilityProperties;

    public void authorize(OperationRun run) {
        AuthorizationDecision decision = authorizationGate.reconcile(run.getJob());
        run.authorized(decision.versionToRun());
    }

    /**
     * Side submission that is not the fire's own operation (e.g. a token approval). Does not move the run's state.
     *
     * @return transaction hash of the side submission
     */
    public String submitAuxiliary(OperationKind kind, String ability, PreparedOperation prepared,
                                  AbilityContext context) {
        return abilityInvoker.invoke(kind, ability, prepared.getAbilityParams(), context, () -> { })
                .transactionHash();
    }

    public String submit(OperationRun run, PreparedOperation prepared, AbilityContext context) {
        ScheduledOperation job = run.getJob();
        AbilityResult result = abilityInvoker.invoke(job.getKind(), prepared.getAbility(),
                prepared.getAbilityParams(), context, () -> run.advance(ExecutionState.PRECHECKED));
        run.executed(result.transactionHash());
        log.info("Job {} ({}) submitted {}", job.getId(), job.getKind(), run.getTxHash());
        return run.getTxHash();
    }

    /**
     * Writes the execution record. A persistence failure does not undo the submission: it is returned in the outcome.
     */
    public ExecutionOutcome persist(OperationRun run, PreparedOperation prepared) {
        ExecutionRecord record = toRecord(run, prepared);
        try {
            ExecutionRecord stored = recordStore.insert(record);
            run.advance(ExecutionState.PERSISTED);
            return ExecutionOutcome.executed(run.getTxHash(), stored);
        } catch (PersistenceFailureException e) {
            log.warn("Job {} submitted {} but the execution record was not stored: {}",
                    run.getJob().getId(), run.getTxHash(), e.getMessage());
            return ExecutionOutcome.executedWithoutRecord(run.getTxHash(), e);
        }
    }

    /**
     * Waits for the receipt when confirmation is enabled and records the result on the execution record. Failing to
     * store the status does not undo the submission: it is reported on the returned outcome.
     *
     * @throws ExecutionRejectedException when the transaction reverted
     * @throws com.dcarunner.failure.AmbiguousOutcomeException when no receipt arrives in time
     */
    public ExecutionOutcome confirm(OperationRun run, ExecutionOutcome outcome) {
        if (!abilityProperties.isConfirmReceipts()) {
            return outcome;
        }
        OperationKind kind = run.getJob().getKind();
        String txHash = run.getTxHash();
        ReceiptStatus status;
        try {
            status = receiptWatcher.awaitReceipt(kind, txHash,
                    Duration.ofMillis(abilityProperties.getReceiptTimeoutMs()));
        } catch (ExecutionRejectedException e) {
            try {
                recordStore.markReceiptStatus(kind, txHash, ReceiptStatus.REVERTED);
            } catch (PersistenceFailureException persistence) {
                e.addSuppressed(persistence);
            }
            throw e;
        }
        if (outcome.record() == null) {
            return outcome;
        }
        try {
            recordStore.markReceiptStatus(kind, txHash, status);
            return outcome;
        } catch (PersistenceFailureException e) {
            log.warn("Job {} confirmed {} as {} but the status was not stored: {}",
                    run.getJob().getId(), txHash, status, e.getMessage());
            return outcome.withPersistenceFailure(e);
        }
    }

    private static ExecutionRecord toRecord(OperationRun run, PreparedOperation prepared) {
        ScheduledOperation job = run.getJob();
        ExecutionRecord record = new ExecutionRecord();
        record.setTxHash(run.getTxHash());
        record.setScheduleId(job.getId());
        record.setKind(job.getKind());
        record.setOwnerAddress(job.getOwnerAddress());
        record.setAppVersion(run.getVersionToRun());
        record.getHumanAmounts().putAll(prepared.getHumanAmounts());
        record.getNormalizedAmounts().putAll(prepared.getNormalizedAmounts());
        record.getDetails().putAll(prepared.getDetails());
        record.setReferencePriceUsd(prepared.getReferencePriceUsd());
        record.setAnnualizedPremiumPct(prepared.getAnnualizedPremiumPct());
        record.setValidUntil(prepared.getValidUntil());
        record.setCreatedAt(Instant.now());
        return record;
    }
}
