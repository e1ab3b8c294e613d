package com.dcarunner.scheduling;

import com.dcarunner.authorization.config.AuthorizationProperties;
import com.dcarunner.common.AmountNormalizer;
import com.dcarunner.common.EvmAddress;
import com.dcarunner.domain.AppReference;
import com.dcarunner.domain.DcaSwapParams;
import com.dcarunner.domain.ExecutionRecord;
import com.dcarunner.domain.OperationKind;
import com.dcarunner.domain.OptionsTradeParams;
import com.dcarunner.domain.ScheduledOperation;
import com.dcarunner.domain.ScheduledOperationRepository;
import com.dcarunner.domain.SettlementParams;
import com.dcarunner.domain.TransferParams;
import com.dcarunner.domain.WriteOptionParams;
import com.dcarunner.failure.InvalidAmountException;
import com.dcarunner.records.ExecutionRecordStore;
import com.dcarunner.scheduling.config.SchedulerProperties;
import com.dcarunner.store.JobStore;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Owner-facing job management: create, list, pause, resume, cancel, and read execution history.
 * Every call is scoped to the owner address; another owner's job is reported as not found.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OperationScheduleService {

    private static final BigDecimal MAX_PERCENT = BigDecimal.valueOf(1000);
    private static final int MAX_SLIPPAGE_BPS = 10_000;

    private final JobStore jobStore;
    private final ScheduledOperationRepository repository;
    private final ExecutionRecordStore recordStore;
    private final SchedulerProperties schedulerProperties;
    private final AuthorizationProperties authorizationProperties;
    private final Validator validator;

    /**
     * Validates and stores a new enabled job whose first fire is due immediately.
     *
     * @throws OperationScheduleException INVALID_ADDRESS, INVALID_AMOUNT, INVALID_FREQUENCY or INVALID_REQUEST
     */
    public ScheduledOperation create(CreateOperationRequest request) {
        if (request == null) {
            throw new OperationScheduleException(OperationScheduleException.INVALID_REQUEST, "Request is required");
        }
        checkConstraints(request);
        String owner = address("ownerAddress", request.getOwnerAddress());
        Duration interval = interval(request.getFrequency());
        String appId = request.getAppId() != null && !request.getAppId().isBlank()
                ? request.getAppId() : authorizationProperties.getAppId();
        if (appId == null || appId.isBlank()) {
            throw new OperationScheduleException(OperationScheduleException.INVALID_REQUEST, "appId is required");
        }
        requireSingleParamBlock(request);

        Instant now = Instant.now();
        ScheduledOperation job = new ScheduledOperation();
        job.setKind(request.getKind());
        job.setName(request.getName() != null && !request.getName().isBlank()
                ? request.getName().trim() : defaultName(request.getKind()));
        job.setOwnerAddress(owner);
        job.setApp(new AppReference(appId, request.getAppVersion()));
        switch (request.getKind()) {
            case TRANSFER -> job.setTransfer(validated(request.getTransfer()));
            case DCA_SWAP -> job.setDcaSwap(validated(request.getDcaSwap()));
            case WRITE_OPTION -> job.setWriteOption(validated(request.getWriteOption()));
            case SETTLEMENT -> job.setSettlement(validated(request.getSettlement()));
            case OPTIONS_TRADE -> job.setOptionsTrade(validated(request.getOptionsTrade(), now));
        }
        job.setEnabled(true);
        job.setIntervalSeconds(interval.getSeconds());
        job.setNextRunAt(now);
        job.setCreatedAt(now);
        ScheduledOperation saved = jobStore.save(job);
        log.info("Created {} job {} for {} every {}s", saved.getKind(), saved.getId(), owner,
                saved.getIntervalSeconds());
        return saved;
    }

    /** Newest first. */
    public List<ScheduledOperation> listByOwner(String ownerAddress) {
        return repository.findByOwnerAddressOrderByCreatedAtDesc(address("ownerAddress", ownerAddress));
    }

    public ScheduledOperation get(String ownerAddress, String jobId) {
        return owned(ownerAddress, jobId);
    }

    public void disable(String ownerAddress, String jobId) {
        owned(ownerAddress, jobId);
        jobStore.disable(jobId, "Paused by owner");
        log.info("Job {} paused by owner", jobId);
    }

    /** Resumes a paused or failure-disabled job; the next fire is due immediately. */
    public void enable(String ownerAddress, String jobId) {
        owned(ownerAddress, jobId);
        jobStore.enable(jobId, Instant.now());
        log.info("Job {} resumed by owner", jobId);
    }

    public void cancel(String ownerAddress, String jobId) {
        owned(ownerAddress, jobId);
        jobStore.remove(jobId);
        log.info("Job {} cancelled by owner", jobId);
    }

    /** Execution history of one job, newest first. */
    public List<ExecutionRecord> listExecutions(String ownerAddress, String jobId) {
        owned(ownerAddress, jobId);
        return recordStore.findBySchedule(jobId);
    }

    private ScheduledOperation owned(String ownerAddress, String jobId) {
        String owner = address("ownerAddress", ownerAddress);
        if (jobId == null || jobId.isBlank()) {
            throw new OperationScheduleException(OperationScheduleException.JOB_NOT_FOUND, "Job id is required");
        }
        return repository.findByIdAndOwnerAddress(jobId, owner)
                .orElseThrow(() -> new OperationScheduleException(OperationScheduleException.JOB_NOT_FOUND,
                        "Job not found: " + jobId));
    }

    private void checkConstraints(CreateOperationRequest request) {
        Set<ConstraintViolation<CreateOperationRequest>> violations = validator.validate(request);
        violations.stream()
                .min(Comparator.comparing(v -> v.getPropertyPath().toString()))
                .ifPresent(v -> {
                    throw new OperationScheduleException(v.getMessage(),
                            v.getPropertyPath() + " is invalid: " + v.getInvalidValue());
                });
    }

    private Duration interval(String frequency) {
        Duration interval;
        try {
            interval = ScheduleIntervals.parse(frequency);
        } catch (IllegalArgumentException e) {
            throw new OperationScheduleException(OperationScheduleException.INVALID_FREQUENCY, e.getMessage());
        }
        if (interval.getSeconds() < schedulerProperties.getMinIntervalSeconds()) {
            throw new OperationScheduleException(OperationScheduleException.INVALID_FREQUENCY,
                    "Frequency below minimum of " + schedulerProperties.getMinIntervalSeconds() + "s: " + frequency);
        }
        return interval;
    }

    private static void requireSingleParamBlock(CreateOperationRequest request) {
        long present = Stream.of(request.getTransfer(), request.getDcaSwap(), request.getWriteOption(),
                request.getSettlement(), request.getOptionsTrade()).filter(Objects::nonNull).count();
        if (present != 1) {
            throw new OperationScheduleException(OperationScheduleException.INVALID_REQUEST,
                    "Exactly one parameter block is required, got " + present);
        }
    }

    private static TransferParams validated(TransferParams p) {
        requireBlock(p, OperationKind.TRANSFER);
        String token = p.getTokenAddress() == null || p.getTokenAddress().isBlank()
                ? null : address("tokenAddress", p.getTokenAddress());
        return new TransferParams(token, address("recipientAddress", p.getRecipientAddress()),
                positive("amount", p.getAmount()));
    }

    private static DcaSwapParams validated(DcaSwapParams p) {
        requireBlock(p, OperationKind.DCA_SWAP);
        String tokenIn = address("tokenIn", p.getTokenIn());
        String tokenOut = address("tokenOut", p.getTokenOut());
        if (tokenIn.equals(tokenOut)) {
            throw new OperationScheduleException(OperationScheduleException.INVALID_REQUEST,
                    "tokenIn and tokenOut must differ");
        }
        if (p.getSlippageBps() < 0 || p.getSlippageBps() > MAX_SLIPPAGE_BPS) {
            throw new OperationScheduleException(OperationScheduleException.INVALID_REQUEST,
                    "slippageBps out of range: " + p.getSlippageBps());
        }
        return new DcaSwapParams(tokenIn, tokenOut, positive("amountIn", p.getAmountIn()), p.getSlippageBps());
    }

    private static WriteOptionParams validated(WriteOptionParams p) {
        requireBlock(p, OperationKind.WRITE_OPTION);
        p.setVault(address("vault", p.getVault()));
        p.setAmount(positive("amount", p.getAmount()));
        p.setStrike(positive("strike", p.getStrike()));
        p.setPremiumPerUnit(nonNegative("premiumPerUnit", p.getPremiumPerUnit()));
        p.setMinDeposit(nonNegative("minDeposit", p.getMinDeposit()));
        p.setMaxDeposit(nonNegative("maxDeposit", p.getMaxDeposit()));
        if (p.getExpiry() <= 0) {
            throw new OperationScheduleException(OperationScheduleException.INVALID_REQUEST, "expiry is required");
        }
        if (p.getSignature() == null || p.getSignature().isBlank()) {
            throw new OperationScheduleException(OperationScheduleException.INVALID_REQUEST,
                    "signature is required");
        }
        return p;
    }

    private static SettlementParams validated(SettlementParams p) {
        requireBlock(p, OperationKind.SETTLEMENT);
        String from = address("fromAddress", p.getFromAddress());
        String to = address("toAddress", p.getToAddress());
        if (from.equals(to)) {
            throw new OperationScheduleException(OperationScheduleException.INVALID_REQUEST,
                    "fromAddress and toAddress must differ");
        }
        String weth = p.getWethAmount() == null || p.getWethAmount().isBlank()
                ? null : positive("wethAmount", p.getWethAmount());
        return new SettlementParams(from, to, weth);
    }

    private static OptionsTradeParams validated(OptionsTradeParams p, Instant now) {
        requireBlock(p, OperationKind.OPTIONS_TRADE);
        p.setVaultAddress(address("vaultAddress", p.getVaultAddress()));
        p.setDepositToken(address("depositToken", p.getDepositToken()));
        p.setDepositAmount(positive("depositAmount", p.getDepositAmount()));
        if (p.getExpiry() == null || !p.getExpiry().isAfter(now)) {
            throw new OperationScheduleException(OperationScheduleException.INVALID_REQUEST,
                    "expiry must be in the future");
        }
        p.setMinimumApy(percent("minimumApy", p.getMinimumApy()));
        p.setStrikeThreshold(percent("strikeThreshold", p.getStrikeThreshold()));
        return p;
    }

    private static void requireBlock(Object params, OperationKind kind) {
        if (params == null) {
            throw new OperationScheduleException(OperationScheduleException.INVALID_REQUEST,
                    "Parameters for " + kind + " are required");
        }
    }

    private static String address(String field, String value) {
        if (!EvmAddress.isValid(value)) {
            throw new OperationScheduleException(OperationScheduleException.INVALID_ADDRESS,
                    field + " is not a valid address: " + value);
        }
        return EvmAddress.normalize(value);
    }

    private static String positive(String field, String value) {
        BigDecimal parsed = amount(field, value);
        if (parsed.signum() == 0) {
            throw new OperationScheduleException(OperationScheduleException.INVALID_AMOUNT,
                    field + " must be greater than zero");
        }
        return value.trim();
    }

    private static String nonNegative(String field, String value) {
        amount(field, value);
        return value.trim();
    }

    private static BigDecimal amount(String field, String value) {
        try {
            return AmountNormalizer.parse(value);
        } catch (InvalidAmountException e) {
            throw new OperationScheduleException(OperationScheduleException.INVALID_AMOUNT,
                    field + ": " + e.getMessage());
        }
    }

    private static BigDecimal percent(String field, BigDecimal value) {
        if (value == null) {
            return BigDecimal.ZERO;
        }
        if (value.signum() < 0 || value.compareTo(MAX_PERCENT) > 0) {
            throw new OperationScheduleException(OperationScheduleException.INVALID_REQUEST,
                    field + " must be within [0, 1000]: " + value.toPlainString());
        }
        return value;
    }

    private static String defaultName(OperationKind kind) {
        return switch (kind) {
            case TRANSFER -> "Recurring transfer";
            case DCA_SWAP -> "DCA swap";
            case WRITE_OPTION -> "Covered call";
            case SETTLEMENT -> "WETH/USDC settlement";
            case OPTIONS_TRADE -> "Options trade";
        };
    }
}
