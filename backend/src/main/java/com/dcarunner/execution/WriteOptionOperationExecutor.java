package com.dcarunner.execution;

import com.dcarunner.ability.AbilityContext;
import com.dcarunner.ability.AbilityNames;
import com.dcarunner.chain.Erc20Reader;
import com.dcarunner.chain.VaultTokenInfoReader;
import com.dcarunner.chain.config.ChainProperties;
import com.dcarunner.common.EvmAddress;
import com.dcarunner.domain.OperationKind;
import com.dcarunner.domain.ScheduledOperation;
import com.dcarunner.domain.VaultTokenInfo;
import com.dcarunner.domain.WriteOptionParams;
import com.dcarunner.execution.config.ExecutionProperties;
import com.dcarunner.failure.AuxiliaryLookupException;
import com.dcarunner.failure.InsufficientBalanceException;
import com.dcarunner.failure.MalformedConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Map;

/**
 * Writes a covered call into an option vault against a signed quote. Amounts are normalized with the vault's own
 * token decimals (deposit, conversion, premium). When the vault cannot be read, the fallback policy decides between
 * 18 decimals everywhere and failing the fire.
 */
@Component
@Slf4j
public class WriteOptionOperationExecutor extends AbstractOperationExecutor {

    private final VaultTokenInfoReader vaultTokenInfoReader;
    private final Erc20Reader erc20Reader;
    private final ChainProperties chainProperties;
    private final ExecutionProperties executionProperties;

    public WriteOptionOperationExecutor(SubmissionPipeline pipeline, VaultTokenInfoReader vaultTokenInfoReader,
                                        Erc20Reader erc20Reader, ChainProperties chainProperties,
                                        ExecutionProperties executionProperties) {
        super(pipeline);
        this.vaultTokenInfoReader = vaultTokenInfoReader;
        this.erc20Reader = erc20Reader;
        this.chainProperties = chainProperties;
        this.executionProperties = executionProperties;
    }

    @Override
    protected OperationKind kind() {
        return OperationKind.WRITE_OPTION;
    }

    @Override
    protected PreparedOperation prepare(OperationRun run) {
        ScheduledOperation job = run.getJob();
        WriteOptionParams params = requireParams(job.getWriteOption());
        String vault = requireAddress("vault", params.getVault());
        if (params.getSignature() == null || params.getSignature().isBlank()) {
            throw new MalformedConfigurationException(kind(), "write-option quote has no signature",
                    Map.of("quoteId", String.valueOf(params.getQuoteId())));
        }
        VaultTokenInfo info = readVaultInfo(job, vault);

        PreparedOperation prepared = PreparedOperation.forAbility(AbilityNames.WRITE_OPTION);
        BigInteger amount = normalizeInto(prepared, "amount", params.getAmount(), info.depositTokenDecimals());
        BigInteger strike = normalizeInto(prepared, "strike", params.getStrike(), info.conversionTokenDecimals());
        BigInteger premiumPerUnit = normalizeInto(prepared, "premiumPerUnit", params.getPremiumPerUnit(),
                info.premiumTokenDecimals());
        BigInteger minDeposit = normalizeInto(prepared, "minDeposit", params.getMinDeposit(), info.depositTokenDecimals());
        BigInteger maxDeposit = normalizeInto(prepared, "maxDeposit", params.getMaxDeposit(), info.depositTokenDecimals());

        if (!info.fallback()) {
            BigInteger balance = erc20Reader.balanceOf(info.depositToken(), job.getOwnerAddress());
            if (balance.compareTo(amount) < 0) {
                throw new InsufficientBalanceException(kind(), info.depositToken(), job.getOwnerAddress(), amount,
                        balance);
            }
        }

        prepared.setValidUntil(params.getValidUntil() > 0 ? Instant.ofEpochSecond(params.getValidUntil()) : null);
        return prepared
                .param("operation", "writeOption")
                .param("chainId", chainProperties.getChainId())
                .param("vault", vault)
                .param("amount", amount.toString())
                .param("strike", strike.toString())
                .param("expiry", String.valueOf(params.getExpiry()))
                .param("premiumPerUnit", premiumPerUnit.toString())
                .param("minDeposit", minDeposit.toString())
                .param("maxDeposit", maxDeposit.toString())
                .param("validUntil", String.valueOf(params.getValidUntil()))
                .param("quoteId", params.getQuoteId())
                .param("signature", params.getSignature())
                .detail("vault", vault)
                .detail("depositToken", info.depositToken())
                .detail("conversionToken", info.conversionToken())
                .detail("premiumToken", info.premiumToken())
                .detail("depositTokenDecimals", info.depositTokenDecimals())
                .detail("conversionTokenDecimals", info.conversionTokenDecimals())
                .detail("premiumTokenDecimals", info.premiumTokenDecimals())
                .detail("vaultInfoFallback", info.fallback())
                .detail("expiry", params.getExpiry())
                .detail("quoteId", params.getQuoteId());
    }

    /**
     * Approves the vault factory to pull the deposit. Skipped when the deposit token is unknown (fallback info).
     */
    @Override
    protected void beforeSubmission(OperationRun run, PreparedOperation prepared, AbilityContext context) {
        String depositToken = prepared.getDetails().get("depositToken");
        if (EvmAddress.isZero(depositToken)) {
            log.warn("Job {}: deposit token unknown, skipping approval", run.getJob().getId());
            return;
        }
        String spender = executionProperties.getWriteOption().getVaultFactoryAddress();
        PreparedOperation approval = PreparedOperation.forAbility(AbilityNames.ERC20_APPROVAL)
                .param("chainId", chainProperties.getChainId())
                .param("tokenAddress", depositToken)
                .param("spenderAddress", spender)
                .param("tokenAmount", prepared.getNormalizedAmounts().get("amount"));
        String approvalTxHash = pipeline.submitAuxiliary(kind(), AbilityNames.ERC20_APPROVAL, approval, context);
        log.info("Job {}: approved {} of {} to {} in {}", run.getJob().getId(),
                prepared.getNormalizedAmounts().get("amount"), depositToken, spender, approvalTxHash);
        prepared.detail("approvalTxHash", approvalTxHash);
        prepared.detail("approvalSpender", spender);
    }

    private VaultTokenInfo readVaultInfo(ScheduledOperation job, String vault) {
        try {
            return vaultTokenInfoReader.read(vault);
        } catch (AuxiliaryLookupException e) {
            switch (executionProperties.getWriteOption().getVaultInfoFallback()) {
                case FAIL:
                    throw e;
                case DEGRADE:
                default:
                    log.warn("Job {}: vault {} token info unavailable, falling back to {} decimals: {}",
                            job.getId(), vault, VaultTokenInfo.FALLBACK_DECIMALS, e.getMessage());
                    return VaultTokenInfo.fallbackInfo();
            }
        }
    }
}
