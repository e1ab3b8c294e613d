package com.dcarunner.execution;

import com.dcarunner.ability.AbilityNames;
import com.dcarunner.chain.Erc20Reader;
import com.dcarunner.chain.config.ChainProperties;
import com.dcarunner.domain.OperationKind;
import com.dcarunner.domain.ScheduledOperation;
import com.dcarunner.domain.TransferParams;
import com.dcarunner.execution.config.ExecutionProperties;
import com.dcarunner.failure.InsufficientBalanceException;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Recurring ERC-20 transfer. The owner's balance is checked before anything is sent.
 */
@Component
public class TransferOperationExecutor extends AbstractOperationExecutor {

    private final Erc20Reader erc20Reader;
    private final ChainProperties chainProperties;
    private final ExecutionProperties executionProperties;

    public TransferOperationExecutor(SubmissionPipeline pipeline, Erc20Reader erc20Reader,
                                     ChainProperties chainProperties, ExecutionProperties executionProperties) {
        super(pipeline);
        this.erc20Reader = erc20Reader;
        this.chainProperties = chainProperties;
        this.executionProperties = executionProperties;
    }

    @Override
    protected OperationKind kind() {
        return OperationKind.TRANSFER;
    }

    @Override
    protected PreparedOperation prepare(OperationRun run) {
        ScheduledOperation job = run.getJob();
        TransferParams params = requireParams(job.getTransfer());
        String configuredToken = params.getTokenAddress() != null && !params.getTokenAddress().isBlank()
                ? params.getTokenAddress()
                : executionProperties.getTransfer().getDefaultTokenAddress();
        String token = requireAddress("token", configuredToken);
        String recipient = requireAddress("recipient", params.getRecipientAddress());

        int decimals = erc20Reader.decimals(token);
        PreparedOperation prepared = PreparedOperation.forAbility(AbilityNames.ERC20_TRANSFER);
        BigInteger amount = normalizeInto(prepared, "amount", params.getAmount(), decimals);

        BigInteger balance = erc20Reader.balanceOf(token, job.getOwnerAddress());
        if (balance.compareTo(amount) < 0) {
            throw new InsufficientBalanceException(kind(), token, job.getOwnerAddress(), amount, balance);
        }

        return prepared
                .param("chainId", chainProperties.getChainId())
                .param("tokenAddress", token)
                .param("to", recipient)
                .param("amount", amount.toString())
                .detail("tokenAddress", token)
                .detail("recipientAddress", recipient)
                .detail("decimals", decimals);
    }
}
