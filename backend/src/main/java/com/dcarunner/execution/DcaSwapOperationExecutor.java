package com.dcarunner.execution;

import com.dcarunner.ability.AbilityNames;
import com.dcarunner.chain.Erc20Reader;
import com.dcarunner.chain.config.ChainProperties;
import com.dcarunner.domain.DcaSwapParams;
import com.dcarunner.domain.OperationKind;
import com.dcarunner.domain.ScheduledOperation;
import com.dcarunner.execution.config.ExecutionProperties;
import com.dcarunner.failure.InsufficientBalanceException;
import com.dcarunner.failure.MalformedConfigurationException;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Map;

/**
 * Recurring swap of a fixed amount of tokenIn into tokenOut.
 */
@Component
public class DcaSwapOperationExecutor extends AbstractOperationExecutor {

    private final Erc20Reader erc20Reader;
    private final ChainProperties chainProperties;
    private final ExecutionProperties executionProperties;

    public DcaSwapOperationExecutor(SubmissionPipeline pipeline, Erc20Reader erc20Reader,
                                    ChainProperties chainProperties, ExecutionProperties executionProperties) {
        super(pipeline);
        this.erc20Reader = erc20Reader;
        this.chainProperties = chainProperties;
        this.executionProperties = executionProperties;
    }

    @Override
    protected OperationKind kind() {
        return OperationKind.DCA_SWAP;
    }

    @Override
    protected PreparedOperation prepare(OperationRun run) {
        ScheduledOperation job = run.getJob();
        DcaSwapParams params = requireParams(job.getDcaSwap());
        String tokenIn = requireAddress("tokenIn", params.getTokenIn());
        String tokenOut = requireAddress("tokenOut", params.getTokenOut());
        if (tokenIn.equals(tokenOut)) {
            throw new MalformedConfigurationException(kind(), "tokenIn and tokenOut are the same token",
                    Map.of("token", tokenIn));
        }
        int slippageBps = slippageBps(params.getSlippageBps());

        int decimals = erc20Reader.decimals(tokenIn);
        PreparedOperation prepared = PreparedOperation.forAbility(AbilityNames.DCA_SWAP);
        BigInteger amountIn = normalizeInto(prepared, "amountIn", params.getAmountIn(), decimals);

        BigInteger balance = erc20Reader.balanceOf(tokenIn, job.getOwnerAddress());
        if (balance.compareTo(amountIn) < 0) {
            throw new InsufficientBalanceException(kind(), tokenIn, job.getOwnerAddress(), amountIn, balance);
        }

        return prepared
                .param("chainId", chainProperties.getChainId())
                .param("tokenIn", tokenIn)
                .param("tokenOut", tokenOut)
                .param("amountIn", amountIn.toString())
                .param("slippageBps", slippageBps)
                .detail("tokenIn", tokenIn)
                .detail("tokenOut", tokenOut)
                .detail("tokenInDecimals", decimals)
                .detail("slippageBps", slippageBps);
    }

    private int slippageBps(int requested) {
        if (requested == 0) {
            return executionProperties.getDcaSwap().getDefaultSlippageBps();
        }
        int max = executionProperties.getDcaSwap().getMaxSlippageBps();
        if (requested < 0 || requested > max) {
            throw new MalformedConfigurationException(kind(), "slippage " + requested + "bps outside [1, " + max + "]",
                    Map.of("slippageBps", requested));
        }
        return requested;
    }
}
