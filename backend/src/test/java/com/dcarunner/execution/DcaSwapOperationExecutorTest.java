package com.dcarunner.execution;

import com.dcarunner.ability.AbilityInvoker;
import com.dcarunner.ability.AbilityNames;
import com.dcarunner.ability.config.AbilityProperties;
import com.dcarunner.authorization.AuthorizationDecision;
import com.dcarunner.authorization.AuthorizationGate;
import com.dcarunner.chain.Erc20Reader;
import com.dcarunner.chain.RpcException;
import com.dcarunner.chain.TransactionReceiptWatcher;
import com.dcarunner.chain.config.ChainProperties;
import com.dcarunner.domain.DcaSwapParams;
import com.dcarunner.domain.ExecutionRecord;
import com.dcarunner.domain.OperationKind;
import com.dcarunner.domain.ScheduledOperation;
import com.dcarunner.execution.config.ExecutionProperties;
import com.dcarunner.failure.MalformedConfigurationException;
import com.dcarunner.records.ExecutionRecordStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.math.BigInteger;

import static com.dcarunner.execution.ExecutionFixtures.OWNER;
import static com.dcarunner.execution.ExecutionFixtures.USDC;
import static com.dcarunner.execution.ExecutionFixtures.WETH;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class DcaSwapOperationExecutorTest {

    @Mock private AuthorizationGate authorizationGate;
    @Mock private AbilityInvoker abilityInvoker;
    @Mock private ExecutionRecordStore recordStore;
    @Mock private TransactionReceiptWatcher receiptWatcher;
    @Mock private Erc20Reader erc20Reader;

    private DcaSwapOperationExecutor executor;
    private ScheduledOperation job;

    @BeforeEach
    void setUp() {
        SubmissionPipeline pipeline = new SubmissionPipeline(authorizationGate, abilityInvoker, recordStore,
                receiptWatcher, new AbilityProperties());
        executor = new DcaSwapOperationExecutor(pipeline, erc20Reader, new ChainProperties(), new ExecutionProperties());

        job = ExecutionFixtures.job(OperationKind.DCA_SWAP);
        job.setDcaSwap(new DcaSwapParams(USDC, WETH, "25", 0));

        when(authorizationGate.reconcile(job)).thenReturn(new AuthorizationDecision(3, false));
        when(erc20Reader.decimals(USDC)).thenReturn(6);
        when(erc20Reader.balanceOf(USDC, OWNER)).thenReturn(BigInteger.valueOf(100_000_000));
        when(abilityInvoker.invoke(eq(OperationKind.DCA_SWAP), eq(AbilityNames.DCA_SWAP), anyMap(), any(), any()))
                .thenAnswer(ExecutionFixtures.acknowledged("0xswap"));
        when(recordStore.insert(any(ExecutionRecord.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    @DisplayName("zero slippage uses the configured default")
    void defaultSlippage() {
        ExecutionOutcome outcome = executor.execute(ExecutionFixtures.run(job));

        assertThat(outcome.txHash()).isEqualTo("0xswap");
        assertThat(outcome.record().getNormalizedAmounts()).containsEntry("amountIn", "25000000");
        assertThat(outcome.record().getDetails())
                .containsEntry("slippageBps", "50")
                .containsEntry("tokenOut", WETH);
    }

    @Test
    @DisplayName("slippage above the maximum is rejected")
    void slippageTooHigh() {
        job.getDcaSwap().setSlippageBps(5_000);

        assertThatThrownBy(() -> executor.execute(ExecutionFixtures.run(job)))
                .isInstanceOf(MalformedConfigurationException.class);
        verifyNoInteractions(abilityInvoker);
    }

    @Test
    @DisplayName("swapping a token into itself is rejected")
    void sameToken() {
        job.getDcaSwap().setTokenOut(USDC.toUpperCase().replace("0X", "0x"));

        assertThatThrownBy(() -> executor.execute(ExecutionFixtures.run(job)))
                .isInstanceOf(MalformedConfigurationException.class)
                .hasMessageContaining("same token");
    }

    @Test
    @DisplayName("balance read failure propagates without submitting")
    void balanceReadFailure() {
        doThrow(new RpcException("eth_call failed after 3 attempts")).when(erc20Reader).balanceOf(USDC, OWNER);

        assertThatThrownBy(() -> executor.execute(ExecutionFixtures.run(job))).isInstanceOf(RpcException.class);
        verifyNoInteractions(abilityInvoker);
    }
}
