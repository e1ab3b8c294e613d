package com.dcarunner.chain;

import com.dcarunner.chain.config.ChainProperties;
import com.dcarunner.domain.OperationKind;
import com.dcarunner.domain.ReceiptStatus;
import com.dcarunner.failure.AmbiguousOutcomeException;
import com.dcarunner.failure.ExecutionRejectedException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Waits for a submitted transaction to be mined. Polls eth_getTransactionReceipt until the receipt shows up
 * or the timeout elapses. Poll errors are tolerated until the deadline.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TransactionReceiptWatcher {

    private final EvmRpcCaller rpcCaller;
    private final ChainProperties chainProperties;

    /**
     * @return {@link ReceiptStatus#CONFIRMED} once mined with status 0x1
     * @throws ExecutionRejectedException when mined with status 0x0
     * @throws AmbiguousOutcomeException  when no receipt is seen within the timeout
     */
    public ReceiptStatus awaitReceipt(OperationKind kind, String txHash, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            try {
                JsonNode receipt = rpcCaller.callForNode("eth_getTransactionReceipt", List.of(txHash));
                if (receipt != null && receipt.isObject()) {
                    String status = receipt.path("status").asText("");
                    if ("0x0".equals(status)) {
                        throw new ExecutionRejectedException(kind, "receipt", "transaction " + txHash + " reverted",
                                Map.of("txHash", txHash, "blockNumber", receipt.path("blockNumber").asText("")), null);
                    }
                    log.debug("Receipt for {} in block {}", txHash, receipt.path("blockNumber").asText());
                    return ReceiptStatus.CONFIRMED;
                }
            } catch (RpcException e) {
                log.debug("Receipt poll for {} failed: {}", txHash, e.getMessage());
            }
            if (System.nanoTime() >= deadline) {
                throw new AmbiguousOutcomeException(kind,
                        "no receipt for " + txHash + " within " + timeout.toMillis() + "ms",
                        Map.of("txHash", txHash), null);
            }
            try {
                Thread.sleep(Math.max(1L, chainProperties.getReceiptPollIntervalMs()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AmbiguousOutcomeException(kind, "interrupted while waiting for receipt of " + txHash,
                        Map.of("txHash", txHash), e);
            }
        }
    }
}
