package com.dcarunner.chain.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Chain the operations run on, and read-only RPC settings. Documented in application.yml under dcarunner.chain.
 */
@ConfigurationProperties(prefix = "dcarunner.chain")
@NoArgsConstructor
@Getter
@Setter
public class ChainProperties {

    /** EIP-155 chain id (Base mainnet 8453, Base Sepolia 84532, Sepolia 11155111). */
    private long chainId = 8453;

    /** JSON-RPC endpoints, used round-robin. */
    private List<String> rpcUrls = new ArrayList<>(List.of("https://mainnet.base.org"));

    /** Upper bound for a single RPC round trip. */
    private long callTimeoutMs = 10_000;

    /** Base delay before the first retry; doubles per attempt. */
    private long retryBaseDelayMs = 500;

    /** ±fraction of jitter applied to each retry delay. */
    private double retryJitterFactor = 0.2;

    /** Attempts per read-only call, first attempt included. */
    private int retryMaxAttempts = 3;

    /** Outbound RPC budget (requests per second) for this instance. */
    private int maxRequestsPerSecond = 50;

    /** How long a call may wait for a limiter permit before failing. */
    private long localLimiterTimeoutMs = 2_000;

    /** Interval between eth_getTransactionReceipt polls. */
    private long receiptPollIntervalMs = 2_000;
}
