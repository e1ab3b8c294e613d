package com.dcarunner.chain.config;

import com.dcarunner.chain.EvmRpcClient;
import com.dcarunner.chain.RpcEndpointRotator;
import com.dcarunner.chain.WebClientEvmRpcClient;
import com.dcarunner.common.RetryPolicy;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * RPC transport, endpoint rotation and the outbound rate limiter for auxiliary chain reads.
 */
@Configuration
@EnableConfigurationProperties(ChainProperties.class)
public class ChainConfig {

    @Bean
    public RpcEndpointRotator evmRpcEndpointRotator(ChainProperties properties) {
        RetryPolicy retryPolicy = new RetryPolicy(
                properties.getRetryBaseDelayMs(),
                properties.getRetryJitterFactor(),
                properties.getRetryMaxAttempts());
        return new RpcEndpointRotator(properties.getRpcUrls(), retryPolicy);
    }

    @Bean
    public EvmRpcClient evmRpcClient(WebClient.Builder webClientBuilder) {
        return new WebClientEvmRpcClient(webClientBuilder);
    }

    @Bean(name = "evmRpcRateLimiter")
    public RateLimiter evmRpcRateLimiter(ChainProperties properties) {
        int rps = Math.max(1, properties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLocalLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("evm-rpc", config);
    }
}
