package com.dcarunner.chain;

import com.dcarunner.chain.config.ChainProperties;
import com.dcarunner.common.Blocking;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Read-only JSON-RPC with endpoint rotation, bounded retries, the outbound limiter and a per-attempt timeout.
 * Returns the {@code result} field; any failure after the last attempt is an {@link RpcException}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EvmRpcCaller {

    private final EvmRpcClient rpcClient;
    private final RpcEndpointRotator rotator;
    @Qualifier("evmRpcRateLimiter")
    private final RateLimiter evmRpcRateLimiter;
    private final ObjectMapper objectMapper;
    private final ChainProperties properties;

    /** eth_call against the latest block. */
    public String ethCall(String to, String data) {
        return callWithRetry("eth_call", List.of(Map.of("to", to, "data", data), "latest"));
    }

    /**
     * @return result node, or a missing/null node when the RPC returned {@code "result": null}
     */
    public JsonNode callForNode(String method, Object params) {
        return callRawWithRetry(method, params, true);
    }

    public String callWithRetry(String method, Object params) {
        JsonNode result = callRawWithRetry(method, params, false);
        return result.asText();
    }

    private JsonNode callRawWithRetry(String method, Object params, boolean allowNullResult) {
        Exception lastException = null;
        for (int attempt = 0; attempt < rotator.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                sleepQuietly(rotator.retryDelayMs(attempt - 1));
            }
            String endpoint = rotator.getNextEndpoint();
            try {
                String json = callOnce(endpoint, method, params);
                return extractResult(json, allowNullResult);
            } catch (Exception e) {
                log.debug("{} on {} failed (attempt {}): {}", method, endpoint, attempt + 1, e.getMessage());
                lastException = e;
            }
        }
        throw new RpcException(method + " failed after " + rotator.getMaxAttempts() + " attempts: "
                + messageOf(lastException), lastException);
    }

    private String callOnce(String endpoint, String method, Object params) {
        if (!evmRpcRateLimiter.acquirePermission()) {
            throw new RpcException("Local limiter timeout before " + method + " on " + endpoint);
        }
        return Blocking.await(rpcClient.call(endpoint, method, params),
                Duration.ofMillis(properties.getCallTimeoutMs()), method);
    }

    private JsonNode extractResult(String json, boolean allowNullResult) throws Exception {
        if (json == null || json.isBlank()) {
            throw new RpcException("Empty RPC response");
        }
        JsonNode root = objectMapper.readTree(json);
        if (root.has("error")) {
            throw new RpcException("RPC error: " + root.get("error"));
        }
        JsonNode result = root.path("result");
        if (!allowNullResult && (result.isMissingNode() || result.isNull())) {
            throw new RpcException("RPC result is null");
        }
        return result;
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(Math.max(0L, millis));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcException("Interrupted during RPC retry", e);
        }
    }

    private static String messageOf(Exception e) {
        if (e == null) {
            return "unknown";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
