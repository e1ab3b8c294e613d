package com.dcarunner.chain;

import reactor.core.publisher.Mono;

/**
 * EVM JSON-RPC transport. Retries and endpoint rotation are handled by {@link EvmRpcCaller}.
 */
public interface EvmRpcClient {

    /**
     * Perform a single JSON-RPC call. Method and params are standard Ethereum JSON-RPC.
     *
     * @param endpointUrl RPC endpoint URL
     * @param method      e.g. "eth_call"
     * @param params      method params
     * @return response body as string (JSON); errors with {@link RpcException} on HTTP failure
     */
    Mono<String> call(String endpointUrl, String method, Object params);
}
