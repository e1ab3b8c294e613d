package com.dcarunner.chain;

import com.dcarunner.chain.config.ChainProperties;
import com.dcarunner.common.EvmAddress;
import com.dcarunner.config.CaffeineConfig;
import com.dcarunner.failure.AuxiliaryLookupException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Map;

/**
 * ERC-20 reads via eth_call. decimals() is cached per (chainId, token) in tokenMetaCache (TTL 24h);
 * balanceOf() is always read live.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class Erc20Reader {

    /** ERC20 decimals() selector: keccak256("decimals()") first 4 bytes. */
    static final String DECIMALS_SELECTOR = "0x313ce567";
    /** ERC20 balanceOf(address) selector. */
    static final String BALANCE_OF_SELECTOR = "0x70a08231";

    private static final Map<String, Integer> KNOWN_DECIMALS = Map.of(
            "8453:0x833589fcd6edb6e08f4c7c32d4f71b54bda02913", 6,
            "8453:0x4200000000000000000000000000000000000006", 18,
            "8453:0xfde4c96c8593536e31f229ea8f37b2ada2699bb2", 6,
            "1:0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48", 6,
            "1:0xdac17f958d2ee523a2206206994597c13d831ec7", 6,
            "1:0xc02aaa39b223fe8d0a0e5c4f27ead9083c756cc2", 18,
            "11155111:0x1c7d4b196cb0c7b01d743fbc6116a902379c7238", 6
    );

    private final EvmRpcCaller rpcCaller;
    private final ChainProperties chainProperties;
    private final CacheManager cacheManager;

    /**
     * @throws AuxiliaryLookupException when decimals() cannot be read or is not a uint8
     */
    public int decimals(String token) {
        String key = cacheKey(token);
        Integer known = KNOWN_DECIMALS.get(key);
        if (known != null) {
            return known;
        }
        Cache cache = cacheManager.getCache(CaffeineConfig.TOKEN_META_CACHE);
        if (cache == null) {
            return fetchDecimals(token);
        }
        try {
            Integer decimals = cache.get(key, () -> fetchDecimals(token));
            return decimals != null ? decimals : fetchDecimals(token);
        } catch (Cache.ValueRetrievalException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new AuxiliaryLookupException("token-decimals", token + ": " + e.getMessage(), e);
        }
    }

    /**
     * Raw (base-unit) balance of owner. RPC failures surface as {@link RpcException}.
     */
    public BigInteger balanceOf(String token, String owner) {
        String data = BALANCE_OF_SELECTOR + EvmAddress.toAbiWord(owner);
        String hex = rpcCaller.ethCall(EvmAddress.normalize(token), data);
        try {
            return parseUint(hex);
        } catch (NumberFormatException e) {
            throw new RpcException("balanceOf returned non-numeric result " + hex, e);
        }
    }

    private int fetchDecimals(String token) {
        String result;
        try {
            result = rpcCaller.ethCall(EvmAddress.normalize(token), DECIMALS_SELECTOR);
        } catch (RpcException e) {
            throw new AuxiliaryLookupException("token-decimals", token + ": " + e.getMessage(), e);
        }
        BigInteger value;
        try {
            value = parseUint(result);
        } catch (NumberFormatException e) {
            throw new AuxiliaryLookupException("token-decimals", token + " returned " + result, e);
        }
        if (result == null || result.length() <= 2 || value.compareTo(BigInteger.valueOf(255)) > 0) {
            throw new AuxiliaryLookupException("token-decimals", token + " returned " + result, null);
        }
        log.debug("decimals({}) = {}", token, value);
        return value.intValueExact();
    }

    private String cacheKey(String token) {
        return chainProperties.getChainId() + ":" + EvmAddress.normalize(token);
    }

    static BigInteger parseUint(String hex) {
        if (hex == null || !hex.startsWith("0x")) {
            throw new NumberFormatException("not a hex quantity: " + hex);
        }
        String raw = hex.substring(2);
        return raw.isEmpty() ? BigInteger.ZERO : new BigInteger(raw, 16);
    }
}
