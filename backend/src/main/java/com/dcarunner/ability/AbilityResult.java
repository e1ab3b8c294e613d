package com.dcarunner.ability;

import java.util.List;
import java.util.Map;

/**
 * Response of a precheck or execute call: {@code {success, error?, result?}}.
 */
public record AbilityResult(boolean success, String error, Map<String, Object> result) {

    private static final List<String> TX_HASH_KEYS = List.of("txHash", "transactionHash", "transferTxHash", "swapTxHash");

    public AbilityResult {
        result = result == null ? Map.of() : result;
    }

    public static AbilityResult ok(Map<String, Object> result) {
        return new AbilityResult(true, null, result);
    }

    public static AbilityResult failed(String error) {
        return new AbilityResult(false, error, Map.of());
    }

    /**
     * Transaction hash reported by an execute call, under whichever key the ability uses; null when absent.
     */
    public String transactionHash() {
        for (String key : TX_HASH_KEYS) {
            Object value = result.get(key);
            if (value instanceof String hash && !hash.isBlank()) {
                return hash;
            }
        }
        return null;
    }
}
