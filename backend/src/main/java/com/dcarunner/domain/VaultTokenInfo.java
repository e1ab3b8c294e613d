package com.dcarunner.domain;

/**
 * Per-vault token view, read fresh for every write-option execution. Not persisted.
 */
public record VaultTokenInfo(
        String depositToken,
        String conversionToken,
        String premiumToken,
        int depositTokenDecimals,
        int conversionTokenDecimals,
        int premiumTokenDecimals,
        boolean fallback
) {

    private static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";
    public static final int FALLBACK_DECIMALS = 18;

    /** Substitute used when the vault cannot be read: zero addresses, 18 decimals everywhere. */
    public static VaultTokenInfo fallbackInfo() {
        return new VaultTokenInfo(ZERO_ADDRESS, ZERO_ADDRESS, ZERO_ADDRESS,
                FALLBACK_DECIMALS, FALLBACK_DECIMALS, FALLBACK_DECIMALS, true);
    }
}
