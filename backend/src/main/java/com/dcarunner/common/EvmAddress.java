package com.dcarunner.common;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 20-byte hex account/contract address helpers. Stored addresses are always lowercase.
 */
public final class EvmAddress {

    public static final String ZERO = "0x0000000000000000000000000000000000000000";

    private static final Pattern EVM_ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    private EvmAddress() {
    }

    public static boolean isValid(String address) {
        if (address == null || address.isBlank()) return false;
        return EVM_ADDRESS.matcher(address.trim()).matches();
    }

    /**
     * Trims and lowercases a valid address.
     *
     * @throws IllegalArgumentException if the address is not a 20-byte hex string
     */
    public static String normalize(String address) {
        if (!isValid(address)) {
            throw new IllegalArgumentException("Invalid address: " + address);
        }
        return address.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean isZero(String address) {
        return address == null || ZERO.equalsIgnoreCase(address.trim());
    }

    /** Last 20 bytes of a 32-byte ABI word, e.g. an eth_call result for an address getter. */
    public static String fromAbiWord(String hexWord) {
        String raw = hexWord != null && hexWord.startsWith("0x") ? hexWord.substring(2) : hexWord;
        if (raw == null || raw.length() < 40) {
            throw new IllegalArgumentException("ABI word too short for address: " + hexWord);
        }
        return "0x" + raw.substring(raw.length() - 40).toLowerCase(Locale.ROOT);
    }

    /** Left-pads an address to a 32-byte ABI argument (no 0x prefix). */
    public static String toAbiWord(String address) {
        String raw = normalize(address).substring(2);
        return "0".repeat(24) + raw;
    }
}
