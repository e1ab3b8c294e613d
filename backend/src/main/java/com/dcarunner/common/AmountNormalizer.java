package com.dcarunner.common;

import com.dcarunner.failure.InvalidAmountException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Map;

/**
 * Converts human decimal quantities into the fixed-point integers used on-chain, per token precision.
 * Excess fractional digits are truncated (never rounded up), so the on-chain value never exceeds the input.
 */
public final class AmountNormalizer {

    public static final int MAX_DECIMALS = 255;

    /** Integer digits of the largest uint256 (about 1.16e77). */
    public static final int MAX_INTEGER_DIGITS = 78;

    private static final int UINT256_BITS = 256;

    private AmountNormalizer() {
    }

    /**
     * @param quantity finite, non-negative decimal string (e.g. "1.5")
     * @param decimals token precision in [0, 255]
     * @return quantity * 10^decimals, truncated toward zero
     * @throws InvalidAmountException if the quantity is not a finite non-negative decimal or precision is out of range
     */
    public static BigInteger normalize(String quantity, int decimals) {
        return normalize(parse(quantity), decimals);
    }

    public static BigInteger normalize(BigDecimal quantity, int decimals) {
        checkDecimals(decimals);
        if (quantity == null) {
            throw new InvalidAmountException("Amount is required");
        }
        if (quantity.signum() < 0) {
            throw new InvalidAmountException("Amount must be non-negative, got: " + quantity.toPlainString());
        }
        checkMagnitude(quantity);
        // below one base unit: skip setScale, which overflows on extreme negative exponents
        if (quantity.signum() == 0 || quantity.compareTo(BigDecimal.ONE.movePointLeft(decimals)) < 0) {
            return BigInteger.ZERO;
        }
        BigInteger raw;
        try {
            raw = quantity.setScale(decimals, RoundingMode.DOWN).unscaledValue();
        } catch (ArithmeticException e) {
            throw new InvalidAmountException("Amount cannot be scaled to " + decimals + " decimals: "
                    + quantity, Map.of("quantity", quantity.toString(), "decimals", decimals), e);
        }
        if (raw.bitLength() > UINT256_BITS) {
            throw new InvalidAmountException("Amount exceeds uint256 at " + decimals + " decimals: " + quantity,
                    Map.of("quantity", quantity.toString(), "decimals", decimals));
        }
        return raw;
    }

    /**
     * Inverse of {@link #normalize}: renders an on-chain integer as a plain decimal string.
     */
    public static String render(BigInteger raw, int decimals) {
        checkDecimals(decimals);
        if (raw == null) {
            throw new InvalidAmountException("Raw amount is required");
        }
        return new BigDecimal(raw, decimals).toPlainString();
    }

    /**
     * Human form of the quantity at the given precision (truncated, fixed scale), as stored on execution records.
     */
    public static String truncate(String quantity, int decimals) {
        return render(normalize(quantity, decimals), decimals);
    }

    /**
     * Parses a human decimal. Rejects blanks, signs other than a leading digit, NaN/Infinity and negatives.
     */
    public static BigDecimal parse(String quantity) {
        if (quantity == null || quantity.isBlank()) {
            throw new InvalidAmountException("Amount is required");
        }
        String trimmed = quantity.trim();
        BigDecimal value;
        try {
            value = new BigDecimal(trimmed);
        } catch (NumberFormatException e) {
            throw new InvalidAmountException("Amount is not a decimal number: " + quantity,
                    Map.of("quantity", quantity), e);
        }
        if (value.signum() < 0) {
            throw new InvalidAmountException("Amount must be non-negative, got: " + quantity);
        }
        checkMagnitude(value);
        return value;
    }

    private static void checkMagnitude(BigDecimal quantity) {
        long integerDigits = (long) quantity.precision() - quantity.scale();
        if (integerDigits > MAX_INTEGER_DIGITS) {
            throw new InvalidAmountException("Amount too large for an on-chain integer: " + quantity,
                    Map.of("quantity", quantity.toString()));
        }
    }

    private static void checkDecimals(int decimals) {
        if (decimals < 0 || decimals > MAX_DECIMALS) {
            throw new InvalidAmountException("Token decimals out of range [0, 255]: " + decimals);
        }
    }
}
