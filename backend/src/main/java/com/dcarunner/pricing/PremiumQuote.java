package com.dcarunner.pricing;

import java.math.BigDecimal;

/**
 * Signed market-maker quote for an option vault.
 *
 * @param premiumPerUnit premium paid per deposited unit, always positive
 * @param strike         strike price in USD; null when the quote does not carry one
 * @param timestamp      quote time, unix seconds
 * @param expiry         option expiry as echoed by the quote, epoch millis
 */
public record PremiumQuote(
        BigDecimal premiumPerUnit,
        BigDecimal strike,
        String signature,
        long timestamp,
        String vault,
        long expiry
) {
}
