package com.dcarunner.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Conditional vault deposit: executes only when the quoted premium clears the configured APY and strike thresholds.
 */
@NoArgsConstructor
@Getter
@Setter
public class OptionsTradeParams {

    private String vaultAddress;
    private String depositToken;
    private String depositAmount;
    private Instant expiry;
    /** Minimum annualised premium, percent (0..1000). */
    private BigDecimal minimumApy;
    /** Required strike distance above spot, percent (0..1000). */
    private BigDecimal strikeThreshold;
}
