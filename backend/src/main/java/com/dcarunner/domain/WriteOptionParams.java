package com.dcarunner.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Covered-call write into an option vault against a signed market-maker quote.
 * Amounts are human decimals; they are normalized with the vault's token decimals at fire time.
 */
@NoArgsConstructor
@Getter
@Setter
public class WriteOptionParams {

    private String vault;
    /** Deposit token amount. */
    private String amount;
    /** Strike in conversion token units. */
    private String strike;
    /** Option expiry, unix seconds. */
    private long expiry;
    /** Premium token amount per deposited unit. */
    private String premiumPerUnit;
    private String minDeposit;
    private String maxDeposit;
    /** Quote validity, unix seconds. */
    private long validUntil;
    private String quoteId;
    private String signature;
}
