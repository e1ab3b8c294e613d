package com.dcarunner.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Two-leg WETH/USDC settlement staged through the settlement router at the current ETH price. */
@NoArgsConstructor
@AllArgsConstructor
@Getter
@Setter
public class SettlementParams {

    private String fromAddress;
    private String toAddress;
    /** WETH leg, human decimal. Defaults to "1.0" when absent. */
    private String wethAmount;
}
