package com.dcarunner.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Dollar-cost-averaging buy: swap a fixed amount of tokenIn for tokenOut every fire. */
@NoArgsConstructor
@AllArgsConstructor
@Getter
@Setter
public class DcaSwapParams {

    private String tokenIn;
    private String tokenOut;
    /** Human decimal amount of tokenIn. */
    private String amountIn;
    /** Max slippage in basis points (50 = 0.5%). */
    private int slippageBps;
}
