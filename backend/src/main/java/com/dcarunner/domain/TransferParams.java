package com.dcarunner.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** ERC-20 transfer of a fixed human amount to one recipient. */
@NoArgsConstructor
@AllArgsConstructor
@Getter
@Setter
public class TransferParams {

    private String tokenAddress;
    private String recipientAddress;
    /** Human decimal, e.g. "1.25". */
    private String amount;
}
