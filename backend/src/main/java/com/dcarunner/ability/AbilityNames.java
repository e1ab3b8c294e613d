package com.dcarunner.ability;

import java.util.List;

/**
 * Relay abilities used by the executors.
 */
public final class AbilityNames {

    public static final String ERC20_TRANSFER = "erc20-transfer";
    public static final String ERC20_APPROVAL = "erc20-approval";
    public static final String DCA_SWAP = "dca-swap";
    public static final String WRITE_OPTION = "write-option";
    public static final String OPTIONS_TRADE = "options-trade";
    public static final String EVM_TX_SIGNER = "evm-tx-signer";

    public static final List<String> ALL = List.of(
            ERC20_TRANSFER, ERC20_APPROVAL, DCA_SWAP, WRITE_OPTION, OPTIONS_TRADE, EVM_TX_SIGNER);

    private AbilityNames() {
    }
}
