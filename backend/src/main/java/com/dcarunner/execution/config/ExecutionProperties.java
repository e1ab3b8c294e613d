package com.dcarunner.execution.config;

import com.dcarunner.execution.VaultInfoFallbackPolicy;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Per-kind constants. Documented in application.yml under dcarunner.execution.
 */
@ConfigurationProperties(prefix = "dcarunner.execution")
@NoArgsConstructor
@Getter
@Setter
public class ExecutionProperties {

    private Transfer transfer = new Transfer();
    private DcaSwap dcaSwap = new DcaSwap();
    private WriteOption writeOption = new WriteOption();
    private Settlement settlement = new Settlement();

    @Getter
    @Setter
    public static class Transfer {
        /** Token used when a transfer job does not name one. */
        private String defaultTokenAddress;
    }

    @Getter
    @Setter
    public static class DcaSwap {
        /** Slippage used when a swap job leaves it at 0, in basis points. */
        private int defaultSlippageBps = 50;
        /** Upper bound accepted for a job's slippage. */
        private int maxSlippageBps = 1_000;
    }

    @Getter
    @Setter
    public static class WriteOption {
        /** Spender approved for the deposit token before writing. */
        private String vaultFactoryAddress = "0x07cf0b6a0591cff7b45d6c1ba3a42da49c1630d2";
        /** Behaviour when vault token info cannot be read. */
        private VaultInfoFallbackPolicy vaultInfoFallback = VaultInfoFallbackPolicy.DEGRADE;
    }

    @Getter
    @Setter
    public static class Settlement {
        private String routerAddress = "0x0000000000000000000000000000000000000000";
        private String wethAddress = "0x4200000000000000000000000000000000000006";
        private String usdcAddress = "0x833589fcd6edb6e08f4c7c32d4f71b54bda02913";
        private int wethDecimals = 18;
        private int usdcDecimals = 6;
        /** WETH leg when the job does not set one. */
        private String defaultWethAmount = "1.0";
        /** How long the staged settlement stays valid. */
        private long validForSeconds = 3_600;
    }
}
