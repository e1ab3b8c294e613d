package com.dcarunner.chain;

import com.dcarunner.common.EvmAddress;
import com.dcarunner.domain.OperationKind;
import com.dcarunner.domain.VaultTokenInfo;
import com.dcarunner.failure.AuxiliaryLookupException;
import com.dcarunner.failure.MalformedConfigurationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Reads the token triple of an option vault and each token's decimals. Not cached: vault configuration is read
 * fresh for every execution.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class VaultTokenInfoReader {

    static final String DEPOSIT_TOKEN_SELECTOR = "0xc89039c5";
    static final String CONVERSION_TOKEN_SELECTOR = "0x53166ecf";
    static final String PREMIUM_TOKEN_SELECTOR = "0xb180783d";

    private final EvmRpcCaller rpcCaller;
    private final Erc20Reader erc20Reader;

    /**
     * @throws MalformedConfigurationException when the vault address is not a 20-byte hex address (no call is made)
     * @throws AuxiliaryLookupException        when any getter or decimals() read fails
     */
    public VaultTokenInfo read(String vault) {
        if (!EvmAddress.isValid(vault)) {
            throw new MalformedConfigurationException(OperationKind.WRITE_OPTION,
                    "malformed vault address " + vault, Map.of("vault", String.valueOf(vault)));
        }
        String vaultAddress = EvmAddress.normalize(vault);
        try {
            String depositToken = readAddress(vaultAddress, DEPOSIT_TOKEN_SELECTOR);
            String conversionToken = readAddress(vaultAddress, CONVERSION_TOKEN_SELECTOR);
            String premiumToken = readAddress(vaultAddress, PREMIUM_TOKEN_SELECTOR);
            return new VaultTokenInfo(
                    depositToken,
                    conversionToken,
                    premiumToken,
                    erc20Reader.decimals(depositToken),
                    erc20Reader.decimals(conversionToken),
                    erc20Reader.decimals(premiumToken),
                    false);
        } catch (AuxiliaryLookupException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AuxiliaryLookupException("vault-token-info", vaultAddress + ": " + e.getMessage(), e);
        }
    }

    private String readAddress(String vault, String selector) {
        String word = rpcCaller.ethCall(vault, selector);
        String address = EvmAddress.fromAbiWord(word);
        if (EvmAddress.isZero(address)) {
            throw new AuxiliaryLookupException("vault-token-info",
                    vault + " returned zero address for " + selector, null);
        }
        return address;
    }
}
