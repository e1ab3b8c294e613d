package com.dcarunner.execution;

import com.dcarunner.ability.AbilityNames;
import com.dcarunner.chain.config.ChainProperties;
import com.dcarunner.common.AmountNormalizer;
import com.dcarunner.common.EvmAddress;
import com.dcarunner.domain.OperationKind;
import com.dcarunner.domain.ScheduledOperation;
import com.dcarunner.domain.SettlementParams;
import com.dcarunner.execution.config.ExecutionProperties;
import com.dcarunner.failure.MalformedConfigurationException;
import com.dcarunner.pricing.SpotPriceOracle;
import com.dcarunner.pricing.config.PricingProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stages a two-leg WETH/USDC settlement through the settlement router: WETH from -> to, USDC to -> from,
 * with the USDC leg priced at the current ETH/USD spot.
 */
@Component
public class SettlementOperationExecutor extends AbstractOperationExecutor {

    private final SpotPriceOracle spotPriceOracle;
    private final PricingProperties pricingProperties;
    private final ChainProperties chainProperties;
    private final ExecutionProperties executionProperties;

    public SettlementOperationExecutor(SubmissionPipeline pipeline, SpotPriceOracle spotPriceOracle,
                                       PricingProperties pricingProperties, ChainProperties chainProperties,
                                       ExecutionProperties executionProperties) {
        super(pipeline);
        this.spotPriceOracle = spotPriceOracle;
        this.pricingProperties = pricingProperties;
        this.chainProperties = chainProperties;
        this.executionProperties = executionProperties;
    }

    @Override
    protected OperationKind kind() {
        return OperationKind.SETTLEMENT;
    }

    @Override
    protected PreparedOperation prepare(OperationRun run) {
        ScheduledOperation job = run.getJob();
        SettlementParams params = requireParams(job.getSettlement());
        ExecutionProperties.Settlement settlement = executionProperties.getSettlement();
        String from = requireAddress("from", params.getFromAddress());
        String to = requireAddress("to", params.getToAddress());
        if (from.equals(to)) {
            throw new MalformedConfigurationException(kind(), "settlement legs have the same counterparty",
                    Map.of("address", from));
        }
        String weth = requireAddress("weth", settlement.getWethAddress());
        String usdc = requireAddress("usdc", settlement.getUsdcAddress());
        String router = requireAddress("router", settlement.getRouterAddress());
        if (EvmAddress.isZero(router)) {
            throw new MalformedConfigurationException(kind(), "settlement router address is not configured",
                    Map.of("router", router));
        }
        String wethHuman = params.getWethAmount() != null && !params.getWethAmount().isBlank()
                ? params.getWethAmount()
                : settlement.getDefaultWethAmount();

        BigDecimal ethPrice = spotPriceOracle.usdPrice(pricingProperties.getEthCoinId());
        String usdcHuman = AmountNormalizer.parse(wethHuman).multiply(ethPrice)
                .setScale(settlement.getUsdcDecimals(), RoundingMode.DOWN)
                .toPlainString();

        PreparedOperation prepared = PreparedOperation.forAbility(AbilityNames.EVM_TX_SIGNER);
        BigInteger wethAmount = normalizeInto(prepared, "wethAmount", wethHuman, settlement.getWethDecimals());
        BigInteger usdcAmount = normalizeInto(prepared, "usdcAmount", usdcHuman, settlement.getUsdcDecimals());

        List<Map<String, Object>> legs = List.of(
                leg(from, to, weth, wethAmount),
                leg(to, from, usdc, usdcAmount));
        String legsHash = legsHash(legs);

        prepared.setReferencePriceUsd(ethPrice);
        prepared.setValidUntil(run.getStartedAt().plusSeconds(settlement.getValidForSeconds()));
        return prepared
                .param("chainId", chainProperties.getChainId())
                .param("to", router)
                .param("function", "stageSettlement")
                .param("escrow", from)
                .param("paymentLegs", legs)
                .param("validForSeconds", settlement.getValidForSeconds())
                .detail("fromAddress", from)
                .detail("toAddress", to)
                .detail("router", router)
                .detail("wethAddress", weth)
                .detail("usdcAddress", usdc)
                .detail("legsHash", legsHash);
    }

    private static Map<String, Object> leg(String from, String to, String token, BigInteger amount) {
        Map<String, Object> leg = new LinkedHashMap<>();
        leg.put("from", from);
        leg.put("to", to);
        leg.put("token", token);
        leg.put("amount", amount.toString());
        return leg;
    }

    /**
     * SHA-256 over the legs in order, each rendered as from|to|token|amount and joined with ';'.
     */
    static String legsHash(List<Map<String, Object>> legs) {
        StringBuilder canonical = new StringBuilder();
        for (Map<String, Object> leg : legs) {
            if (canonical.length() > 0) {
                canonical.append(';');
            }
            canonical.append(leg.get("from")).append('|')
                    .append(leg.get("to")).append('|')
                    .append(leg.get("token")).append('|')
                    .append(leg.get("amount"));
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return "0x" + HexFormat.of().formatHex(digest.digest(canonical.toString().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
