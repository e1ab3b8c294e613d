package com.dcarunner.execution;

import com.dcarunner.ability.AbilityNames;
import com.dcarunner.chain.Erc20Reader;
import com.dcarunner.chain.config.ChainProperties;
import com.dcarunner.domain.OperationKind;
import com.dcarunner.domain.OptionsTradeParams;
import com.dcarunner.domain.ScheduledOperation;
import com.dcarunner.failure.MalformedConfigurationException;
import com.dcarunner.pricing.PremiumQuote;
import com.dcarunner.pricing.PremiumQuoteClient;
import com.dcarunner.pricing.SpotPriceOracle;
import com.dcarunner.pricing.config.PricingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Conditional vault deposit. Each fire fetches a fresh quote and the ETH spot price and deposits only when the
 * quoted strike clears spot by the configured threshold and the annualised premium reaches the minimum APY.
 * Otherwise the fire ends as skipped.
 */
@Component
@Slf4j
public class OptionsTradeOperationExecutor extends AbstractOperationExecutor {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal SECONDS_PER_YEAR = BigDecimal.valueOf(365L * 24 * 60 * 60);

    private final PremiumQuoteClient premiumQuoteClient;
    private final SpotPriceOracle spotPriceOracle;
    private final Erc20Reader erc20Reader;
    private final PricingProperties pricingProperties;
    private final ChainProperties chainProperties;

    public OptionsTradeOperationExecutor(SubmissionPipeline pipeline, PremiumQuoteClient premiumQuoteClient,
                                         SpotPriceOracle spotPriceOracle, Erc20Reader erc20Reader,
                                         PricingProperties pricingProperties, ChainProperties chainProperties) {
        super(pipeline);
        this.premiumQuoteClient = premiumQuoteClient;
        this.spotPriceOracle = spotPriceOracle;
        this.erc20Reader = erc20Reader;
        this.pricingProperties = pricingProperties;
        this.chainProperties = chainProperties;
    }

    @Override
    protected OperationKind kind() {
        return OperationKind.OPTIONS_TRADE;
    }

    @Override
    protected PreparedOperation prepare(OperationRun run) {
        ScheduledOperation job = run.getJob();
        OptionsTradeParams params = requireParams(job.getOptionsTrade());
        String vault = requireAddress("vault", params.getVaultAddress());
        String depositToken = requireAddress("depositToken", params.getDepositToken());
        if (params.getExpiry() == null) {
            throw new MalformedConfigurationException(kind(), "options trade has no expiry", Map.of("vault", vault));
        }
        BigDecimal threshold = orZero(params.getStrikeThreshold());
        BigDecimal minimumApy = orZero(params.getMinimumApy());

        PremiumQuote quote = premiumQuoteClient.fetch(vault, params.getExpiry());
        BigDecimal spot = spotPriceOracle.usdPrice(pricingProperties.getEthCoinId());

        if (quote.strike() == null) {
            return PreparedOperation.skip("quote for " + vault + " carries no strike");
        }
        BigDecimal requiredStrike = spot.multiply(BigDecimal.ONE.add(threshold.divide(HUNDRED, MathContext.DECIMAL64)));
        if (quote.strike().compareTo(requiredStrike) < 0) {
            return PreparedOperation.skip("strike " + quote.strike().toPlainString() + " below required "
                    + requiredStrike.setScale(2, RoundingMode.HALF_UP).toPlainString());
        }
        BigDecimal apy = annualizedPremiumPct(quote.premiumPerUnit(), params.getExpiry(), run.getStartedAt());
        if (apy.compareTo(minimumApy) < 0) {
            return PreparedOperation.skip("annualised premium " + apy.toPlainString() + "% below minimum "
                    + minimumApy.toPlainString() + "%");
        }

        int decimals = erc20Reader.decimals(depositToken);
        PreparedOperation prepared = PreparedOperation.forAbility(AbilityNames.OPTIONS_TRADE);
        BigInteger depositAmount = normalizeInto(prepared, "depositAmount", params.getDepositAmount(), decimals);
        log.debug("Job {}: strike {} >= {}, apy {}% >= {}%", job.getId(), quote.strike(), requiredStrike, apy,
                minimumApy);

        prepared.setReferencePriceUsd(spot);
        prepared.setAnnualizedPremiumPct(apy);
        return prepared
                .param("chainId", chainProperties.getChainId())
                .param("vaultAddress", vault)
                .param("depositToken", depositToken)
                .param("depositAmount", depositAmount.toString())
                .param("premiumPerUnit", quote.premiumPerUnit().toPlainString())
                .param("signature", quote.signature())
                .detail("vaultAddress", vault)
                .detail("depositToken", depositToken)
                .detail("depositTokenDecimals", decimals)
                .detail("premiumPerUnit", quote.premiumPerUnit().toPlainString())
                .detail("strike", quote.strike().toPlainString())
                .detail("quoteTimestamp", quote.timestamp())
                .detail("expiry", params.getExpiry());
    }

    /**
     * premiumPerUnit / yearsToExpiry * 100, scale 4. Zero once expired.
     */
    static BigDecimal annualizedPremiumPct(BigDecimal premiumPerUnit, Instant expiry, Instant now) {
        long seconds = Duration.between(now, expiry).getSeconds();
        if (seconds <= 0) {
            return BigDecimal.ZERO.setScale(4);
        }
        BigDecimal years = BigDecimal.valueOf(seconds).divide(SECONDS_PER_YEAR, MathContext.DECIMAL64);
        return premiumPerUnit.divide(years, MathContext.DECIMAL64).multiply(HUNDRED)
                .setScale(4, RoundingMode.HALF_UP);
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
