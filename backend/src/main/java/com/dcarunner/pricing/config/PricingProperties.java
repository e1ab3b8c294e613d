package com.dcarunner.pricing.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Price oracle and premium quote endpoints. Documented in application.yml under dcarunner.pricing.
 */
@ConfigurationProperties(prefix = "dcarunner.pricing")
@Getter
@Setter
public class PricingProperties {

    /**
     * CoinGecko API base URL (free: https://api.coingecko.com/api/v3).
     */
    private String coingeckoBaseUrl = "https://api.coingecko.com/api/v3";

    /**
     * CoinGecko coin id used for the ETH/USD reference price.
     */
    private String ethCoinId = "ethereum";

    /**
     * Market-maker premium quote endpoint; queried with ?vault=&expiry=(epoch millis).
     */
    private String premiumQuoteUrl = "https://api.example.com/premium";

    /**
     * Upper bound for one price or quote request.
     */
    private long timeoutMs = 10_000;
}
