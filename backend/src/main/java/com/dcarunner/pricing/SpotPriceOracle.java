package com.dcarunner.pricing;

import com.dcarunner.common.Blocking;
import com.dcarunner.config.CaffeineConfig;
import com.dcarunner.failure.AuxiliaryLookupException;
import com.dcarunner.pricing.config.PricingProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Current USD price via CoinGecko /simple/price. Cached 5 min. There is no fallback price:
 * any failure is an {@link AuxiliaryLookupException}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SpotPriceOracle {

    private final PricingProperties pricingProperties;
    private final WebClient.Builder webClientBuilder;
    private final ObjectMapper objectMapper;

    @Cacheable(cacheNames = CaffeineConfig.SPOT_PRICE_CACHE, key = "#coinId")
    public BigDecimal usdPrice(String coinId) {
        String url = pricingProperties.getCoingeckoBaseUrl() + "/simple/price?ids=" + coinId + "&vs_currencies=usd";
        String response;
        try {
            response = Blocking.await(webClientBuilder.build().get()
                            .uri(url)
                            .retrieve()
                            .bodyToMono(String.class),
                    Duration.ofMillis(pricingProperties.getTimeoutMs()), "spot price " + coinId);
        } catch (RuntimeException e) {
            throw new AuxiliaryLookupException("spot-price", coinId + ": " + e.getMessage(), e);
        }
        BigDecimal price = parseUsdPrice(response, coinId);
        log.debug("Spot price {} = {} USD", coinId, price);
        return price;
    }

    BigDecimal parseUsdPrice(String json, String coinId) {
        JsonNode usd;
        try {
            usd = objectMapper.readTree(json == null ? "" : json).path(coinId).path("usd");
        } catch (Exception e) {
            throw new AuxiliaryLookupException("spot-price", coinId + ": unreadable response", e);
        }
        if (!usd.isNumber() || usd.decimalValue().signum() <= 0) {
            throw new AuxiliaryLookupException("spot-price", coinId + ": no usd price in " + json, null);
        }
        return usd.decimalValue();
    }
}
