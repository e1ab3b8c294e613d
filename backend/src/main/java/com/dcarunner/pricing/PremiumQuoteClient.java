package com.dcarunner.pricing;

import com.dcarunner.common.Blocking;
import com.dcarunner.failure.AuxiliaryLookupException;
import com.dcarunner.pricing.config.PricingProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Fetches the current premium quote for a vault and expiry. Not cached; a quote is only good for one decision.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PremiumQuoteClient {

    private final PricingProperties pricingProperties;
    private final WebClient.Builder webClientBuilder;
    private final ObjectMapper objectMapper;

    /**
     * @throws AuxiliaryLookupException when the endpoint fails or premiumPerUnit, signature or timestamp is missing
     */
    public PremiumQuote fetch(String vault, Instant expiry) {
        String url = pricingProperties.getPremiumQuoteUrl() + "?vault=" + vault + "&expiry=" + expiry.toEpochMilli();
        String response;
        try {
            response = Blocking.await(webClientBuilder.build().get()
                            .uri(url)
                            .retrieve()
                            .bodyToMono(String.class),
                    Duration.ofMillis(pricingProperties.getTimeoutMs()), "premium quote " + vault);
        } catch (RuntimeException e) {
            throw new AuxiliaryLookupException("premium-quote", vault + ": " + e.getMessage(), e);
        }
        return parse(response, vault);
    }

    PremiumQuote parse(String json, String vault) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json == null ? "" : json);
        } catch (Exception e) {
            throw new AuxiliaryLookupException("premium-quote", vault + ": unreadable response", e);
        }
        JsonNode premium = root.path("premiumPerUnit");
        String signature = root.path("signature").asText("");
        long timestamp = root.path("timestamp").asLong(0);
        if (!premium.isNumber() || premium.decimalValue().signum() <= 0 || signature.isBlank() || timestamp <= 0) {
            throw new AuxiliaryLookupException("premium-quote", vault + ": invalid quote " + json, null);
        }
        JsonNode strike = root.path("strike");
        BigDecimal strikeValue = strike.isNumber() ? strike.decimalValue() : null;
        log.debug("Premium quote for {}: premiumPerUnit={} strike={}", vault, premium.decimalValue(), strikeValue);
        return new PremiumQuote(
                premium.decimalValue(),
                strikeValue,
                signature,
                timestamp,
                root.path("vaultAddress").asText(vault),
                root.path("expiry").asLong(0));
    }
}
