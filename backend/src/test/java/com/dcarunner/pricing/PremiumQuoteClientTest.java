package com.dcarunner.pricing;

import com.dcarunner.failure.AuxiliaryLookupException;
import com.dcarunner.pricing.config.PricingProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PremiumQuoteClientTest {

    private static final String VAULT = "0x2222222222222222222222222222222222222222";
    private static final Instant EXPIRY = Instant.parse("2026-12-25T08:00:00Z");

    @Test
    @DisplayName("fetch passes vault and expiry millis and parses the signed quote")
    void fetch() {
        AtomicReference<String> query = new AtomicReference<>();
        PremiumQuoteClient client = client(HttpStatus.OK,
                "{\"premiumPerUnit\": 0.0125, \"strike\": 4200, \"signature\": \"0xsig\", \"timestamp\": 1760000000,"
                        + " \"vaultAddress\": \"" + VAULT + "\", \"expiry\": " + EXPIRY.toEpochMilli() + "}", query);

        PremiumQuote quote = client.fetch(VAULT, EXPIRY);

        assertThat(query.get()).isEqualTo("vault=" + VAULT + "&expiry=" + EXPIRY.toEpochMilli());
        assertThat(quote.premiumPerUnit()).isEqualByComparingTo("0.0125");
        assertThat(quote.strike()).isEqualByComparingTo("4200");
        assertThat(quote.signature()).isEqualTo("0xsig");
        assertThat(quote.expiry()).isEqualTo(EXPIRY.toEpochMilli());
    }

    @Test
    @DisplayName("strike is optional")
    void strikeOptional() {
        PremiumQuote quote = client(HttpStatus.OK, "", new AtomicReference<>())
                .parse("{\"premiumPerUnit\": 0.01, \"signature\": \"0xsig\", \"timestamp\": 1760000000}", VAULT);

        assertThat(quote.strike()).isNull();
        assertThat(quote.vault()).isEqualTo(VAULT);
    }

    @Test
    @DisplayName("quote without premium, signature or timestamp is rejected")
    void incompleteQuote() {
        PremiumQuoteClient client = client(HttpStatus.OK, "", new AtomicReference<>());

        assertThatThrownBy(() -> client.parse("{\"signature\": \"0xsig\", \"timestamp\": 1}", VAULT))
                .isInstanceOf(AuxiliaryLookupException.class);
        assertThatThrownBy(() -> client.parse("{\"premiumPerUnit\": 0.01, \"timestamp\": 1}", VAULT))
                .isInstanceOf(AuxiliaryLookupException.class);
        assertThatThrownBy(() -> client.parse("{\"premiumPerUnit\": 0.01, \"signature\": \"0xsig\"}", VAULT))
                .isInstanceOf(AuxiliaryLookupException.class);
    }

    @Test
    @DisplayName("endpoint failure is an auxiliary lookup failure")
    void endpointFailure() {
        assertThatThrownBy(() -> client(HttpStatus.INTERNAL_SERVER_ERROR, "oops", new AtomicReference<>())
                .fetch(VAULT, EXPIRY))
                .isInstanceOf(AuxiliaryLookupException.class)
                .hasMessageContaining("premium-quote");
    }

    private static PremiumQuoteClient client(HttpStatus status, String body, AtomicReference<String> query) {
        PricingProperties props = new PricingProperties();
        props.setPremiumQuoteUrl("https://quotes.test/premium");
        WebClient.Builder webClientBuilder = WebClient.builder()
                .exchangeFunction(req -> {
                    query.set(req.url().getQuery());
                    return Mono.just(ClientResponse.create(status)
                            .header("Content-Type", "application/json")
                            .body(body)
                            .build());
                });
        return new PremiumQuoteClient(props, webClientBuilder, new ObjectMapper());
    }
}
