package com.dcarunner.ability.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Map;

/**
 * Signing relay settings. Documented in application.yml under dcarunner.abilities.
 */
@ConfigurationProperties(prefix = "dcarunner.abilities")
@NoArgsConstructor
@Getter
@Setter
public class AbilityProperties {

    /** Relay base URL. */
    private String relayBaseUrl = "http://localhost:3000";

    /** Sent as X-Api-Key when set. */
    private String apiKey;

    /** Upper bound for a precheck call. */
    private long precheckTimeoutMs = 30_000;

    /** Upper bound for an execute call (sign + broadcast). */
    private long executeTimeoutMs = 120_000;

    /** Wait for the transaction receipt after persisting the execution record. */
    private boolean confirmReceipts = false;

    /** How long to wait for a receipt before declaring the outcome ambiguous. */
    private long receiptTimeoutMs = 180_000;

    /** Relay path per ability when it differs from the ability name, e.g. write-option: derifun-write-option. */
    private Map<String, String> relayPaths = new HashMap<>();
}
