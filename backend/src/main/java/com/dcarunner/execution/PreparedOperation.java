package com.dcarunner.execution;

import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Output of the normalization step: what to send to the relay and what to record once it is on-chain.
 * A skipped operation carries only the reason.
 */
@Getter
public class PreparedOperation {

    private final String ability;
    private final String skipReason;
    private final Map<String, Object> abilityParams = new LinkedHashMap<>();
    private final Map<String, String> humanAmounts = new LinkedHashMap<>();
    private final Map<String, String> normalizedAmounts = new LinkedHashMap<>();
    private final Map<String, String> details = new LinkedHashMap<>();
    @Setter
    private BigDecimal referencePriceUsd;
    @Setter
    private BigDecimal annualizedPremiumPct;
    @Setter
    private Instant validUntil;

    private PreparedOperation(String ability, String skipReason) {
        this.ability = ability;
        this.skipReason = skipReason;
    }

    public static PreparedOperation forAbility(String ability) {
        return new PreparedOperation(ability, null);
    }

    /** Conditions for submission not met this fire. The fire ends successfully without a record. */
    public static PreparedOperation skip(String reason) {
        return new PreparedOperation(null, reason);
    }

    public boolean isSkipped() {
        return skipReason != null;
    }

    public PreparedOperation param(String name, Object value) {
        abilityParams.put(name, value);
        return this;
    }

    /**
     * Records an economic term in both forms. The human form is the entered value truncated to the precision used.
     */
    public PreparedOperation amount(String name, String human, BigInteger normalized) {
        humanAmounts.put(name, human);
        normalizedAmounts.put(name, normalized.toString());
        return this;
    }

    public PreparedOperation detail(String name, Object value) {
        details.put(name, String.valueOf(value));
        return this;
    }
}
