package com.dcarunner.failure.config;

import com.dcarunner.domain.OperationKind;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Fatal keyword lists for errors reported by the signing relay, whose error taxonomy is opaque.
 * Matching is case-insensitive substring.
 */
@ConfigurationProperties(prefix = "dcarunner.failure")
@NoArgsConstructor
@Getter
@Setter
public class FailureProperties {

    /** Keywords fatal for every operation kind. */
    private List<String> fatalKeywords = new ArrayList<>(List.of(
            "insufficient funds",
            "insufficient balance",
            "not enough balance",
            "exceeds balance",
            "gas too low",
            "out of gas",
            "intrinsic gas too low"
    ));

    /** Extra keywords per kind, e.g. WRITE_OPTION: ["quote expired"]. */
    private Map<OperationKind, List<String>> kindFatalKeywords = new EnumMap<>(OperationKind.class);
}
