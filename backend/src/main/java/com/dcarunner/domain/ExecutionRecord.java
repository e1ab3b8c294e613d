package com.dcarunner.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One successful on-chain submission of a scheduled operation. txHash is unique across all records,
 * which makes a re-delivered fire idempotent at the persistence level.
 */
@Document(collection = "execution_records")
@CompoundIndex(name = "schedule_created", def = "{'scheduleId': 1, 'createdAt': -1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ExecutionRecord {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed(unique = true)
    private String txHash;
    private String scheduleId;
    private OperationKind kind;
    @Indexed
    private String ownerAddress;
    private int appVersion;
    /** Economic terms as entered, truncated to the precision they were normalized at (e.g. amount -> "1.500000"). */
    private Map<String, String> humanAmounts = new LinkedHashMap<>();
    /** Same keys as humanAmounts, fixed-point integer strings as submitted on-chain. */
    private Map<String, String> normalizedAmounts = new LinkedHashMap<>();
    /** Addresses, decimals, quote ids and other kind-specific terms. */
    private Map<String, String> details = new LinkedHashMap<>();
    /** Settlement: ETH/USD used for the USDC leg. Options: spot at decision time. */
    private BigDecimal referencePriceUsd;
    /** Options trade only. */
    private BigDecimal annualizedPremiumPct;
    private Instant validUntil;
    private ReceiptStatus receiptStatus = ReceiptStatus.UNCONFIRMED;
    private Instant createdAt;
}
