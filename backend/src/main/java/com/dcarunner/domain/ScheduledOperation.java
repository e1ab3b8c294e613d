package com.dcarunner.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One recurring, user-authorized operation (job). Exactly one parameter block matching {@link #kind} is set.
 * Disabled (not deleted) on fatal failure; deleted only by explicit user cancellation.
 * Scheduling fields (nextRunAt, lastRunAt, failedAt, ...) are owned by the job store and only changed via targeted updates.
 */
@Document(collection = "scheduled_operations")
@CompoundIndex(name = "enabled_next_run", def = "{'enabled': 1, 'nextRunAt': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ScheduledOperation {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private OperationKind kind;
    private String name;
    /** Delegating owner, lowercase 20-byte hex. */
    @Indexed
    private String ownerAddress;
    private AppReference app;

    private TransferParams transfer;
    private DcaSwapParams dcaSwap;
    private WriteOptionParams writeOption;
    private SettlementParams settlement;
    private OptionsTradeParams optionsTrade;

    private boolean enabled;
    /** Set when disabled by a fatal failure; shown to the user as paused-with-reason. */
    private String disabledReason;
    private long intervalSeconds;
    private Instant nextRunAt;
    private Instant lastRunAt;
    private Instant lastFinishedAt;
    private Instant failedAt;
    private String failReason;
    private Instant createdAt;
    private Instant updatedAt;
}
