package com.dcarunner.domain;

/**
 * Recurring operation kinds. Each kind has exactly one executor and one parameter block on {@link ScheduledOperation}.
 */
public enum OperationKind {
    TRANSFER,
    DCA_SWAP,
    WRITE_OPTION,
    SETTLEMENT,
    OPTIONS_TRADE
}
