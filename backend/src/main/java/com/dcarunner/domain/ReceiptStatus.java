package com.dcarunner.domain;

/**
 * On-chain inclusion state of an executed transaction, as far as this service has observed it.
 */
public enum ReceiptStatus {
    /** Submission acknowledged by the signing relay; inclusion not (yet) checked. */
    UNCONFIRMED,
    CONFIRMED,
    REVERTED
}
