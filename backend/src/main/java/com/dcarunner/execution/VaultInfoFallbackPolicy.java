package com.dcarunner.execution;

/**
 * What a write-option fire does when the vault's token configuration cannot be read.
 */
public enum VaultInfoFallbackPolicy {
    /** Proceed with 18 decimals for every token and no approval. */
    DEGRADE,
    /** Fail the fire as fatal. */
    FAIL
}
