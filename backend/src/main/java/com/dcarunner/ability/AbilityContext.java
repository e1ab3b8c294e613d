package com.dcarunner.ability;

/**
 * Per-invocation context. The relay signs on behalf of this delegating owner.
 */
public record AbilityContext(String delegatorAddress) {
}
