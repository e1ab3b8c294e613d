package com.dcarunner.ability;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Two-call protocol of one signing-relay ability. Implementations never retry.
 */
public interface AbilityClient {

    String ability();

    /** Dry-run validation. Nothing is signed. */
    Mono<AbilityResult> precheck(Map<String, Object> params, AbilityContext context);

    /** Signs and broadcasts. */
    Mono<AbilityResult> execute(Map<String, Object> params, AbilityContext context);
}
