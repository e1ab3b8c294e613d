package com.dcarunner.common;

import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Blocks on a WebClient-backed {@link Mono} with an explicit bound. Every external call goes through here.
 */
public final class Blocking {

    private Blocking() {
    }

    /**
     * @param call    short name for logs and errors, e.g. "precheck erc20-transfer"
     * @param timeout upper bound for the call
     * @return the emitted value, or null for an empty Mono
     * @throws CallTimeoutException when the bound elapses
     */
    public static <T> T await(Mono<T> mono, Duration timeout, String call) {
        try {
            return mono.timeout(timeout).block();
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                throw new CallTimeoutException(call, timeout, cause);
            }
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
    }
}
