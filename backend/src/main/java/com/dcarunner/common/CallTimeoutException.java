package com.dcarunner.common;

import java.time.Duration;

/**
 * A collaborator call did not complete within its caller-supplied bound.
 */
public class CallTimeoutException extends RuntimeException {

    private final String call;
    private final Duration timeout;

    public CallTimeoutException(String call, Duration timeout, Throwable cause) {
        super(call + " timed out after " + timeout.toMillis() + "ms", cause);
        this.call = call;
        this.timeout = timeout;
    }

    public String getCall() {
        return call;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
