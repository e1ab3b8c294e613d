package com.dcarunner.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BlockingTest {

    @Test
    @DisplayName("elapsed bound surfaces as CallTimeoutException naming the call")
    void timeoutIsTyped() {
        assertThatThrownBy(() -> Blocking.await(Mono.never(), Duration.ofMillis(50), "execute dca-swap"))
                .isInstanceOf(CallTimeoutException.class)
                .hasMessageContaining("execute dca-swap")
                .satisfies(e -> assertThat(((CallTimeoutException) e).getTimeout()).isEqualTo(Duration.ofMillis(50)));
    }

    @Test
    @DisplayName("runtime errors pass through unchanged and empty completes as null")
    void errorsPassThrough() {
        IllegalStateException boom = new IllegalStateException("boom");
        assertThatThrownBy(() -> Blocking.await(Mono.error(boom), Duration.ofSeconds(1), "x")).isSameAs(boom);
        assertThat(Blocking.<String>await(Mono.empty(), Duration.ofSeconds(1), "x")).isNull();
        assertThat(Blocking.await(Mono.just("ok"), Duration.ofSeconds(1), "x")).isEqualTo("ok");
    }
}
