package com.dcarunner.chain;

import com.dcarunner.common.RetryPolicy;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RpcEndpointRotatorTest {

    @Test
    void getNextEndpoint_roundRobins() {
        RpcEndpointRotator rotator = new RpcEndpointRotator(
                List.of("https://base-a.example", "https://base-b.example"),
                RetryPolicy.defaultPolicy());
        assertThat(rotator.getNextEndpoint()).isEqualTo("https://base-a.example");
        assertThat(rotator.getNextEndpoint()).isEqualTo("https://base-b.example");
        assertThat(rotator.getNextEndpoint()).isEqualTo("https://base-a.example");
    }

    @Test
    void getNextEndpoint_singleEndpoint_alwaysSame() {
        RpcEndpointRotator rotator = new RpcEndpointRotator(List.of("https://mainnet.base.org"), null);
        IntStream.range(0, 5).forEach(i -> assertThat(rotator.getNextEndpoint()).isEqualTo("https://mainnet.base.org"));
    }

    @Test
    void retryDelayMs_andMaxAttempts_comeFromPolicy() {
        RpcEndpointRotator rotator = new RpcEndpointRotator(List.of("https://a.example"), new RetryPolicy(100L, 0, 4));
        assertThat(rotator.retryDelayMs(0)).isEqualTo(100L);
        assertThat(rotator.retryDelayMs(1)).isEqualTo(200L);
        assertThat(rotator.getMaxAttempts()).isEqualTo(4);
    }

    @Test
    void constructor_emptyEndpoints_throws() {
        assertThatThrownBy(() -> new RpcEndpointRotator(List.of(), null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("At least one endpoint");
        assertThatThrownBy(() -> new RpcEndpointRotator(null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
