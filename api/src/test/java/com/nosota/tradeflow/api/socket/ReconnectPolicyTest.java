package com.nosota.tradeflow.api.socket;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReconnectPolicyTest {

    @Test
    void delayGrowsExponentiallyUpToTheCap() {
        ReconnectPolicy policy = new ReconnectPolicy(Duration.ofMillis(500), Duration.ofSeconds(3), 2.0, 0);

        assertThat(policy.delayFor(1)).isEqualTo(Duration.ofMillis(500));
        assertThat(policy.delayFor(2)).isEqualTo(Duration.ofMillis(1000));
        assertThat(policy.delayFor(3)).isEqualTo(Duration.ofMillis(2000));
        assertThat(policy.delayFor(4)).isEqualTo(Duration.ofSeconds(3));
        assertThat(policy.delayFor(40)).isEqualTo(Duration.ofSeconds(3));
    }

    @Test
    void zeroMaxAttemptsNeverExhausts() {
        assertThat(ReconnectPolicy.defaults().isExhausted(10_000)).isFalse();
    }

    @Test
    void boundedPolicyExhaustsAfterMaxAttempts() {
        ReconnectPolicy policy = new ReconnectPolicy(Duration.ofMillis(10), Duration.ofMillis(10), 1.0, 3);

        assertThat(policy.isExhausted(3)).isFalse();
        assertThat(policy.isExhausted(4)).isTrue();
    }

    @Test
    void invalidSettingsAreRejected() {
        assertThatThrownBy(() -> new ReconnectPolicy(Duration.ZERO, Duration.ofSeconds(1), 2.0, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ReconnectPolicy(Duration.ofSeconds(2), Duration.ofSeconds(1), 2.0, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ReconnectPolicy(Duration.ofSeconds(1), Duration.ofSeconds(1), 0.5, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ReconnectPolicy.defaults().delayFor(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
