package com.troveindexer.common;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RetryPolicyTest {

    @Test
    void delayMs_attemptZero_returnsJitteredBaseDelay() {
        RetryPolicy policy = new RetryPolicy(1000L, 0.2, 5);
        for (int i = 0; i < 20; i++) {
            assertThat(policy.delayMs(0)).isBetween(800L, 1200L);
        }
    }

    @Test
    void delayMs_withoutJitter_doublesPerAttempt() {
        RetryPolicy policy = new RetryPolicy(250L, 0, 4);
        assertThat(policy.delayMs(0)).isEqualTo(250L);
        assertThat(policy.delayMs(1)).isEqualTo(500L);
        assertThat(policy.delayMs(3)).isEqualTo(2000L);
    }

    @Test
    void delayMs_largeAttempt_isCapped() {
        RetryPolicy policy = new RetryPolicy(1L, 0, 100);
        assertThat(policy.delayMs(60)).isEqualTo(1L << 20);
    }

    @Test
    void defaultPolicy_threeAttempts() {
        assertThat(RetryPolicy.defaultPolicy().getMaxAttempts()).isEqualTo(3);
    }
}
