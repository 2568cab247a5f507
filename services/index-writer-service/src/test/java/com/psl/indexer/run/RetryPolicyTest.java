package com.psl.indexer.run;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class RetryPolicyTest {

    @Test
    void backoffGrowsExponentiallyUpToCap() {
        RetryPolicy policy = new RetryPolicy(5, 500, 2.0, 1500);

        assertThat(policy.backoffMs(1)).isEqualTo(500);
        assertThat(policy.backoffMs(2)).isEqualTo(1000);
        assertThat(policy.backoffMs(3)).isEqualTo(1500);
        assertThat(policy.backoffMs(4)).isEqualTo(1500);
    }

    @Test
    void attemptsAreBoundedByMaxAttempts() {
        RetryPolicy policy = new RetryPolicy(3, 10, 2.0, 100);

        assertThat(policy.canRetry(1)).isTrue();
        assertThat(policy.canRetry(2)).isTrue();
        assertThat(policy.canRetry(3)).isFalse();
    }

    @Test
    void nonsensicalSettingsAreClamped() {
        RetryPolicy policy = new RetryPolicy(0, -5, 0.5, 100);

        assertThat(policy.getMaxAttempts()).isEqualTo(1);
        assertThat(policy.canRetry(1)).isFalse();
        assertThat(policy.backoffMs(3)).isZero();
    }
}
