package com.nosota.msettle.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Fee policy")
class FeePolicyTest {

    private final FeePolicy feePolicy = new FeePolicy(250, 1000);

    @Test
    @DisplayName("FEE-001: 2.5% of 10000 is 250")
    void computesBasisPoints() {
        assertThat(feePolicy.compute(10_000L, 250)).isEqualTo(250L);
        assertThat(feePolicy.compute(6_000L, 250)).isEqualTo(150L);
        assertThat(feePolicy.compute(4_000L, 250)).isEqualTo(100L);
    }

    @Test
    @DisplayName("FEE-002: fractional fees are rounded down")
    void roundsDown() {
        // 39 * 250 / 10000 = 0.975
        assertThat(feePolicy.compute(39L, 250)).isZero();
        // 999 * 250 / 10000 = 24.975
        assertThat(feePolicy.compute(999L, 250)).isEqualTo(24L);
    }

    @Test
    @DisplayName("FEE-003: requested rates are clamped into [0, max]")
    void clampsRate() {
        assertThat(feePolicy.compute(10_000L, 5_000)).isEqualTo(1_000L);
        assertThat(feePolicy.compute(10_000L, -10)).isZero();
        assertThat(feePolicy.resolve(null)).isEqualTo(250);
        assertThat(feePolicy.resolve(2_000)).isEqualTo(1_000);
        assertThat(feePolicy.resolve(0)).isZero();
    }

    @Test
    @DisplayName("FEE-004: huge amounts do not overflow")
    void largeAmounts() {
        long fee = feePolicy.compute(Long.MAX_VALUE, 1000);
        assertThat(fee).isEqualTo(Long.MAX_VALUE / 10);
        assertThat(fee).isLessThanOrEqualTo(Long.MAX_VALUE);
    }

    @Test
    @DisplayName("FEE-005: default above max is clamped, max outside [0, 10000] is rejected")
    void configuration() {
        assertThat(new FeePolicy(5_000, 1_000).defaultBps()).isEqualTo(1_000);
        assertThatThrownBy(() -> new FeePolicy(250, 20_000))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
