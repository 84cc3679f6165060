package com.nosota.msettle.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Platform fee calculation in basis points.
 *
 * <p>{@code fee = floor(amount * bps / 10000)} with the rate clamped into
 * {@code [0, ledger.fee.max-bps]}. Pure: no state besides the two configured rates.
 */
@Component
@Slf4j
public class FeePolicy {

    private static final BigDecimal BPS_DIVISOR = BigDecimal.valueOf(10_000);

    private final int defaultBps;
    private final int maxBps;

    public FeePolicy(@Value("${ledger.fee.default-bps:250}") int defaultBps,
                     @Value("${ledger.fee.max-bps:1000}") int maxBps) {
        if (maxBps < 0 || maxBps > 10_000) {
            throw new IllegalArgumentException("ledger.fee.max-bps must be within [0, 10000], got " + maxBps);
        }
        this.maxBps = maxBps;
        this.defaultBps = clamp(defaultBps);
        log.info("Fee policy: default {} bps, max {} bps", this.defaultBps, this.maxBps);
    }

    /**
     * Computes the fee taken from {@code amount}.
     *
     * @param amount Gross amount, non-negative
     * @param bps    Requested rate; clamped into the allowed range
     * @return Fee, always {@code <= amount}
     */
    public long compute(long amount, int bps) {
        if (amount <= 0) {
            return 0L;
        }
        return BigDecimal.valueOf(amount)
                .multiply(BigDecimal.valueOf(clamp(bps)))
                .divide(BPS_DIVISOR, 0, RoundingMode.DOWN)
                .longValueExact();
    }

    /**
     * Rate to apply for a request: the clamped requested rate, or the default when absent.
     */
    public int resolve(Integer requestedBps) {
        return requestedBps == null ? defaultBps : clamp(requestedBps);
    }

    public int defaultBps() {
        return defaultBps;
    }

    public int maxBps() {
        return maxBps;
    }

    private int clamp(int bps) {
        return Math.max(0, Math.min(bps, maxBps));
    }
}
