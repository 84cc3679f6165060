package com.nosota.msettle.service;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Effective price of a Dutch auction:
 * {@code max(reserve, lastPrice - decrement * floor((now - lastUpdate) / interval))}.
 *
 * <p>The price never goes below the reserve and never rises.
 */
@Component
public class DutchPriceCalculator {

    public long currentPrice(long lastPrice, long reservePrice, long decrementAmount,
                             long decrementIntervalSeconds, Instant lastUpdate, Instant now) {
        if (!now.isAfter(lastUpdate)) {
            return Math.max(reservePrice, lastPrice);
        }

        long elapsedSeconds = Duration.between(lastUpdate, now).getSeconds();
        long steps = elapsedSeconds / decrementIntervalSeconds;

        // steps * decrement may exceed the range for very old auctions; the floor is the reserve anyway
        long maxSteps = (lastPrice - reservePrice) / decrementAmount + 1;
        long discount = Math.min(steps, Math.max(maxSteps, 0)) * decrementAmount;

        return Math.max(reservePrice, lastPrice - discount);
    }

    /**
     * Creation check: the price reaches the reserve within the auction's duration.
     * Integer division on the step count.
     */
    public boolean reachesReserveWithin(long startingPrice, long reservePrice, long decrementAmount,
                                        long decrementIntervalSeconds, long durationSeconds) {
        long steps = (startingPrice - reservePrice) / decrementAmount;
        try {
            return Math.multiplyExact(steps, decrementIntervalSeconds) <= durationSeconds;
        } catch (ArithmeticException e) {
            return false;
        }
    }
}
