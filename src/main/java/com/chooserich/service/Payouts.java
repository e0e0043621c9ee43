package com.chooserich.service;

import java.math.BigDecimal;
import java.math.RoundingMode;

final class Payouts {

    static final int SCALE = 2;
    // multipliers are quantized before use so binary float noise cannot floor away a cent
    static final int MULTIPLIER_SCALE = 8;

    private Payouts() {
    }

    /** stake x multiplier, floored to cents so rounding never favours the player. */
    static BigDecimal apply(BigDecimal stake, double multiplier) {
        if (multiplier <= 0.0) {
            return BigDecimal.ZERO.setScale(SCALE);
        }
        return stake.multiply(quantized(multiplier)).setScale(SCALE, RoundingMode.FLOOR);
    }

    /** Odds as shown to players, on the same grid the payout uses. */
    static double quantize(double value) {
        return quantized(value).doubleValue();
    }

    private static BigDecimal quantized(double value) {
        return BigDecimal.valueOf(value).setScale(MULTIPLIER_SCALE, RoundingMode.HALF_EVEN);
    }

    static BigDecimal zero() {
        return BigDecimal.ZERO.setScale(SCALE);
    }
}
