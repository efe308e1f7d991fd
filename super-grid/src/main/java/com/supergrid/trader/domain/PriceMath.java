package com.supergrid.trader.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Percent arithmetic shared by the state machine and the sizer.
 */
final class PriceMath {

    static final int PERCENT_SCALE = 10;
    static final int VOLUME_SCALE = 8;

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private PriceMath() {
    }

    /**
     * {@code delta / reference * 100}. The reference must be positive.
     */
    static BigDecimal percentOf(BigDecimal delta, BigDecimal reference) {
        return delta.multiply(HUNDRED).divide(reference, PERCENT_SCALE, RoundingMode.HALF_UP);
    }

    static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }
}
