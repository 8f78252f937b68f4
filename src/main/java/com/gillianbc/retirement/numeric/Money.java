package com.gillianbc.retirement.numeric;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Shared arithmetic conventions for monetary amounts.
 * <p>
 * Intermediate values keep full precision under {@link #MATH_CONTEXT}; values are only
 * rounded to cents when they are written into a result record.
 */
public final class Money {

    public static final MathContext MATH_CONTEXT = new MathContext(16, RoundingMode.HALF_UP);
    public static final BigDecimal TWO = BigDecimal.valueOf(2);

    private Money() {
    }

    /** Rounds to 2 decimal places using HALF_UP. */
    public static BigDecimal round(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }

    public static BigDecimal floorAtZero(BigDecimal value) {
        return value.signum() < 0 ? BigDecimal.ZERO : value;
    }

    public static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }

    /**
     * Divides, returning zero when the divisor is zero. Callers use this for pro-rata shares
     * where an empty pool means nothing to share.
     */
    public static BigDecimal ratio(BigDecimal numerator, BigDecimal denominator) {
        if (denominator.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return numerator.divide(denominator, MATH_CONTEXT);
    }

    /** (1 + rate)^years. */
    public static BigDecimal compound(BigDecimal rate, int years) {
        return BigDecimal.ONE.add(rate).pow(years, MATH_CONTEXT);
    }
}
