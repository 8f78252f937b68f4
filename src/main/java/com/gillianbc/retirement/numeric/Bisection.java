package com.gillianbc.retirement.numeric;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Bisection root finder for monotonically increasing functions of a monetary amount.
 */
public final class Bisection {

    private Bisection() {
    }

    /**
     * Searches {@code [low, high]} for an {@code x} with {@code |f(x) - target| < tolerance}.
     * <p>
     * The function must be non-decreasing over the interval. When the iteration budget runs
     * out the last midpoint is returned with {@code converged == false}.
     *
     * @param function      non-decreasing function to invert
     * @param target        value sought
     * @param low           lower end of the bracket
     * @param high          upper end of the bracket (>= low)
     * @param tolerance     absolute acceptance tolerance on the function value
     * @param maxIterations iteration cap (>= 1)
     * @return the best estimate found
     */
    public static Root solveIncreasing(UnaryOperator<BigDecimal> function,
                                       BigDecimal target,
                                       BigDecimal low,
                                       BigDecimal high,
                                       BigDecimal tolerance,
                                       int maxIterations) {
        Objects.requireNonNull(function, "function must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(low, "low must not be null");
        Objects.requireNonNull(high, "high must not be null");
        Objects.requireNonNull(tolerance, "tolerance must not be null");
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be >= 1");
        }
        if (high.compareTo(low) < 0) {
            throw new IllegalArgumentException("high must be >= low");
        }

        BigDecimal lo = low;
        BigDecimal hi = high;
        BigDecimal mid = low;
        BigDecimal value = null;
        for (int i = 1; i <= maxIterations; i++) {
            mid = lo.add(hi).divide(Money.TWO, Money.MATH_CONTEXT);
            value = function.apply(mid);
            BigDecimal residual = value.subtract(target);
            if (residual.abs().compareTo(tolerance) < 0) {
                return new Root(mid, value, i, true);
            }
            if (residual.signum() < 0) {
                lo = mid;
            } else {
                hi = mid;
            }
        }
        return new Root(mid, value, maxIterations, false);
    }

    /** Outcome of a bisection search. */
    @Value
    public static class Root {
        BigDecimal x;
        /** f(x) at the returned estimate. */
        BigDecimal value;
        int iterations;
        boolean converged;
    }
}
