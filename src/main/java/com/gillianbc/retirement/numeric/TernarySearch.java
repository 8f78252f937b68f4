package com.gillianbc.retirement.numeric;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Fixed-iteration ternary search for the minimum of a unimodal function.
 */
public final class TernarySearch {

    private static final BigDecimal THREE = BigDecimal.valueOf(3);

    private TernarySearch() {
    }

    /**
     * Narrows {@code [low, high]} by a third on each iteration, moving toward whichever interior
     * point has the lower value. Ties move toward {@code low}, so flat objectives settle on the
     * smaller argument.
     *
     * @return the midpoint of the final bracket and the function value there
     */
    public static Minimum minimize(UnaryOperator<BigDecimal> function,
                                   BigDecimal low,
                                   BigDecimal high,
                                   int iterations) {
        Objects.requireNonNull(function, "function must not be null");
        Objects.requireNonNull(low, "low must not be null");
        Objects.requireNonNull(high, "high must not be null");
        if (iterations < 0) {
            throw new IllegalArgumentException("iterations must be >= 0");
        }
        if (high.compareTo(low) < 0) {
            throw new IllegalArgumentException("high must be >= low");
        }

        BigDecimal lo = low;
        BigDecimal hi = high;
        for (int i = 0; i < iterations; i++) {
            BigDecimal third = hi.subtract(lo).divide(THREE, Money.MATH_CONTEXT);
            BigDecimal m1 = lo.add(third);
            BigDecimal m2 = hi.subtract(third);
            if (function.apply(m1).compareTo(function.apply(m2)) <= 0) {
                hi = m2;
            } else {
                lo = m1;
            }
        }
        BigDecimal x = lo.add(hi).divide(Money.TWO, Money.MATH_CONTEXT);
        return new Minimum(x, function.apply(x));
    }

    @Value
    public static class Minimum {
        BigDecimal x;
        BigDecimal value;
    }
}
