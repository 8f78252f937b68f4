package com.gillianbc.retirement.numeric;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BisectionTest {

    @Test
    @DisplayName("Finds x with 2x = 10 inside [0, 100]")
    void converges() {
        Bisection.Root root = Bisection.solveIncreasing(x -> x.multiply(Money.TWO), BigDecimal.TEN,
                BigDecimal.ZERO, new BigDecimal("100"), new BigDecimal("0.001"), 60);
        assertTrue(root.isConverged());
        assertTrue(root.getX().subtract(new BigDecimal("5")).abs().compareTo(new BigDecimal("0.001")) < 0);
        assertTrue(root.getIterations() <= 60);
    }

    @Test
    @DisplayName("Out of iterations: returns the last midpoint, flagged as not converged")
    void budgetExhausted() {
        Bisection.Root root = Bisection.solveIncreasing(x -> x, BigDecimal.ONE,
                BigDecimal.ZERO, new BigDecimal("100"), new BigDecimal("0.001"), 1);
        assertFalse(root.isConverged());
        assertEquals(0, new BigDecimal("50").compareTo(root.getX()));
        assertEquals(1, root.getIterations());
    }

    @Test
    @DisplayName("Rejects an inverted bracket and a zero iteration budget")
    void invalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> Bisection.solveIncreasing(x -> x, BigDecimal.ONE,
                BigDecimal.TEN, BigDecimal.ONE, BigDecimal.ONE, 10));
        assertThrows(IllegalArgumentException.class, () -> Bisection.solveIncreasing(x -> x, BigDecimal.ONE,
                BigDecimal.ZERO, BigDecimal.TEN, BigDecimal.ONE, 0));
    }
}
