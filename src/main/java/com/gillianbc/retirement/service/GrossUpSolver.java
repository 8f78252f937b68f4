package com.gillianbc.retirement.service;

import com.gillianbc.retirement.numeric.Bisection;
import com.gillianbc.retirement.numeric.Money;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Finds the taxable withdrawal that leaves a required amount in hand once the extra income
 * tax and OAS recovery tax it causes are paid.
 */
@Slf4j
@Service
public class GrossUpSolver {

    static final int MAX_ITERATIONS = 20;
    static final BigDecimal TOLERANCE = BigDecimal.ONE;
    static final BigDecimal UPPER_BOUND_MULTIPLE = BigDecimal.valueOf(3);
    static final BigDecimal MAX_GROSS = new BigDecimal("10000000");

    private final IncomeTaxCalculator taxCalculator;

    public GrossUpSolver(IncomeTaxCalculator taxCalculator) {
        this.taxCalculator = Objects.requireNonNull(taxCalculator, "taxCalculator must not be null");
    }

    /**
     * Bisects {@code gross} over {@code [targetNet, min(3 x targetNet, 10,000,000)]} until
     * {@code gross - marginalTax(gross)} is within $1 of {@code targetNet}, for at most 20
     * iterations. A non-converged search returns its last midpoint. No pension or dividend
     * credits are applied.
     *
     * @param targetNet          cash required after tax
     * @param currentTaxable     taxable income already committed this year
     * @param baseBenefitAmount  OAS received this year, the most that can be clawed back
     * @param jurisdiction       province or territory code
     * @param inflationFactor    indexation for the year
     * @param age                age for the age credit
     */
    public GrossUpResult solveGrossWithdrawal(BigDecimal targetNet,
                                              BigDecimal currentTaxable,
                                              BigDecimal baseBenefitAmount,
                                              String jurisdiction,
                                              BigDecimal inflationFactor,
                                              int age) {
        return solveGrossWithdrawal(targetNet, currentTaxable, baseBenefitAmount, jurisdiction, inflationFactor, age,
                BigDecimal.ZERO, BigDecimal.ZERO, false);
    }

    /**
     * As {@link #solveGrossWithdrawal(BigDecimal, BigDecimal, BigDecimal, String, BigDecimal, int)},
     * but priced with the person's credits so the result agrees with the tax assessed on the
     * whole year.
     *
     * @param currentEligiblePension pension income already eligible for the pension credit
     * @param grossedUpDividends     grossed-up eligible dividends already in {@code currentTaxable}
     * @param withdrawalIsPension    whether the withdrawal itself counts as eligible pension income
     */
    public GrossUpResult solveGrossWithdrawal(BigDecimal targetNet,
                                              BigDecimal currentTaxable,
                                              BigDecimal baseBenefitAmount,
                                              String jurisdiction,
                                              BigDecimal inflationFactor,
                                              int age,
                                              BigDecimal currentEligiblePension,
                                              BigDecimal grossedUpDividends,
                                              boolean withdrawalIsPension) {
        Objects.requireNonNull(targetNet, "targetNet must not be null");
        Objects.requireNonNull(currentTaxable, "currentTaxable must not be null");
        if (targetNet.signum() <= 0) {
            return new GrossUpResult(BigDecimal.ZERO, BigDecimal.ZERO, true);
        }

        Position position = new Position(currentTaxable, baseBenefitAmount, jurisdiction, inflationFactor, age,
                Money.orZero(currentEligiblePension), Money.orZero(grossedUpDividends), withdrawalIsPension);
        BigDecimal baseTax = position.taxWith(BigDecimal.ZERO);
        BigDecimal high = targetNet.multiply(UPPER_BOUND_MULTIPLE).min(MAX_GROSS).max(targetNet);

        Bisection.Root root = Bisection.solveIncreasing(
                gross -> gross.subtract(position.taxWith(gross).subtract(baseTax)),
                targetNet, targetNet, high, TOLERANCE, MAX_ITERATIONS);

        BigDecimal gross = root.getX();
        BigDecimal marginal = gross.subtract(root.getValue());
        if (!root.isConverged()) {
            log.debug("Gross-up for net {} did not converge; best gross {} leaves net {}",
                    targetNet, gross, root.getValue());
        }
        return new GrossUpResult(gross, marginal, root.isConverged());
    }

    /**
     * Extra tax (including OAS recovery) caused by adding {@code gross} to {@code currentTaxable}.
     */
    public BigDecimal marginalTax(BigDecimal gross,
                                  BigDecimal currentTaxable,
                                  BigDecimal baseBenefitAmount,
                                  String jurisdiction,
                                  BigDecimal inflationFactor,
                                  int age) {
        return marginalTax(gross, currentTaxable, baseBenefitAmount, jurisdiction, inflationFactor, age,
                BigDecimal.ZERO, BigDecimal.ZERO, false);
    }

    public BigDecimal marginalTax(BigDecimal gross,
                                  BigDecimal currentTaxable,
                                  BigDecimal baseBenefitAmount,
                                  String jurisdiction,
                                  BigDecimal inflationFactor,
                                  int age,
                                  BigDecimal currentEligiblePension,
                                  BigDecimal grossedUpDividends,
                                  boolean withdrawalIsPension) {
        Position position = new Position(currentTaxable, baseBenefitAmount, jurisdiction, inflationFactor, age,
                Money.orZero(currentEligiblePension), Money.orZero(grossedUpDividends), withdrawalIsPension);
        return position.taxWith(gross).subtract(position.taxWith(BigDecimal.ZERO));
    }

    /** One person's income for the year before the withdrawal being priced. */
    private final class Position {
        private final BigDecimal taxable;
        private final BigDecimal oas;
        private final String jurisdiction;
        private final BigDecimal inflationFactor;
        private final int age;
        private final BigDecimal eligiblePension;
        private final BigDecimal grossedUpDividends;
        private final boolean withdrawalIsPension;

        Position(BigDecimal taxable, BigDecimal oas, String jurisdiction, BigDecimal inflationFactor, int age,
                 BigDecimal eligiblePension, BigDecimal grossedUpDividends, boolean withdrawalIsPension) {
            this.taxable = taxable;
            this.oas = Money.orZero(oas);
            this.jurisdiction = jurisdiction;
            this.inflationFactor = inflationFactor;
            this.age = age;
            this.eligiblePension = eligiblePension;
            this.grossedUpDividends = grossedUpDividends;
            this.withdrawalIsPension = withdrawalIsPension;
        }

        BigDecimal taxWith(BigDecimal gross) {
            BigDecimal pension = withdrawalIsPension ? eligiblePension.add(gross) : eligiblePension;
            return taxCalculator.computeTotalTax(taxable.add(gross), jurisdiction, inflationFactor, age,
                    pension, grossedUpDividends, oas);
        }
    }

    /** A solved withdrawal: the gross to take and the extra tax it triggers. */
    @Value
    public static class GrossUpResult {
        BigDecimal gross;
        BigDecimal marginalTax;
        boolean converged;

        public BigDecimal getNet() {
            return gross.subtract(marginalTax);
        }
    }
}
