package com.gillianbc.retirement.service;

import com.gillianbc.retirement.model.TaxRates;
import com.gillianbc.retirement.numeric.Money;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Estimates the two government pensions: CPP (contribution- and start-age-adjusted) and OAS
 * (deferral bonus plus the 10% increase from age 75).
 */
@Service
public class GovernmentBenefitCalculator {

    static final int STANDARD_START_AGE = 65;
    static final int FULL_CONTRIBUTION_YEARS = 40;
    static final BigDecimal CPP_EARLY_REDUCTION_PER_MONTH = new BigDecimal("0.006");
    static final BigDecimal CPP_LATE_INCREASE_PER_MONTH = new BigDecimal("0.007");
    static final int MAX_ADJUSTMENT_MONTHS = 60;
    static final BigDecimal OAS_DEFERRAL_INCREASE_PER_MONTH = new BigDecimal("0.006");
    static final int OAS_INCREASE_AGE = 75;
    static final BigDecimal OAS_AGE_75_MULTIPLIER = new BigDecimal("1.10");

    private final TaxRates taxRates;

    public GovernmentBenefitCalculator(TaxRates taxRates) {
        this.taxRates = Objects.requireNonNull(taxRates, "taxRates must not be null");
    }

    /**
     * Annual CPP retirement pension.
     * <p>
     * maximum x min(1, years / 40) x (1 - 0.6% per month before 65, or + 0.7% per month after 65),
     * with the month adjustment limited to 60 months either way.
     *
     * @param yearsContributed years of contributions (negative treated as 0)
     * @param startAge         age the pension starts
     * @param inflationFactor  indexation of the maximum benefit
     */
    public BigDecimal estimateCpp(int yearsContributed, int startAge, BigDecimal inflationFactor) {
        Objects.requireNonNull(inflationFactor, "inflationFactor must not be null");
        BigDecimal max = taxRates.getCpp().getMaxAnnualBenefit().multiply(inflationFactor, Money.MATH_CONTEXT);

        int years = Math.max(0, Math.min(FULL_CONTRIBUTION_YEARS, yearsContributed));
        BigDecimal share = BigDecimal.valueOf(years).divide(BigDecimal.valueOf(FULL_CONTRIBUTION_YEARS), Money.MATH_CONTEXT);

        int months = Math.max(-MAX_ADJUSTMENT_MONTHS, Math.min(MAX_ADJUSTMENT_MONTHS, (startAge - STANDARD_START_AGE) * 12));
        BigDecimal adjustment = BigDecimal.ONE;
        if (months < 0) {
            adjustment = adjustment.subtract(CPP_EARLY_REDUCTION_PER_MONTH.multiply(BigDecimal.valueOf(-months)));
        } else if (months > 0) {
            adjustment = adjustment.add(CPP_LATE_INCREASE_PER_MONTH.multiply(BigDecimal.valueOf(months)));
        }

        return max.multiply(share, Money.MATH_CONTEXT).multiply(adjustment, Money.MATH_CONTEXT);
    }

    /**
     * Annual OAS pension at {@code age}; zero before {@code startAge}.
     */
    public BigDecimal estimateOas(int age, int startAge, BigDecimal inflationFactor) {
        Objects.requireNonNull(inflationFactor, "inflationFactor must not be null");
        if (age < startAge) {
            return BigDecimal.ZERO;
        }
        BigDecimal benefit = taxRates.getOas().getMaxAnnualBenefit().multiply(inflationFactor, Money.MATH_CONTEXT);

        if (startAge > STANDARD_START_AGE) {
            int monthsDeferred = Math.min((startAge - STANDARD_START_AGE) * 12, MAX_ADJUSTMENT_MONTHS);
            BigDecimal bonus = OAS_DEFERRAL_INCREASE_PER_MONTH.multiply(BigDecimal.valueOf(monthsDeferred));
            benefit = benefit.multiply(BigDecimal.ONE.add(bonus), Money.MATH_CONTEXT);
        }
        if (age >= OAS_INCREASE_AGE) {
            benefit = benefit.multiply(OAS_AGE_75_MULTIPLIER, Money.MATH_CONTEXT);
        }
        return benefit;
    }
}
