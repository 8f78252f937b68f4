package com.gillianbc.retirement.service;

import com.gillianbc.retirement.model.JurisdictionResolution;
import com.gillianbc.retirement.model.TaxBracket;
import com.gillianbc.retirement.model.TaxRates;
import com.gillianbc.retirement.numeric.Money;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Combined federal and provincial income tax for one person and one year.
 * <p>
 * All dollar thresholds (brackets, personal amounts, credit bases, surtax tiers, health
 * premium bands) are indexed by the caller's inflation factor. The calculator is stateless
 * apart from remembering which unknown jurisdiction codes it has already warned about.
 */
@Slf4j
@Service
public class IncomeTaxCalculator {

    static final BigDecimal FEDERAL_CREDIT_RATE = new BigDecimal("0.15");
    // Pension, age and similar credits are valued at an approximate combined rate
    static final BigDecimal COMBINED_CREDIT_RATE = new BigDecimal("0.20");
    static final BigDecimal PENSION_CREDIT_BASE = new BigDecimal("2000");
    static final BigDecimal FEDERAL_DIVIDEND_CREDIT_RATE = new BigDecimal("0.150198");
    static final int AGE_CREDIT_AGE = 65;
    static final BigDecimal AGE_AMOUNT = new BigDecimal("8790");
    static final BigDecimal AGE_AMOUNT_THRESHOLD = new BigDecimal("44325");
    static final BigDecimal AGE_AMOUNT_REDUCTION_RATE = new BigDecimal("0.15");
    static final BigDecimal CLAWBACK_RATE = new BigDecimal("0.15");

    // Ontario surtax on basic provincial tax, cumulative tiers
    static final String SURTAX_JURISDICTION = "ON";
    static final BigDecimal SURTAX_TIER1_THRESHOLD = new BigDecimal("5315");
    static final BigDecimal SURTAX_TIER1_RATE = new BigDecimal("0.20");
    static final BigDecimal SURTAX_TIER2_THRESHOLD = new BigDecimal("6802");
    static final BigDecimal SURTAX_TIER2_RATE = new BigDecimal("0.36");

    // Ontario Health Premium: {upper income bound, premium}; above the last bound the top premium applies
    private static final long[][] HEALTH_PREMIUM_BANDS = {
            {20000, 0},
            {36000, 300},
            {48000, 450},
            {72000, 600},
            {200000, 750}
    };
    private static final BigDecimal HEALTH_PREMIUM_TOP = new BigDecimal("900");

    @Getter
    private final TaxRates taxRates;
    private final Set<String> reportedFallbacks = ConcurrentHashMap.newKeySet();

    public IncomeTaxCalculator(TaxRates taxRates) {
        this.taxRates = Objects.requireNonNull(taxRates, "taxRates must not be null");
    }

    /** Tax under the configured table, with no age, pension or dividend credits. */
    public BigDecimal computeTax(BigDecimal taxableIncome, String jurisdiction, BigDecimal inflationFactor) {
        return computeTax(taxableIncome, jurisdiction, inflationFactor, taxRates, 0, BigDecimal.ZERO, BigDecimal.ZERO);
    }

    public BigDecimal computeTax(BigDecimal taxableIncome, String jurisdiction, BigDecimal inflationFactor, int age,
                                 BigDecimal eligiblePensionIncome, BigDecimal grossedUpDividends) {
        return computeTax(taxableIncome, jurisdiction, inflationFactor, taxRates, age, eligiblePensionIncome, grossedUpDividends);
    }

    /**
     * Income tax after the basic personal credits and, where they apply, the pension income,
     * dividend and age credits. Ontario adds its health premium and surtax. Never negative.
     *
     * @param taxableIncome         taxable income including grossed-up dividends
     * @param jurisdiction          province or territory code; unknown codes fall back to the table default
     * @param inflationFactor       indexation applied to every dollar threshold
     * @param rates                 tax table to use
     * @param age                   age at the end of the year (age credit from 65)
     * @param eligiblePensionIncome income eligible for the pension credit
     * @param grossedUpDividends    grossed-up eligible dividends included in taxable income
     * @return tax payable, >= 0
     */
    public BigDecimal computeTax(BigDecimal taxableIncome,
                                 String jurisdiction,
                                 BigDecimal inflationFactor,
                                 TaxRates rates,
                                 int age,
                                 BigDecimal eligiblePensionIncome,
                                 BigDecimal grossedUpDividends) {
        Objects.requireNonNull(taxableIncome, "taxableIncome must not be null");
        Objects.requireNonNull(inflationFactor, "inflationFactor must not be null");
        Objects.requireNonNull(rates, "rates must not be null");
        BigDecimal pension = Money.orZero(eligiblePensionIncome);
        BigDecimal dividends = Money.orZero(grossedUpDividends);

        String region = resolve(jurisdiction, rates).getResolved();
        List<TaxBracket> regionalBrackets = rates.regionalBracketsFor(region);

        BigDecimal federalTax = bracketTax(taxableIncome, rates.getFederalBrackets(), inflationFactor);
        BigDecimal regionalTax = bracketTax(taxableIncome, regionalBrackets, inflationFactor);

        BigDecimal federalCredit = indexed(rates.getFederalBasicPersonalAmount(), inflationFactor)
                .multiply(FEDERAL_CREDIT_RATE, Money.MATH_CONTEXT);
        BigDecimal regionalCredit = indexed(rates.regionalBasicPersonalAmountFor(region), inflationFactor)
                .multiply(regionalBrackets.get(0).getRate(), Money.MATH_CONTEXT);

        BigDecimal basicRegionalTax = regionalTax.subtract(regionalCredit);
        BigDecimal total = federalTax.subtract(federalCredit).add(basicRegionalTax);

        if (pension.signum() > 0) {
            BigDecimal claim = pension.min(indexed(PENSION_CREDIT_BASE, inflationFactor));
            total = total.subtract(claim.multiply(COMBINED_CREDIT_RATE, Money.MATH_CONTEXT));
        }
        if (dividends.signum() > 0) {
            BigDecimal creditRate = FEDERAL_DIVIDEND_CREDIT_RATE.add(rates.regionalDividendCreditRateFor(region));
            total = total.subtract(dividends.multiply(creditRate, Money.MATH_CONTEXT));
        }
        if (age >= AGE_CREDIT_AGE) {
            total = total.subtract(ageCredit(taxableIncome, inflationFactor));
        }

        if (SURTAX_JURISDICTION.equals(region)) {
            total = total.add(healthPremium(taxableIncome, inflationFactor));
            total = total.add(surtax(basicRegionalTax, inflationFactor));
        }

        return Money.floorAtZero(total);
    }

    /**
     * OAS recovery tax: 15% of net income above the indexed threshold, capped at the benefit
     * actually received.
     */
    public BigDecimal computeClawback(BigDecimal netIncome, BigDecimal maxClawback, BigDecimal inflationFactor, BigDecimal threshold) {
        Objects.requireNonNull(netIncome, "netIncome must not be null");
        Objects.requireNonNull(maxClawback, "maxClawback must not be null");
        Objects.requireNonNull(inflationFactor, "inflationFactor must not be null");
        Objects.requireNonNull(threshold, "threshold must not be null");

        BigDecimal indexedThreshold = indexed(threshold, inflationFactor);
        if (netIncome.compareTo(indexedThreshold) <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal repayment = netIncome.subtract(indexedThreshold).multiply(CLAWBACK_RATE, Money.MATH_CONTEXT);
        return repayment.min(Money.floorAtZero(maxClawback));
    }

    public BigDecimal computeClawback(BigDecimal netIncome, BigDecimal maxClawback, BigDecimal inflationFactor) {
        return computeClawback(netIncome, maxClawback, inflationFactor, taxRates.getOas().getClawbackThreshold());
    }

    /**
     * Income tax plus OAS recovery tax, the figure every simulation step works with.
     */
    public BigDecimal computeTotalTax(BigDecimal taxableIncome, String jurisdiction, BigDecimal inflationFactor, int age,
                                      BigDecimal eligiblePensionIncome, BigDecimal grossedUpDividends, BigDecimal oasIncome) {
        return computeTax(taxableIncome, jurisdiction, inflationFactor, age, eligiblePensionIncome, grossedUpDividends)
                .add(computeClawback(taxableIncome, Money.orZero(oasIncome), inflationFactor));
    }

    /**
     * Resolves a jurisdiction code against the configured table, logging the first fallback
     * seen for each unknown code.
     */
    public JurisdictionResolution resolve(String jurisdiction) {
        return resolve(jurisdiction, taxRates);
    }

    private JurisdictionResolution resolve(String jurisdiction, TaxRates rates) {
        JurisdictionResolution resolution = rates.resolveJurisdiction(jurisdiction);
        if (resolution.isFallback()) {
            if (reportedFallbacks.add(String.valueOf(jurisdiction))) {
                log.warn("Jurisdiction '{}' not in tax table {}; using default {}",
                        jurisdiction, rates.getVersion(), resolution.getResolved());
            } else {
                log.debug("Jurisdiction '{}' resolved to default {}", jurisdiction, resolution.getResolved());
            }
        }
        return resolution;
    }

    /**
     * Progressive tax over one bracket schedule: the sum over brackets of
     * {@code rate * (min(income, nextThreshold) - threshold)} for the brackets income reaches.
     *
     * @throws IllegalArgumentException if the thresholds are not in ascending order
     */
    public static BigDecimal bracketTax(BigDecimal income, List<TaxBracket> brackets, BigDecimal inflationFactor) {
        Objects.requireNonNull(income, "income must not be null");
        Objects.requireNonNull(brackets, "brackets must not be null");
        BigDecimal tax = BigDecimal.ZERO;
        for (int i = 0; i < brackets.size(); i++) {
            BigDecimal start = indexed(brackets.get(i).getThreshold(), inflationFactor);
            boolean last = i == brackets.size() - 1;
            if (!last && brackets.get(i + 1).getThreshold().compareTo(brackets.get(i).getThreshold()) < 0) {
                throw new IllegalArgumentException("bracket thresholds must be ascending at index " + (i + 1));
            }
            if (income.compareTo(start) <= 0) {
                continue;
            }
            BigDecimal top = last ? income : income.min(indexed(brackets.get(i + 1).getThreshold(), inflationFactor));
            tax = tax.add(top.subtract(start).multiply(brackets.get(i).getRate(), Money.MATH_CONTEXT));
        }
        return tax;
    }

    static BigDecimal healthPremium(BigDecimal income, BigDecimal inflationFactor) {
        for (long[] band : HEALTH_PREMIUM_BANDS) {
            if (income.compareTo(indexed(BigDecimal.valueOf(band[0]), inflationFactor)) <= 0) {
                return BigDecimal.valueOf(band[1]);
            }
        }
        return HEALTH_PREMIUM_TOP;
    }

    static BigDecimal surtax(BigDecimal basicRegionalTax, BigDecimal inflationFactor) {
        if (basicRegionalTax.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal surtax = BigDecimal.ZERO;
        BigDecimal tier1 = indexed(SURTAX_TIER1_THRESHOLD, inflationFactor);
        BigDecimal tier2 = indexed(SURTAX_TIER2_THRESHOLD, inflationFactor);
        if (basicRegionalTax.compareTo(tier1) > 0) {
            surtax = surtax.add(basicRegionalTax.subtract(tier1).multiply(SURTAX_TIER1_RATE, Money.MATH_CONTEXT));
        }
        if (basicRegionalTax.compareTo(tier2) > 0) {
            surtax = surtax.add(basicRegionalTax.subtract(tier2).multiply(SURTAX_TIER2_RATE, Money.MATH_CONTEXT));
        }
        return surtax;
    }

    private static BigDecimal ageCredit(BigDecimal income, BigDecimal inflationFactor) {
        BigDecimal excess = Money.floorAtZero(income.subtract(indexed(AGE_AMOUNT_THRESHOLD, inflationFactor)));
        BigDecimal claim = Money.floorAtZero(indexed(AGE_AMOUNT, inflationFactor)
                .subtract(excess.multiply(AGE_AMOUNT_REDUCTION_RATE, Money.MATH_CONTEXT)));
        return claim.multiply(COMBINED_CREDIT_RATE, Money.MATH_CONTEXT);
    }

    private static BigDecimal indexed(BigDecimal amount, BigDecimal inflationFactor) {
        return amount.multiply(inflationFactor, Money.MATH_CONTEXT);
    }
}
