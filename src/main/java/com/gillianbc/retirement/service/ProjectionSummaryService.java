package com.gillianbc.retirement.service;

import com.gillianbc.retirement.config.RetirementProperties;
import com.gillianbc.retirement.model.ProjectionSummary;
import com.gillianbc.retirement.model.SimulationInputs;
import com.gillianbc.retirement.model.SimulationResult;
import com.gillianbc.retirement.numeric.Money;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Headline figures for a finished projection: lifetime tax in retirement, the estate and the
 * tax on it, and when (if ever) the money runs out.
 */
@Service
public class ProjectionSummaryService {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final RetirementProperties properties;

    public ProjectionSummaryService(RetirementProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
    }

    /**
     * @param inflationAdjusted when true, amounts are converted to today's dollars by dividing
     *                          each year's figures by that year's inflation factor
     */
    public ProjectionSummary summarize(SimulationInputs inputs, List<SimulationResult> results, boolean inflationAdjusted) {
        Objects.requireNonNull(inputs, "inputs must not be null");
        Objects.requireNonNull(results, "results must not be null");
        if (results.isEmpty()) {
            return empty();
        }

        int retirementAge = inputs.getPerson().getRetirementAge();
        BigDecimal retirementTax = BigDecimal.ZERO;
        BigDecimal retirementIncome = BigDecimal.ZERO;
        Integer outOfMoneyAge = null;
        BigDecimal threshold = properties.getMonteCarlo().getSuccessThreshold();

        for (SimulationResult r : results) {
            if (r.getAge() < retirementAge) {
                continue;
            }
            retirementTax = retirementTax.add(adjust(r.getTaxPaid(), r, inflationAdjusted));
            retirementIncome = retirementIncome.add(adjust(r.getGrossIncome(), r, inflationAdjusted));
            if (outOfMoneyAge == null && r.getTotalAssets().compareTo(threshold) < 0) {
                outOfMoneyAge = r.getAge();
            }
        }

        SimulationResult last = results.get(results.size() - 1);
        BigDecimal estate = adjust(last.getTotalAssets(), last, inflationAdjusted);
        BigDecimal estateTax = adjust(last.getTotalTerminalTax(), last, inflationAdjusted);
        BigDecimal netEstate = estate.subtract(estateTax);
        BigDecimal netRetirementIncome = retirementIncome.subtract(retirementTax);

        return ProjectionSummary.builder()
                .estateValue(Money.round(estate))
                .estateTax(Money.round(estateTax))
                .netEstateValue(Money.round(netEstate))
                .annualTaxRetirement(Money.round(retirementTax))
                .totalRetirementIncome(Money.round(retirementIncome))
                .netRetirementIncome(Money.round(netRetirementIncome))
                .totalNetValue(Money.round(netRetirementIncome.add(netEstate)))
                .effectiveTaxRateRetirement(percent(retirementTax, retirementIncome))
                .effectiveTaxRateEstate(percent(estateTax, estate))
                .totalEffectiveTaxRate(percent(retirementTax.add(estateTax), retirementIncome.add(estate)))
                .initialWithdrawalRate(initialWithdrawalRate(inputs, results, retirementAge))
                .outOfMoneyAge(outOfMoneyAge)
                .build();
    }

    /**
     * Savings withdrawn in the first retired year as a percentage of assets at the start of
     * that year. When the projection starts in retirement the starting balances are used.
     */
    private static BigDecimal initialWithdrawalRate(SimulationInputs inputs, List<SimulationResult> results, int retirementAge) {
        int index = -1;
        for (int i = 0; i < results.size(); i++) {
            if (results.get(i).getAge() == retirementAge) {
                index = i;
                break;
            }
        }

        SimulationResult firstRetired;
        BigDecimal startAssets;
        if (index > 0) {
            firstRetired = results.get(index);
            startAssets = results.get(index - 1).getTotalAssets();
        } else {
            firstRetired = results.get(0);
            startAssets = inputs.getPerson().totalAssets();
            if (inputs.hasSpouse()) {
                startAssets = startAssets.add(inputs.getSpouse().totalAssets());
            }
        }
        BigDecimal withdrawn = firstRetired.getTotalRrspWithdrawal()
                .add(firstRetired.getTotalTfsaWithdrawal())
                .add(firstRetired.getTotalNonRegWithdrawal());
        return percent(withdrawn, startAssets);
    }

    private static BigDecimal adjust(BigDecimal amount, SimulationResult year, boolean inflationAdjusted) {
        if (!inflationAdjusted) {
            return amount;
        }
        return Money.ratio(amount, year.getInflationFactor());
    }

    private static BigDecimal percent(BigDecimal part, BigDecimal whole) {
        if (whole.signum() <= 0) {
            return Money.round(BigDecimal.ZERO);
        }
        return Money.round(part.multiply(HUNDRED).divide(whole, Money.MATH_CONTEXT));
    }

    private static ProjectionSummary empty() {
        BigDecimal zero = Money.round(BigDecimal.ZERO);
        return ProjectionSummary.builder()
                .estateValue(zero)
                .estateTax(zero)
                .netEstateValue(zero)
                .annualTaxRetirement(zero)
                .totalRetirementIncome(zero)
                .netRetirementIncome(zero)
                .totalNetValue(zero)
                .effectiveTaxRateRetirement(zero)
                .effectiveTaxRateEstate(zero)
                .totalEffectiveTaxRate(zero)
                .initialWithdrawalRate(zero)
                .build();
    }
}
