package com.gillianbc.retirement.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Headline figures derived from a projection. Rates are percentages.
 */
@Value
@Builder
public class ProjectionSummary {

    BigDecimal estateValue;
    BigDecimal estateTax;
    BigDecimal netEstateValue;
    BigDecimal annualTaxRetirement;
    BigDecimal totalRetirementIncome;
    BigDecimal netRetirementIncome;
    BigDecimal totalNetValue;
    BigDecimal effectiveTaxRateRetirement;
    BigDecimal effectiveTaxRateEstate;
    BigDecimal totalEffectiveTaxRate;
    BigDecimal initialWithdrawalRate;
    /** First retired age with assets below the success threshold; null if never. */
    Integer outOfMoneyAge;
}
