package com.gillianbc.retirement.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

/** Canada Pension Plan constants for one tax year. */
@Value
@Builder
public class PensionPlanConstants {
    @NonNull BigDecimal maxPensionableEarnings;
    @NonNull BigDecimal basicExemption;
    @NonNull BigDecimal maxContribution;
    /** Maximum annual retirement pension when starting at 65 with a full contribution record. */
    @NonNull BigDecimal maxAnnualBenefit;
}
