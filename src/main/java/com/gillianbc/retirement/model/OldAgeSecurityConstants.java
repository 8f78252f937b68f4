package com.gillianbc.retirement.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

/** Old Age Security constants for one tax year. */
@Value
@Builder
public class OldAgeSecurityConstants {
    /** Annual benefit at 65 before deferral or age-75 increases. */
    @NonNull BigDecimal maxAnnualBenefit;
    /** Net income above which the recovery tax starts. */
    @NonNull BigDecimal clawbackThreshold;
}
