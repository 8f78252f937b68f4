package com.gillianbc.retirement.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

/** Annual market return assumptions. */
@Value
@Builder(toBuilder = true)
public class ReturnAssumptions {
    /** Yield on the interest share of the open account. */
    @NonNull @Builder.Default BigDecimal interest = BigDecimal.ZERO;
    /** Cash yield on the dividend share of the open account. */
    @NonNull @Builder.Default BigDecimal dividend = BigDecimal.ZERO;
    /** Mean annual capital growth. */
    @NonNull @Builder.Default BigDecimal capitalGrowth = BigDecimal.ZERO;
    /** Standard deviation of annual capital growth, used only by stochastic runs. */
    @Builder.Default double volatility = 0.0;
}
