package com.gillianbc.retirement.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Everything a projection needs. Spending targets and one-time amounts are in today's money
 * and are inflated year by year.
 */
@Value
@Builder(toBuilder = true)
public class SimulationInputs {
    Person person;
    /** Optional. */
    Person spouse;
    @NonNull @Builder.Default String jurisdiction = "ON";
    @NonNull @Builder.Default BigDecimal inflationRate = BigDecimal.ZERO;
    @NonNull @Builder.Default BigDecimal preRetirementSpend = BigDecimal.ZERO;
    @NonNull @Builder.Default BigDecimal postRetirementSpend = BigDecimal.ZERO;
    @Singular List<OneTimeEvent> oneTimeEvents;
    @NonNull @Builder.Default WithdrawalStrategy withdrawalStrategy = WithdrawalStrategy.TAX_EFFICIENT;
    boolean useIncomeSplitting;
    @NonNull @Builder.Default ReturnAssumptions returnRates = ReturnAssumptions.builder().build();
    /** Calendar year of the first projected year; null means the current year. */
    Integer startYear;

    public boolean hasSpouse() {
        return spouse != null;
    }
}
