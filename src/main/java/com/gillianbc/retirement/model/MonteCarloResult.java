package com.gillianbc.retirement.model;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
public class MonteCarloResult {
    List<MonteCarloPercentile> percentiles;
    /** Fraction (0..1) of runs whose final-year assets exceed the success threshold. */
    double successRate;
    BigDecimal medianEndOfPlanAssets;
    int iterations;
    long seed;

    public boolean isEmpty() {
        return percentiles.isEmpty();
    }
}
