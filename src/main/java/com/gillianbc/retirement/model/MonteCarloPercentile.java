package com.gillianbc.retirement.model;

import lombok.Value;

import java.math.BigDecimal;

/** Distribution of total assets across runs for one projected year. */
@Value
public class MonteCarloPercentile {
    int year;
    int age;
    BigDecimal p5;
    BigDecimal p25;
    BigDecimal p50;
    BigDecimal p75;
    BigDecimal p95;
}
