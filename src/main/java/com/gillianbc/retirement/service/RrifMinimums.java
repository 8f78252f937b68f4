package com.gillianbc.retirement.service;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Federal RRIF minimum withdrawal factors (post-2015 schedule).
 */
final class RrifMinimums {

    static final int FIRST_TABLE_AGE = 71;
    static final int LAST_TABLE_AGE = 94;
    static final BigDecimal BELOW_TABLE_FACTOR = new BigDecimal("0.05");
    static final BigDecimal ABOVE_TABLE_FACTOR = new BigDecimal("0.20");

    private static final Map<Integer, BigDecimal> FACTORS = Map.ofEntries(
            Map.entry(71, new BigDecimal("0.0528")), Map.entry(72, new BigDecimal("0.0540")),
            Map.entry(73, new BigDecimal("0.0553")), Map.entry(74, new BigDecimal("0.0567")),
            Map.entry(75, new BigDecimal("0.0582")), Map.entry(76, new BigDecimal("0.0598")),
            Map.entry(77, new BigDecimal("0.0617")), Map.entry(78, new BigDecimal("0.0636")),
            Map.entry(79, new BigDecimal("0.0658")), Map.entry(80, new BigDecimal("0.0682")),
            Map.entry(81, new BigDecimal("0.0708")), Map.entry(82, new BigDecimal("0.0738")),
            Map.entry(83, new BigDecimal("0.0771")), Map.entry(84, new BigDecimal("0.0808")),
            Map.entry(85, new BigDecimal("0.0851")), Map.entry(86, new BigDecimal("0.0899")),
            Map.entry(87, new BigDecimal("0.0955")), Map.entry(88, new BigDecimal("0.1021")),
            Map.entry(89, new BigDecimal("0.1099")), Map.entry(90, new BigDecimal("0.1192")),
            Map.entry(91, new BigDecimal("0.1306")), Map.entry(92, new BigDecimal("0.1449")),
            Map.entry(93, new BigDecimal("0.1634")), Map.entry(94, new BigDecimal("0.1879")));

    private RrifMinimums() {
    }

    static BigDecimal factor(int age) {
        if (age < FIRST_TABLE_AGE) {
            return BELOW_TABLE_FACTOR;
        }
        if (age > LAST_TABLE_AGE) {
            return ABOVE_TABLE_FACTOR;
        }
        return FACTORS.get(age);
    }
}
