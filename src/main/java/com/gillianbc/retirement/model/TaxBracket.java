package com.gillianbc.retirement.model;

import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One step of a progressive schedule: {@code rate} applies to income between this threshold
 * and the next bracket's threshold (or without limit for the last bracket).
 */
@Value
public class TaxBracket {

    @NonNull BigDecimal threshold;
    @NonNull BigDecimal rate;

    public static TaxBracket of(long threshold, String rate) {
        return new TaxBracket(BigDecimal.valueOf(threshold), new BigDecimal(rate));
    }
}
