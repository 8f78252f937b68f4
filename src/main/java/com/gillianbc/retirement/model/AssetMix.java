package com.gillianbc.retirement.model;

import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Share of an open account held for interest, dividends and capital growth. The three
 * fractions are expected to sum to roughly 1.0.
 */
@Value
public class AssetMix {

    public static final AssetMix ALL_GROWTH = new AssetMix(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ONE);

    @NonNull BigDecimal interest;
    @NonNull BigDecimal dividend;
    @NonNull BigDecimal capitalGain;

    public static AssetMix of(String interest, String dividend, String capitalGain) {
        return new AssetMix(new BigDecimal(interest), new BigDecimal(dividend), new BigDecimal(capitalGain));
    }
}
