package com.gillianbc.retirement.model;

import lombok.Value;

/**
 * Outcome of looking up a jurisdiction code in a {@link TaxRates} table.
 * {@code fallback} is set when the requested code was not present and the table's default
 * jurisdiction was used instead.
 */
@Value
public class JurisdictionResolution {
    String requested;
    String resolved;
    boolean fallback;
}
