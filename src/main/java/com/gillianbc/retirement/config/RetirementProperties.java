package com.gillianbc.retirement.config;

import com.gillianbc.retirement.model.DeferredSplitPolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Engine settings bound from {@code retirement.*}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "retirement")
public class RetirementProperties {

    private Tax tax = new Tax();
    private Projection projection = new Projection();
    private MonteCarlo monteCarlo = new MonteCarlo();

    @Getter
    @Setter
    public static class Tax {
        /** Jurisdiction used when a requested code is missing from the tax table. */
        private String defaultJurisdiction = "ON";
    }

    @Getter
    @Setter
    public static class Projection {
        /** Upper bound on projected years; longer horizons are rejected. */
        private int maxYears = 120;
        private DeferredSplitPolicy deferredSplit = DeferredSplitPolicy.BALANCE_WEIGHTED;
    }

    @Getter
    @Setter
    public static class MonteCarlo {
        private int iterations = 200;
        /** Fixed master seed; unset means a fresh seed per call. */
        private Long seed;
        /** Final-year assets above this count as a successful run. */
        private BigDecimal successThreshold = new BigDecimal("1000");
        private boolean parallel = false;
    }
}
