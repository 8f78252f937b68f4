package com.gillianbc.retirement.config;

import com.gillianbc.retirement.model.TaxRates;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@EnableConfigurationProperties(RetirementProperties.class)
public class EngineConfiguration {

    /**
     * The current-year tax table with the configured fallback jurisdiction applied.
     */
    @Bean
    public TaxRates taxRates(RetirementProperties properties) {
        String defaultJurisdiction = properties.getTax().getDefaultJurisdiction();
        TaxRates rates = TaxRates.CANADA_2025.toBuilder()
                .defaultJurisdiction(defaultJurisdiction)
                .build();
        if (!rates.getRegionalBrackets().containsKey(defaultJurisdiction)) {
            throw new IllegalStateException("retirement.tax.default-jurisdiction '" + defaultJurisdiction
                    + "' is not in tax table " + rates.getVersion());
        }
        log.info("Using tax table {} with default jurisdiction {}", rates.getVersion(), defaultJurisdiction);
        return rates;
    }
}
