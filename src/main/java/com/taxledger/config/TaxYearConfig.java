package com.taxledger.config;

import com.taxledger.reporting.TaxYearPolicy;
import java.time.Month;
import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Tax year boundaries. Defaults to the calendar year; set {@code start-month: 4} for an
 * April-to-March year, labelled "2024-25".
 *
 * <p>Properties prefix: {@code taxledger.tax-year.*}
 */
@Configuration
@ConfigurationProperties(prefix = "taxledger.tax-year")
@Getter
@Setter
public class TaxYearConfig {

    private static final Logger log = LoggerFactory.getLogger(TaxYearConfig.class);

    /** First month of the tax year, 1-12. */
    private int startMonth = 1;

    @Bean
    public TaxYearPolicy taxYearPolicy() {
        TaxYearPolicy policy = new TaxYearPolicy(Month.of(startMonth));
        log.info("Tax year starts in {}", policy.getStartMonth());
        return policy;
    }
}
