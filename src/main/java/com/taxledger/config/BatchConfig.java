package com.taxledger.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Startup batch run: read broker exports from disk and write the report folder.
 *
 * <p>Properties prefix: {@code taxledger.batch.*}
 */
@Configuration
@ConfigurationProperties(prefix = "taxledger.batch")
@Getter
@Setter
public class BatchConfig {

    private boolean enabled = false;

    /** Trade history exports. All must exist. */
    private List<String> inputFiles = new ArrayList<>();

    /** Extra exports merged in when present, e.g. an RSU vesting history. */
    private List<String> optionalInputFiles = new ArrayList<>();

    private String outputDir = "reports";
}
