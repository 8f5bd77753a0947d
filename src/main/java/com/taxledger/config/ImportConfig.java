package com.taxledger.config;

import com.taxledger.domain.enums.TransactionAction;
import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Settings for normalizing broker CSV exports into transaction records.
 *
 * <p>Properties prefix: {@code taxledger.import.*}
 */
@Configuration
@ConfigurationProperties(prefix = "taxledger.import")
@Getter
@Setter
public class ImportConfig {

    /** Shares per option contract. Option prices in the export are per share. */
    private BigDecimal optionContractMultiplier = new BigDecimal("100");

    /** Account used when the export has no account column. */
    private String defaultAccountId = "default";

    /**
     * Raw direction strings accepted for each action, matched case-insensitively.
     * Entries here replace the built-in list for that action.
     */
    private Map<TransactionAction, List<String>> directionMapping = new EnumMap<>(TransactionAction.class);
}
