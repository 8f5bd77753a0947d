package com.taxledger.config;

import com.taxledger.domain.model.SplitEvent;
import java.math.MathContext;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.format.annotation.DateTimeFormat;

/**
 * Configuration properties for the lot ledger engine.
 *
 * <p>Properties prefix: {@code taxledger.ledger.*}
 */
@Configuration
@ConfigurationProperties(prefix = "taxledger.ledger")
@Getter
@Setter
public class LedgerConfig {

    /** Decimal places for emitted monetary values (ledger rows, summaries, snapshots). */
    private int moneyScale = 4;

    /** Process independent (account, instrument) partitions on the ledger executor. */
    private boolean parallel = false;

    /** Close options whose expiry date has passed but which have no expiration record. */
    private boolean autoExpireOptions = true;

    /** Date used to decide whether an option has expired. Null = today. */
    @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
    private LocalDate asOfDate;

    /** Stock splits to apply to open lots. */
    private List<Split> splits = new ArrayList<>();

    /** Precision used for the running average; emitted values are rounded to {@link #moneyScale}. */
    public MathContext mathContext() {
        return MathContext.DECIMAL64;
    }

    public List<SplitEvent> splitEvents() {
        return splits.stream()
                .map(split -> SplitEvent.parse(split.getInstrumentId(), split.getEffectiveDate(), split.getRatio()))
                .toList();
    }

    @Getter
    @Setter
    public static class Split {

        /** Instrument code exactly as it appears in the transaction stream, e.g. "US.NVDA". */
        private String instrumentId;

        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
        private LocalDate effectiveDate;

        /** "N:M": N new shares for every M held. */
        private String ratio;
    }
}
