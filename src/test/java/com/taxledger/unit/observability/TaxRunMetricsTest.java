package com.taxledger.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;

import com.taxledger.domain.enums.AnomalyReason;
import com.taxledger.domain.model.AnomalyRecord;
import com.taxledger.domain.model.LedgerRow;
import com.taxledger.domain.model.LotKey;
import com.taxledger.domain.model.TaxRunResult;
import com.taxledger.event.TaxRunCompletedEvent;
import com.taxledger.event.TaxRunFailedEvent;
import com.taxledger.exception.DataOrderingException;
import com.taxledger.observability.TaxRunMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for TaxRunMetrics against a SimpleMeterRegistry, driven through the run lifecycle events. */
class TaxRunMetricsTest {

    private SimpleMeterRegistry meterRegistry;
    private TaxRunMetrics taxRunMetrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        taxRunMetrics = new TaxRunMetrics(meterRegistry);
    }

    private static AnomalyRecord anomaly(AnomalyReason reason) {
        return AnomalyRecord.builder().reason(reason).message(reason.name()).build();
    }

    @Test
    @DisplayName("Completed run counts rows, anomalies per reason and duration")
    void completedRun() {
        TaxRunResult result = TaxRunResult.builder()
                .runId("run-1")
                .ledgerRows(List.of(LedgerRow.builder().build(), LedgerRow.builder().build()))
                .anomalies(List.of(
                        anomaly(AnomalyReason.OVERSELL),
                        anomaly(AnomalyReason.OVERSELL),
                        anomaly(AnomalyReason.UNRECOGNIZED_INSTRUMENT_TYPE)))
                .build();

        taxRunMetrics.onRunCompleted(new TaxRunCompletedEvent(this, result, TimeUnit.MILLISECONDS.toNanos(40)));

        assertThat(meterRegistry.get("taxledger.runs.completed").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("taxledger.ledger.rows").counter().count()).isEqualTo(2.0);
        assertThat(meterRegistry.get("taxledger.anomalies").tag("reason", "OVERSELL").counter().count())
                .isEqualTo(2.0);
        assertThat(meterRegistry.get("taxledger.anomalies").tag("reason", "UNRECOGNIZED_INSTRUMENT_TYPE").counter().count())
                .isEqualTo(1.0);
        assertThat(meterRegistry.get("taxledger.run.duration").timer().count()).isEqualTo(1L);
        assertThat(meterRegistry.get("taxledger.run.duration").timer().totalTime(TimeUnit.MILLISECONDS))
                .isEqualTo(40.0);
    }

    @Test
    @DisplayName("Failed run only increments the failure counter")
    void failedRun() {
        taxRunMetrics.onRunFailed(new TaxRunFailedEvent(this, 12, new DataOrderingException(
                LotKey.of("ACC-1", "US.AAPL"),
                LocalDateTime.parse("2024-03-02T10:00:00"),
                LocalDateTime.parse("2024-03-01T10:00:00"),
                7)));

        assertThat(meterRegistry.get("taxledger.runs.failed").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("taxledger.runs.completed").counter().count()).isZero();
        assertThat(meterRegistry.find("taxledger.anomalies").counter()).isNull();
    }
}
