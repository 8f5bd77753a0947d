package com.taxledger.observability;

import com.taxledger.domain.model.AnomalyRecord;
import com.taxledger.domain.model.TaxRunResult;
import com.taxledger.event.TaxRunCompletedEvent;
import com.taxledger.event.TaxRunFailedEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for tax runs:
 * <ul>
 *   <li><b>taxledger.runs.completed</b> (counter)</li>
 *   <li><b>taxledger.runs.failed</b> (counter)</li>
 *   <li><b>taxledger.ledger.rows</b> (counter): disposals emitted, synthetic expirations included</li>
 *   <li><b>taxledger.anomalies</b> (counter, tagged by reason)</li>
 *   <li><b>taxledger.run.duration</b> (timer)</li>
 * </ul>
 */
@Service
public class TaxRunMetrics {

    private static final Logger log = LoggerFactory.getLogger(TaxRunMetrics.class);

    private final MeterRegistry meterRegistry;
    private final Counter runsCompletedCounter;
    private final Counter runsFailedCounter;
    private final Counter ledgerRowsCounter;
    private final Timer runDurationTimer;

    public TaxRunMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.runsCompletedCounter = Counter.builder("taxledger.runs.completed")
                .description("Tax runs that produced a ledger")
                .register(meterRegistry);
        this.runsFailedCounter = Counter.builder("taxledger.runs.failed")
                .description("Tax runs aborted before producing a ledger")
                .register(meterRegistry);
        this.ledgerRowsCounter = Counter.builder("taxledger.ledger.rows")
                .description("Disposal rows emitted across all runs")
                .register(meterRegistry);
        this.runDurationTimer = Timer.builder("taxledger.run.duration")
                .description("Wall time of a tax run from input to merged ledger")
                .publishPercentiles(0.5, 0.95)
                .register(meterRegistry);
    }

    @EventListener
    public void onRunCompleted(TaxRunCompletedEvent event) {
        TaxRunResult result = event.getResult();
        runsCompletedCounter.increment();
        ledgerRowsCounter.increment(result.getLedgerRows().size());
        runDurationTimer.record(event.getElapsedNanos(), TimeUnit.NANOSECONDS);
        for (AnomalyRecord anomaly : result.getAnomalies()) {
            meterRegistry
                    .counter("taxledger.anomalies", "reason", anomaly.getReason().name())
                    .increment();
        }
    }

    @EventListener
    public void onRunFailed(TaxRunFailedEvent event) {
        runsFailedCounter.increment();
        log.warn(
                "Tax run over {} transactions failed: {}",
                event.getTransactionCount(),
                event.getCause().getMessage());
    }
}
