package com.taxledger.event;

import com.taxledger.domain.model.TaxRunResult;
import org.springframework.context.ApplicationEvent;

/**
 * Published after a tax run has produced its ledger, summaries and anomaly list.
 */
public class TaxRunCompletedEvent extends ApplicationEvent {

    private final TaxRunResult result;
    private final long elapsedNanos;

    public TaxRunCompletedEvent(Object source, TaxRunResult result, long elapsedNanos) {
        super(source);
        this.result = result;
        this.elapsedNanos = elapsedNanos;
    }

    public TaxRunResult getResult() {
        return result;
    }

    public long getElapsedNanos() {
        return elapsedNanos;
    }
}
