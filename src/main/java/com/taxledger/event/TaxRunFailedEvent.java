package com.taxledger.event;

import org.springframework.context.ApplicationEvent;

/**
 * Published when a tax run aborts, typically on out-of-order input for a lot.
 */
public class TaxRunFailedEvent extends ApplicationEvent {

    private final int transactionCount;
    private final Throwable cause;

    public TaxRunFailedEvent(Object source, int transactionCount, Throwable cause) {
        super(source);
        this.transactionCount = transactionCount;
        this.cause = cause;
    }

    public int getTransactionCount() {
        return transactionCount;
    }

    public Throwable getCause() {
        return cause;
    }
}
