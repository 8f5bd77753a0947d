package com.taxledger.event;

import com.taxledger.domain.model.TaxRunResult;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Thin wrapper around Spring's {@link ApplicationEventPublisher} with typed methods for
 * tax run lifecycle events. Listeners are synchronous {@code @EventListener}s.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    public void publishRunCompleted(Object source, TaxRunResult result, long elapsedNanos) {
        applicationEventPublisher.publishEvent(new TaxRunCompletedEvent(source, result, elapsedNanos));
    }

    public void publishRunFailed(Object source, int transactionCount, Throwable cause) {
        applicationEventPublisher.publishEvent(new TaxRunFailedEvent(source, transactionCount, cause));
    }
}
