package com.vtrader.event;

import java.util.Map;
import java.util.Set;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Thin wrapper around Spring's {@link ApplicationEventPublisher} with typed factory methods,
 * so call sites read {@code eventPublisherHelper.publishRecordChange(...)}.
 *
 * <p>Delivery timing depends on the listener: {@code @TransactionalEventListener} methods
 * run once the surrounding transaction commits.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    public void publishRecordChange(
            Object source,
            RecordKind recordKind,
            ChangeAction action,
            Map<String, Object> state,
            Map<String, Object> previousState,
            Set<String> changedFields) {
        applicationEventPublisher.publishEvent(
                new RecordChangeEvent(source, recordKind, action, state, previousState, changedFields));
    }
}
