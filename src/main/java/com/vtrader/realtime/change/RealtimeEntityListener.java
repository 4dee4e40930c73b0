package com.vtrader.realtime.change;

import com.vtrader.entity.TrackedEntity;
import com.vtrader.event.ChangeAction;
import com.vtrader.event.EventPublisherHelper;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.PostRemove;
import jakarta.persistence.PostUpdate;
import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * JPA entity listener on every {@link TrackedEntity}.
 *
 * <p>Snapshots the record on load, and on every write publishes a
 * {@link com.vtrader.event.RecordChangeEvent} with the changed tracked fields. It never
 * throws: a failure here is logged and the write it observes goes on untouched.
 *
 * <p>Hibernate obtains this listener from the Spring context, so it is an ordinary bean.
 */
@Component
public class RealtimeEntityListener {

    private static final Logger log = LoggerFactory.getLogger(RealtimeEntityListener.class);

    private final EventPublisherHelper eventPublisherHelper;

    public RealtimeEntityListener(EventPublisherHelper eventPublisherHelper) {
        this.eventPublisherHelper = eventPublisherHelper;
    }

    @PostLoad
    public void onLoad(Object entity) {
        if (entity instanceof TrackedEntity tracked) {
            tracked.markLoaded();
        }
    }

    @PostPersist
    public void onPersist(Object entity) {
        record(entity, ChangeAction.CREATED);
    }

    @PostUpdate
    public void onUpdate(Object entity) {
        record(entity, ChangeAction.UPDATED);
    }

    @PostRemove
    public void onRemove(Object entity) {
        record(entity, ChangeAction.DELETED);
    }

    /** Tracked fields that differ between the two states. Every tracked field if {@code previous} is unknown. */
    public static Set<String> changedFields(
            Set<String> trackedFields, Map<String, Object> previous, Map<String, Object> current) {
        if (previous == null) {
            return trackedFields;
        }
        Set<String> changed = new LinkedHashSet<>();
        for (String field : trackedFields) {
            if (!sameValue(previous.get(field), current.get(field))) {
                changed.add(field);
            }
        }
        return changed;
    }

    private void record(Object entity, ChangeAction action) {
        if (!(entity instanceof TrackedEntity tracked)) {
            return;
        }
        try {
            Map<String, Object> current = tracked.snapshot();
            Map<String, Object> previous = tracked.getLoadedState();
            Set<String> changed = action == ChangeAction.UPDATED
                    ? changedFields(tracked.trackedFields(), previous, current)
                    : tracked.trackedFields();
            tracked.markLoaded();

            eventPublisherHelper.publishRecordChange(this, tracked.recordKind(), action, current, previous, changed);
        } catch (RuntimeException e) {
            log.error(
                    "Failed to record change, write continues without realtime event: kind={}, action={}",
                    tracked.recordKind(),
                    action,
                    e);
        }
    }

    // 100.0 and 100.00 are the same amount.
    private static boolean sameValue(Object a, Object b) {
        if (a instanceof BigDecimal left && b instanceof BigDecimal right) {
            return left.compareTo(right) == 0;
        }
        return Objects.equals(a, b);
    }
}
