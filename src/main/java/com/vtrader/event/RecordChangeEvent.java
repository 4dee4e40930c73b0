package com.vtrader.event;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import org.springframework.context.ApplicationEvent;

/**
 * Published when a monitored record was created, updated or deleted.
 *
 * <p>Carries copies of the record state, so listeners that run after the transaction
 * committed see the values as written, whatever happens to the entity afterwards.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>ChangeTranslator: turns the write into a realtime event for the record's owner</li>
 * </ul>
 */
public class RecordChangeEvent extends ApplicationEvent {

    private final RecordKind recordKind;
    private final ChangeAction action;
    private final Map<String, Object> state;
    private final Map<String, Object> previousState;
    private final Set<String> changedFields;

    /**
     * @param source        the component publishing this event
     * @param recordKind    which table the write hit
     * @param action        create, update or delete
     * @param state         record state after the write (before it, for deletes)
     * @param previousState state as last loaded, or null when unknown
     * @param changedFields tracked fields that differ from {@code previousState}; every
     *                      tracked field when the previous state is unknown
     */
    public RecordChangeEvent(
            Object source,
            RecordKind recordKind,
            ChangeAction action,
            Map<String, Object> state,
            Map<String, Object> previousState,
            Set<String> changedFields) {
        super(source);
        this.recordKind = recordKind;
        this.action = action;
        this.state = Collections.unmodifiableMap(state);
        this.previousState = previousState != null ? Collections.unmodifiableMap(previousState) : null;
        this.changedFields = Set.copyOf(changedFields);
    }

    public RecordKind getRecordKind() {
        return recordKind;
    }

    public ChangeAction getAction() {
        return action;
    }

    public Map<String, Object> getState() {
        return state;
    }

    public Map<String, Object> getPreviousState() {
        return previousState;
    }

    public Set<String> getChangedFields() {
        return changedFields;
    }

    public boolean hasChanged(String field) {
        return changedFields.contains(field);
    }

    public Object get(String field) {
        return state.get(field);
    }

    public String getString(String field) {
        Object value = state.get(field);
        return value != null ? value.toString() : null;
    }

    @Override
    public String toString() {
        return "RecordChangeEvent{kind=" + recordKind + ", action=" + action + ", id=" + state.get("id")
                + ", changed=" + changedFields + "}";
    }
}
