package com.vtrader.entity;

import com.vtrader.event.RecordKind;
import com.vtrader.realtime.change.RealtimeEntityListener;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.Transient;
import java.util.Map;
import java.util.Set;

/**
 * Base class of every record whose writes are translated into realtime events.
 *
 * <p>{@link RealtimeEntityListener} keeps {@code loadedState}, the snapshot of the record as
 * last read from or written to the database, so an update can tell which tracked fields
 * actually changed. The snapshot is transient and never persisted.
 */
@MappedSuperclass
@EntityListeners(RealtimeEntityListener.class)
public abstract class TrackedEntity {

    @Transient
    private Map<String, Object> loadedState;

    public abstract RecordKind recordKind();

    /** Field values of this record that realtime payloads are built from, keyed by field name. */
    public abstract Map<String, Object> snapshot();

    /** Fields whose change makes an update worth announcing. */
    public abstract Set<String> trackedFields();

    /** State as of the last load or write, or null if this instance was never loaded. */
    public Map<String, Object> getLoadedState() {
        return loadedState;
    }

    public void markLoaded() {
        this.loadedState = snapshot();
    }
}
