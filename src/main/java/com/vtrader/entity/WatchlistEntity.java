package com.vtrader.entity;

import com.vtrader.event.RecordKind;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** JPA entity for the watchlists table. */
@Entity
@Table(name = "watchlists")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WatchlistEntity extends TrackedEntity {

    private static final Set<String> TRACKED = Set.of("name");

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "user_id", length = 36, nullable = false)
    private String userId;

    @Column(length = 100)
    private String name;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Override
    public RecordKind recordKind() {
        return RecordKind.WATCHLIST;
    }

    @Override
    public Map<String, Object> snapshot() {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("id", id);
        state.put("userId", userId);
        state.put("name", name);
        return state;
    }

    @Override
    public Set<String> trackedFields() {
        return TRACKED;
    }
}
