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

/**
 * JPA entity for the watchlist_items table. The owner is found through {@code watchlistId}.
 */
@Entity
@Table(name = "watchlist_items")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WatchlistItemEntity extends TrackedEntity {

    private static final Set<String> TRACKED = Set.of("symbol", "sortOrder");

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "watchlist_id", length = 36, nullable = false)
    private String watchlistId;

    @Column(length = 50)
    private String symbol;

    @Column(length = 10)
    private String exchange;

    @Column(name = "instrument_token")
    private Long instrumentToken;

    @Column(name = "sort_order")
    private int sortOrder;

    @Column(name = "added_at")
    private LocalDateTime addedAt;

    @Override
    public RecordKind recordKind() {
        return RecordKind.WATCHLIST_ITEM;
    }

    @Override
    public Map<String, Object> snapshot() {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("id", id);
        state.put("watchlistId", watchlistId);
        state.put("symbol", symbol);
        state.put("sortOrder", sortOrder);
        return state;
    }

    @Override
    public Set<String> trackedFields() {
        return TRACKED;
    }
}
