package com.vtrader.entity;

import com.vtrader.event.RecordKind;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
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
 * JPA entity for the positions table. A position with quantity 0 is closed.
 */
@Entity
@Table(name = "positions")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PositionEntity extends TrackedEntity {

    private static final Set<String> TRACKED =
            Set.of("quantity", "averagePrice", "realizedPnl", "unrealizedPnl");

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "trading_account_id", length = 36, nullable = false)
    private String tradingAccountId;

    @Column(length = 50)
    private String symbol;

    private int quantity;

    @Column(name = "average_price", precision = 15, scale = 2)
    private BigDecimal averagePrice;

    @Column(name = "realized_pnl", precision = 15, scale = 2)
    private BigDecimal realizedPnl;

    @Column(name = "unrealized_pnl", precision = 15, scale = 2)
    private BigDecimal unrealizedPnl;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Override
    public RecordKind recordKind() {
        return RecordKind.POSITION;
    }

    @Override
    public Map<String, Object> snapshot() {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("id", id);
        state.put("tradingAccountId", tradingAccountId);
        state.put("symbol", symbol);
        state.put("quantity", quantity);
        state.put("averagePrice", averagePrice);
        state.put("realizedPnl", realizedPnl);
        state.put("unrealizedPnl", unrealizedPnl);
        return state;
    }

    @Override
    public Set<String> trackedFields() {
        return TRACKED;
    }
}
