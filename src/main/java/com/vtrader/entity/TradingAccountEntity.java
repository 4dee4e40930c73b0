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
 * JPA entity for the trading_accounts table. Owned directly by a user; orders and positions
 * reach their owner through this record.
 */
@Entity
@Table(name = "trading_accounts")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TradingAccountEntity extends TrackedEntity {

    public static final Set<String> BALANCE_FIELDS = Set.of("balance", "availableMargin", "usedMargin");

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "user_id", length = 36, nullable = false)
    private String userId;

    @Column(precision = 15, scale = 2)
    private BigDecimal balance;

    @Column(name = "available_margin", precision = 15, scale = 2)
    private BigDecimal availableMargin;

    @Column(name = "used_margin", precision = 15, scale = 2)
    private BigDecimal usedMargin;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Override
    public RecordKind recordKind() {
        return RecordKind.TRADING_ACCOUNT;
    }

    @Override
    public Map<String, Object> snapshot() {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("id", id);
        state.put("userId", userId);
        state.put("balance", balance);
        state.put("availableMargin", availableMargin);
        state.put("usedMargin", usedMargin);
        return state;
    }

    @Override
    public Set<String> trackedFields() {
        return BALANCE_FIELDS;
    }
}
