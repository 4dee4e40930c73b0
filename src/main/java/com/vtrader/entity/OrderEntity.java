package com.vtrader.entity;

import com.vtrader.domain.enums.OrderSide;
import com.vtrader.domain.enums.OrderStatus;
import com.vtrader.domain.enums.OrderType;
import com.vtrader.event.RecordKind;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
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
 * JPA entity for the orders table. The owner is found through {@code tradingAccountId}.
 */
@Entity
@Table(name = "orders")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderEntity extends TrackedEntity {

    private static final Set<String> TRACKED = Set.of("status", "quantity", "price", "averagePrice");

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "trading_account_id", length = 36, nullable = false)
    private String tradingAccountId;

    @Column(name = "broker_order_id", length = 100)
    private String brokerOrderId;

    @Column(length = 50)
    private String symbol;

    @Column(length = 10)
    private String exchange;

    @Column(name = "instrument_token")
    private Long instrumentToken;

    @Enumerated(EnumType.STRING)
    @Column(name = "order_side", columnDefinition = "varchar(10)")
    private OrderSide orderSide;

    @Enumerated(EnumType.STRING)
    @Column(name = "order_type", columnDefinition = "varchar(10)")
    private OrderType orderType;

    private int quantity;

    @Column(precision = 15, scale = 2)
    private BigDecimal price;

    @Column(name = "average_price", precision = 15, scale = 2)
    private BigDecimal averagePrice;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(20)")
    private OrderStatus status;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Override
    public RecordKind recordKind() {
        return RecordKind.ORDER;
    }

    @Override
    public Map<String, Object> snapshot() {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("id", id);
        state.put("tradingAccountId", tradingAccountId);
        state.put("symbol", symbol);
        state.put("quantity", quantity);
        state.put("orderType", orderType);
        state.put("orderSide", orderSide);
        state.put("status", status);
        state.put("price", price);
        state.put("averagePrice", averagePrice);
        return state;
    }

    @Override
    public Set<String> trackedFields() {
        return TRACKED;
    }
}
