package com.vtrader.realtime.change;

import com.vtrader.domain.enums.OrderStatus;
import com.vtrader.entity.TradingAccountEntity;
import com.vtrader.event.ChangeAction;
import com.vtrader.event.RecordChangeEvent;
import com.vtrader.realtime.RealtimeEventBroadcaster;
import com.vtrader.realtime.RealtimeEventType;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Turns committed record writes into realtime events for the record's owner.
 *
 * <p>Mapping:
 * <ul>
 *   <li>order created: {@code order_placed}; status changed to EXECUTED: {@code order_executed}
 *       with the fill price; status changed to CANCELLED: {@code order_cancelled}</li>
 *   <li>position created: {@code position_opened}; updated to quantity 0:
 *       {@code position_closed} with realized P&amp;L; any other update: {@code position_updated}</li>
 *   <li>account updated with a balance or margin change: {@code balance_updated}</li>
 *   <li>watchlist updated: {@code watchlist_updated}</li>
 *   <li>watchlist item created or deleted: {@code watchlist_item_added} / {@code watchlist_item_removed}</li>
 * </ul>
 * Anything else is ignored. Accounts and watchlists carry their owner; orders, positions and
 * watchlist items are resolved through {@link OwnerResolver}. A write whose owner cannot be
 * resolved is dropped with a warning.
 *
 * <p>Runs after the transaction commits, so rolled-back writes are never announced, or
 * straight away when the write happened outside a transaction. Nothing thrown here reaches
 * the code that made the write.
 */
@Component
public class ChangeTranslator {

    private static final Logger log = LoggerFactory.getLogger(ChangeTranslator.class);

    private final RealtimeEventBroadcaster realtimeEventBroadcaster;
    private final OwnerResolver ownerResolver;

    public ChangeTranslator(RealtimeEventBroadcaster realtimeEventBroadcaster, OwnerResolver ownerResolver) {
        this.realtimeEventBroadcaster = realtimeEventBroadcaster;
        this.ownerResolver = ownerResolver;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onRecordChange(RecordChangeEvent event) {
        try {
            translate(event);
        } catch (RuntimeException e) {
            log.error("Failed to translate record change: {}", event, e);
        }
    }

    private void translate(RecordChangeEvent event) {
        switch (event.getRecordKind()) {
            case ORDER -> translateOrder(event);
            case POSITION -> translatePosition(event);
            case TRADING_ACCOUNT -> translateTradingAccount(event);
            case WATCHLIST -> translateWatchlist(event);
            case WATCHLIST_ITEM -> translateWatchlistItem(event);
        }
    }

    private void translateOrder(RecordChangeEvent event) {
        RealtimeEventType type;
        BigDecimal price;
        if (event.getAction() == ChangeAction.CREATED) {
            type = RealtimeEventType.ORDER_PLACED;
            price = decimal(event, "price");
        } else if (event.getAction() == ChangeAction.UPDATED && event.hasChanged("status")) {
            Object status = event.get("status");
            if (status == OrderStatus.EXECUTED) {
                type = RealtimeEventType.ORDER_EXECUTED;
                BigDecimal fill = decimal(event, "averagePrice");
                price = fill != null ? fill : decimal(event, "price");
            } else if (status == OrderStatus.CANCELLED) {
                type = RealtimeEventType.ORDER_CANCELLED;
                price = null;
            } else {
                return;
            }
        } else {
            return;
        }

        Optional<String> owner = ownerResolver.ownerOfTradingAccount(event.getString("tradingAccountId"));
        if (owner.isEmpty()) {
            dropped(event, type);
            return;
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("orderId", event.get("id"));
        payload.put("symbol", event.get("symbol"));
        payload.put("quantity", event.get("quantity"));
        payload.put("orderType", event.get("orderType"));
        payload.put("orderSide", event.get("orderSide"));
        payload.put("status", event.get("status"));
        payload.put("price", price);
        payload.put("tradingAccountId", event.get("tradingAccountId"));
        emit(owner.get(), type, payload);
    }

    private void translatePosition(RecordChangeEvent event) {
        RealtimeEventType type;
        if (event.getAction() == ChangeAction.CREATED) {
            type = RealtimeEventType.POSITION_OPENED;
        } else if (event.getAction() == ChangeAction.UPDATED) {
            type = isZero(event.get("quantity"))
                    ? RealtimeEventType.POSITION_CLOSED
                    : RealtimeEventType.POSITION_UPDATED;
        } else {
            return;
        }

        Optional<String> owner = ownerResolver.ownerOfTradingAccount(event.getString("tradingAccountId"));
        if (owner.isEmpty()) {
            dropped(event, type);
            return;
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("positionId", event.get("id"));
        payload.put("symbol", event.get("symbol"));
        payload.put("quantity", event.get("quantity"));
        payload.put("averagePrice", event.get("averagePrice"));
        payload.put("tradingAccountId", event.get("tradingAccountId"));
        if (type == RealtimeEventType.POSITION_CLOSED) {
            BigDecimal realized = decimal(event, "realizedPnl");
            payload.put("realizedPnl", realized != null ? realized : decimal(event, "unrealizedPnl"));
        }
        emit(owner.get(), type, payload);
    }

    private void translateTradingAccount(RecordChangeEvent event) {
        String accountId = event.getString("id");
        String userId = event.getString("userId");
        ownerResolver.rememberTradingAccount(accountId, userId);

        if (event.getAction() != ChangeAction.UPDATED) {
            return;
        }
        boolean balanceOrMarginChanged =
                TradingAccountEntity.BALANCE_FIELDS.stream().anyMatch(event::hasChanged);
        if (!balanceOrMarginChanged) {
            return;
        }
        if (userId == null) {
            dropped(event, RealtimeEventType.BALANCE_UPDATED);
            return;
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("tradingAccountId", accountId);
        payload.put("balance", event.get("balance"));
        payload.put("availableMargin", event.get("availableMargin"));
        payload.put("usedMargin", event.get("usedMargin"));
        Map<String, Object> previous = event.getPreviousState();
        if (previous != null) {
            payload.put("balanceChange", difference(event.get("balance"), previous.get("balance")));
            payload.put("marginChange", difference(event.get("availableMargin"), previous.get("availableMargin")));
        }
        emit(userId, RealtimeEventType.BALANCE_UPDATED, payload);
    }

    private void translateWatchlist(RecordChangeEvent event) {
        String watchlistId = event.getString("id");
        String userId = event.getString("userId");
        ownerResolver.rememberWatchlist(watchlistId, userId);

        if (event.getAction() != ChangeAction.UPDATED) {
            return;
        }
        if (userId == null) {
            dropped(event, RealtimeEventType.WATCHLIST_UPDATED);
            return;
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("watchlistId", watchlistId);
        payload.put("action", "item_updated");
        payload.put("userId", userId);
        emit(userId, RealtimeEventType.WATCHLIST_UPDATED, payload);
    }

    private void translateWatchlistItem(RecordChangeEvent event) {
        RealtimeEventType type;
        String action;
        if (event.getAction() == ChangeAction.CREATED) {
            type = RealtimeEventType.WATCHLIST_ITEM_ADDED;
            action = "item_added";
        } else if (event.getAction() == ChangeAction.DELETED) {
            type = RealtimeEventType.WATCHLIST_ITEM_REMOVED;
            action = "item_removed";
        } else {
            return;
        }

        String watchlistId = event.getString("watchlistId");
        Optional<String> owner = ownerResolver.ownerOfWatchlist(watchlistId);
        if (owner.isEmpty()) {
            dropped(event, type);
            return;
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("watchlistId", watchlistId);
        payload.put("action", action);
        payload.put("itemId", event.get("id"));
        payload.put("userId", owner.get());
        emit(owner.get(), type, payload);
    }

    private void emit(String userId, RealtimeEventType type, Map<String, Object> payload) {
        log.debug("Translated record change: eventType={}, userId={}", type.getWireName(), userId);
        realtimeEventBroadcaster.emit(userId, type, payload);
    }

    private void dropped(RecordChangeEvent event, RealtimeEventType type) {
        log.warn("Owner not resolved, dropping realtime event: eventType={}, change={}", type.getWireName(), event);
    }

    private static BigDecimal decimal(RecordChangeEvent event, String field) {
        Object value = event.get(field);
        return value instanceof BigDecimal decimal ? decimal : null;
    }

    private static boolean isZero(Object quantity) {
        return quantity instanceof Number number && number.longValue() == 0;
    }

    private static BigDecimal difference(Object current, Object previous) {
        if (current instanceof BigDecimal now && previous instanceof BigDecimal before) {
            return now.subtract(before);
        }
        return null;
    }
}
