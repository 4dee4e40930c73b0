package com.vtrader.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.vtrader.config.RealtimeConfig;
import com.vtrader.domain.enums.OrderSide;
import com.vtrader.domain.enums.OrderStatus;
import com.vtrader.domain.enums.OrderType;
import com.vtrader.entity.OrderEntity;
import com.vtrader.entity.TradingAccountEntity;
import com.vtrader.entity.WatchlistItemEntity;
import com.vtrader.event.EventPublisherHelper;
import com.vtrader.event.RecordChangeEvent;
import com.vtrader.realtime.RealtimeEventBroadcaster;
import com.vtrader.realtime.change.ChangeTranslator;
import com.vtrader.realtime.change.OwnerResolver;
import com.vtrader.realtime.change.RealtimeEntityListener;
import com.vtrader.repository.jpa.TradingAccountJpaRepository;
import com.vtrader.repository.jpa.WatchlistJpaRepository;
import com.vtrader.support.MutableClock;
import com.vtrader.support.RecordingConnection;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

/**
 * Write path end to end: entity lifecycle callbacks through the change translator to the
 * user's push connections. Only the owner lookups are mocked; the listener is driven the
 * way Hibernate drives it.
 */
@ExtendWith(MockitoExtension.class)
class OrderRealtimeFlowIntegrationTest {

    private static final Instant NOW = Instant.parse("2026-01-05T04:10:00Z");

    @Mock
    private TradingAccountJpaRepository tradingAccountJpaRepository;

    @Mock
    private WatchlistJpaRepository watchlistJpaRepository;

    private final ObjectMapper objectMapper = JsonMapper.builder().build();
    private RealtimeEventBroadcaster broadcaster;
    private RealtimeEntityListener entityListener;
    private RecordingConnection ownerConnection;
    private RecordingConnection otherUserConnection;

    @BeforeEach
    void setUp() {
        RealtimeConfig realtimeConfig = new RealtimeConfig();
        realtimeConfig.setHeartbeatEnabled(false);
        broadcaster = new RealtimeEventBroadcaster(realtimeConfig, objectMapper, null, new MutableClock(NOW));

        OwnerResolver ownerResolver = new OwnerResolver(tradingAccountJpaRepository, watchlistJpaRepository);
        ChangeTranslator changeTranslator = new ChangeTranslator(broadcaster, ownerResolver);
        EventPublisherHelper eventPublisherHelper = new EventPublisherHelper(event -> {
            if (event instanceof RecordChangeEvent change) {
                changeTranslator.onRecordChange(change);
            }
        });
        entityListener = new RealtimeEntityListener(eventPublisherHelper);

        ownerConnection = new RecordingConnection("conn-owner");
        otherUserConnection = new RecordingConnection("conn-other");
        broadcaster.subscribe("user-1", ownerConnection);
        broadcaster.subscribe("user-2", otherUserConnection);
    }

    @Test
    @DisplayName("A placed order that later fills reaches only its owner as order_placed then order_executed")
    void placedThenExecutedOrderReachesOwner() {
        when(tradingAccountJpaRepository.findUserIdById("acc-1")).thenReturn(Optional.of("user-1"));
        OrderEntity order = OrderEntity.builder()
                .id("ord-1")
                .tradingAccountId("acc-1")
                .symbol("NSE_EQ-22")
                .quantity(10)
                .orderSide(OrderSide.BUY)
                .orderType(OrderType.LIMIT)
                .price(new BigDecimal("2450.00"))
                .status(OrderStatus.PENDING)
                .build();

        entityListener.onPersist(order);

        order.setStatus(OrderStatus.EXECUTED);
        order.setAveragePrice(new BigDecimal("2449.50"));
        entityListener.onUpdate(order);

        List<Map<String, Object>> messages = messagesOf(ownerConnection);
        assertThat(messages)
                .extracting(message -> message.get("eventType"))
                .containsExactly("connected", "order_placed", "order_executed");

        Map<String, Object> executed = payloadOf(messages.get(2));
        assertThat(executed.get("orderId")).isEqualTo("ord-1");
        assertThat(executed.get("status")).isEqualTo("EXECUTED");
        assertThat(((Number) executed.get("price")).doubleValue()).isEqualTo(2449.5);
        assertThat(otherUserConnection.getFrames()).hasSize(1);

        // Owner resolved once, then served from cache.
        verify(tradingAccountJpaRepository, times(1)).findUserIdById("acc-1");
    }

    @Test
    @DisplayName("An order update that leaves status unchanged is not pushed")
    void unchangedStatusIsNotPushed() {
        when(tradingAccountJpaRepository.findUserIdById("acc-1")).thenReturn(Optional.of("user-1"));
        OrderEntity order = OrderEntity.builder()
                .id("ord-2")
                .tradingAccountId("acc-1")
                .symbol("NSE_EQ-2885")
                .quantity(5)
                .orderSide(OrderSide.SELL)
                .orderType(OrderType.LIMIT)
                .price(new BigDecimal("1520.00"))
                .status(OrderStatus.PENDING)
                .build();
        entityListener.onPersist(order);

        order.setPrice(new BigDecimal("1521.00"));
        entityListener.onUpdate(order);

        assertThat(messagesOf(ownerConnection))
                .extracting(message -> message.get("eventType"))
                .containsExactly("connected", "order_placed");
    }

    @Test
    @DisplayName("A balance write primes the owner cache for the account's later order events")
    void balanceWritePrimesOwnerForOrders() {
        TradingAccountEntity account = TradingAccountEntity.builder()
                .id("acc-9")
                .userId("user-1")
                .balance(new BigDecimal("100000.00"))
                .availableMargin(new BigDecimal("80000.00"))
                .usedMargin(new BigDecimal("20000.00"))
                .build();
        entityListener.onLoad(account);
        account.setBalance(new BigDecimal("99500.00"));
        entityListener.onUpdate(account);

        OrderEntity order = OrderEntity.builder()
                .id("ord-3")
                .tradingAccountId("acc-9")
                .symbol("NSE_EQ-22")
                .quantity(1)
                .orderSide(OrderSide.BUY)
                .orderType(OrderType.MARKET)
                .status(OrderStatus.PENDING)
                .build();
        entityListener.onPersist(order);

        assertThat(messagesOf(ownerConnection))
                .extracting(message -> message.get("eventType"))
                .containsExactly("connected", "balance_updated", "order_placed");
        assertThat(((Number) payloadOf(messagesOf(ownerConnection).get(1)).get("balanceChange")).doubleValue())
                .isEqualTo(-500.0);
        verify(tradingAccountJpaRepository, times(0)).findUserIdById("acc-9");
    }

    @Test
    @DisplayName("A watchlist item insert is routed to the watchlist's owner")
    void watchlistItemRoutedToOwner() {
        when(watchlistJpaRepository.findUserIdById("wl-1")).thenReturn(Optional.of("user-2"));
        WatchlistItemEntity item = WatchlistItemEntity.builder()
                .id("item-1")
                .watchlistId("wl-1")
                .symbol("NSE_EQ-22")
                .sortOrder(0)
                .build();

        entityListener.onPersist(item);

        assertThat(ownerConnection.getFrames()).hasSize(1);
        Map<String, Object> added = messagesOf(otherUserConnection).get(1);
        assertThat(added.get("eventType")).isEqualTo("watchlist_item_added");
        assertThat(payloadOf(added)).containsEntry("watchlistId", "wl-1").containsEntry("itemId", "item-1");
    }

    @SuppressWarnings("unchecked")
    private List<Map<String, Object>> messagesOf(RecordingConnection connection) {
        return connection.getFrames().stream()
                .map(frame -> (Map<String, Object>)
                        objectMapper.readValue(frame.substring("data: ".length()).trim(), Map.class))
                .collect(Collectors.toList());
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> payloadOf(Map<String, Object> message) {
        return (Map<String, Object>) message.get("payload");
    }
}
