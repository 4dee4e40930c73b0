package com.vtrader.unit.realtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.vtrader.config.RealtimeConfig;
import com.vtrader.realtime.RealtimeEventBroadcaster;
import com.vtrader.realtime.RealtimeEventType;
import com.vtrader.realtime.SseFrames;
import com.vtrader.support.MutableClock;
import com.vtrader.support.RecordingConnection;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

/**
 * Unit tests for RealtimeEventBroadcaster covering registration, fan-out, dead-connection
 * pruning, the heartbeat and lifecycle.
 */
@ExtendWith(MockitoExtension.class)
class RealtimeEventBroadcasterTest {

    private static final Instant NOW = Instant.parse("2026-01-05T03:45:00Z");

    @Mock
    private ScheduledExecutorService heartbeatScheduler;

    @Mock
    private ScheduledFuture<?> heartbeatFuture;

    private final ObjectMapper objectMapper = JsonMapper.builder().build();
    private RealtimeConfig realtimeConfig;
    private RealtimeEventBroadcaster broadcaster;

    @BeforeEach
    void setUp() {
        realtimeConfig = new RealtimeConfig();
        broadcaster =
                new RealtimeEventBroadcaster(realtimeConfig, objectMapper, heartbeatScheduler, new MutableClock(NOW));
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> parse(String frame) {
        assertThat(frame).startsWith("data: ").endsWith("\n\n");
        return objectMapper.readValue(frame.substring("data: ".length()).trim(), Map.class);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> payloadOf(Map<String, Object> message) {
        return (Map<String, Object>) message.get("payload");
    }

    private Map<String, Object> orderPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("orderId", "ord-1");
        payload.put("symbol", "NSE_EQ-22");
        payload.put("quantity", 10);
        return payload;
    }

    @Nested
    @DisplayName("Subscribe")
    class Subscribe {

        @Test
        @DisplayName("New connection receives a connected message carrying its userId")
        void connectedMessage() {
            RecordingConnection connection = new RecordingConnection("c1");

            broadcaster.subscribe("user-1", connection);

            assertThat(connection.getFrames()).hasSize(1);
            Map<String, Object> message = parse(connection.lastFrame());
            assertThat(message.get("eventType")).isEqualTo("connected");
            assertThat(payloadOf(message).get("userId")).isEqualTo("user-1");
            assertThat(message.get("timestamp")).isEqualTo(NOW.toString());
            assertThat(broadcaster.getUserConnectionCount("user-1")).isEqualTo(1);
        }

        @Test
        @DisplayName("Connected message goes only to the new connection")
        void connectedOnlyToNewConnection() {
            RecordingConnection first = new RecordingConnection("c1");
            RecordingConnection second = new RecordingConnection("c2");

            broadcaster.subscribe("user-1", first);
            broadcaster.subscribe("user-1", second);

            assertThat(first.getFrames()).hasSize(1);
            assertThat(second.getFrames()).hasSize(1);
            assertThat(broadcaster.getUserConnectionCount("user-1")).isEqualTo(2);
        }

        @Test
        @DisplayName("Connection that cannot take the connected message is dropped")
        void failedWelcomeDropsConnection() {
            broadcaster.subscribe("user-1", RecordingConnection.failing("c1"));

            assertThat(broadcaster.getUserConnectionCount("user-1")).isZero();
            assertThat(broadcaster.snapshot()).doesNotContainKey("user-1");
        }

        @Test
        @DisplayName("Unsubscribing the last connection removes the user entry")
        void unsubscribeRemovesEmptyUser() {
            RecordingConnection first = new RecordingConnection("c1");
            RecordingConnection second = new RecordingConnection("c2");
            broadcaster.subscribe("user-1", first);
            broadcaster.subscribe("user-1", second);

            broadcaster.unsubscribe("user-1", first);
            assertThat(broadcaster.snapshot()).containsEntry("user-1", 1);

            broadcaster.unsubscribe("user-1", second);
            assertThat(broadcaster.snapshot()).isEmpty();
            assertThat(broadcaster.getConnectionCount()).isZero();
        }

        @Test
        @DisplayName("Unsubscribing an unknown connection is harmless")
        void unsubscribeUnknown() {
            assertThatCode(() -> broadcaster.unsubscribe("ghost", new RecordingConnection("c9")))
                    .doesNotThrowAnyException();
        }
    }

    @Nested
    @DisplayName("Emit")
    class Emit {

        @Test
        @DisplayName("Emitting to a user with no connections is a silent no-op")
        void noConnectionsNoOp() {
            assertThatCode(() -> broadcaster.emit("nobody", RealtimeEventType.ORDER_PLACED, orderPayload()))
                    .doesNotThrowAnyException();
            assertThatCode(() -> broadcaster.emit(null, RealtimeEventType.ORDER_PLACED, orderPayload()))
                    .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Every connection of the user receives the identical frame")
        void fanOutIdenticalFrames() {
            RecordingConnection tab1 = new RecordingConnection("tab-1");
            RecordingConnection tab2 = new RecordingConnection("tab-2");
            RecordingConnection otherUser = new RecordingConnection("other");
            broadcaster.subscribe("user-1", tab1);
            broadcaster.subscribe("user-1", tab2);
            broadcaster.subscribe("user-2", otherUser);

            broadcaster.emit("user-1", RealtimeEventType.ORDER_PLACED, orderPayload());

            assertThat(tab1.getFrames()).hasSize(2);
            assertThat(tab2.getFrames()).hasSize(2);
            assertThat(tab1.lastFrame()).isEqualTo(tab2.lastFrame());
            assertThat(otherUser.getFrames()).hasSize(1);

            Map<String, Object> message = parse(tab1.lastFrame());
            assertThat(message.get("eventType")).isEqualTo("order_placed");
            assertThat(payloadOf(message).get("orderId")).isEqualTo("ord-1");
            assertThat(payloadOf(message).get("quantity")).isEqualTo(10);
        }

        @Test
        @DisplayName("A failing connection is pruned and the others still receive the event")
        void deadConnectionPruned() {
            RecordingConnection healthy = new RecordingConnection("healthy");
            RecordingConnection dying = new RecordingConnection("dying");
            broadcaster.subscribe("user-1", healthy);
            broadcaster.subscribe("user-1", dying);
            dying.startFailing();

            broadcaster.emit("user-1", RealtimeEventType.BALANCE_UPDATED, Map.of("balance", 1000));

            assertThat(healthy.getFrames()).hasSize(2);
            assertThat(parse(healthy.lastFrame()).get("eventType")).isEqualTo("balance_updated");
            assertThat(dying.isClosed()).isTrue();
            assertThat(broadcaster.getUserConnectionCount("user-1")).isEqualTo(1);
        }

        @Test
        @DisplayName("User entry disappears when its only connection dies during emit")
        void lastDeadConnectionRemovesUser() {
            RecordingConnection only = new RecordingConnection("only");
            broadcaster.subscribe("user-1", only);
            only.startFailing();

            broadcaster.emit("user-1", RealtimeEventType.POSITION_UPDATED, Map.of("positionId", "p1"));

            assertThat(broadcaster.snapshot()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Heartbeat And Lifecycle")
    class HeartbeatAndLifecycle {

        @Test
        @DisplayName("Heartbeat reaches every connection and prunes dead ones")
        void heartbeatPrunes() {
            RecordingConnection alive = new RecordingConnection("alive");
            RecordingConnection dead = new RecordingConnection("dead");
            broadcaster.subscribe("user-1", alive);
            broadcaster.subscribe("user-2", dead);
            dead.startFailing();

            int sent = broadcaster.sendHeartbeat();

            assertThat(sent).isEqualTo(1);
            assertThat(alive.lastFrame()).isEqualTo(SseFrames.HEARTBEAT);
            assertThat(broadcaster.snapshot()).containsOnlyKeys("user-1");
        }

        @Test
        @DisplayName("start() schedules the heartbeat at the configured interval")
        void startSchedulesHeartbeat() {
            realtimeConfig.setHeartbeatIntervalMs(15_000);
            doReturn(heartbeatFuture)
                    .when(heartbeatScheduler)
                    .schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));

            broadcaster.start();

            assertThat(broadcaster.isRunning()).isTrue();
            verify(heartbeatScheduler).schedule(any(Runnable.class), eq(15_000L), eq(TimeUnit.MILLISECONDS));
        }

        @Test
        @DisplayName("start() with the heartbeat disabled schedules nothing")
        void disabledHeartbeat() {
            realtimeConfig.setHeartbeatEnabled(false);

            broadcaster.start();

            assertThat(broadcaster.isRunning()).isTrue();
            verify(heartbeatScheduler, never()).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        }

        @Test
        @DisplayName("stop() cancels the heartbeat, closes connections and is idempotent")
        void stopIsIdempotent() {
            doReturn(heartbeatFuture)
                    .when(heartbeatScheduler)
                    .schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
            RecordingConnection connection = new RecordingConnection("c1");
            broadcaster.start();
            broadcaster.subscribe("user-1", connection);

            broadcaster.stop();
            broadcaster.stop();

            verify(heartbeatFuture).cancel(false);
            assertThat(connection.isClosed()).isTrue();
            assertThat(broadcaster.getConnectionCount()).isZero();
            assertThat(broadcaster.isRunning()).isFalse();
        }
    }
}
