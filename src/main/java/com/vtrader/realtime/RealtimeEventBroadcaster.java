package com.vtrader.realtime;

import com.vtrader.config.RealtimeConfig;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Per-user fan-out of realtime events to open push streams.
 *
 * <p>The registry maps userId to the set of that user's open connections. Entries are
 * created and removed atomically per user, and a user entry disappears as soon as its last
 * connection goes away.
 *
 * <p>Delivery is best-effort. {@link #emit} serializes the message once, writes it to a
 * snapshot of the user's connections with a failure boundary per connection, and prunes the
 * connections that failed only after the loop. Emitting to a user without connections is a
 * no-op. Nothing here ever throws back into the emitting code path.
 *
 * <p>A heartbeat comment frame goes to every connection every {@code heartbeatIntervalMs}
 * on a daemon thread, pruning dead connections the same way. It runs only between
 * {@link #start()} and {@link #stop()} and only when enabled.
 */
@Component
public class RealtimeEventBroadcaster implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(RealtimeEventBroadcaster.class);

    private final Map<String, Set<PushConnection>> connections = new ConcurrentHashMap<>();

    private final RealtimeConfig realtimeConfig;
    private final ObjectMapper objectMapper;
    private final ScheduledExecutorService heartbeatScheduler;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile ScheduledFuture<?> heartbeatTask;

    public RealtimeEventBroadcaster(
            RealtimeConfig realtimeConfig,
            ObjectMapper objectMapper,
            @Qualifier("heartbeatScheduler") ScheduledExecutorService heartbeatScheduler,
            Clock clock) {
        this.realtimeConfig = realtimeConfig;
        this.objectMapper = objectMapper;
        this.heartbeatScheduler = heartbeatScheduler;
        this.clock = clock;
    }

    /**
     * Registers the connection for the user and sends the {@code connected} acknowledgement
     * on that connection only. A connection that cannot take the acknowledgement is dropped.
     */
    public void subscribe(String userId, PushConnection connection) {
        connections.compute(userId, (key, existing) -> {
            Set<PushConnection> set = existing != null ? existing : ConcurrentHashMap.newKeySet();
            set.add(connection);
            return set;
        });
        log.info(
                "User subscribed: userId={}, connectionId={}, totalConnections={}",
                userId,
                connection.getId(),
                getConnectionCount());

        String timestamp = now();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("userId", userId);
        payload.put("timestamp", timestamp);
        String frame = frameOf(RealtimeMessage.of(RealtimeEventType.CONNECTED, payload, timestamp));
        if (frame == null) {
            return;
        }
        try {
            connection.send(frame);
        } catch (Exception e) {
            log.warn(
                    "Could not send connected message, dropping connection: userId={}, connectionId={}, error={}",
                    userId,
                    connection.getId(),
                    e.getMessage());
            unsubscribe(userId, connection);
        }
    }

    public void unsubscribe(String userId, PushConnection connection) {
        boolean removed = removeConnection(userId, connection);
        if (removed) {
            log.info(
                    "User unsubscribed: userId={}, connectionId={}, totalConnections={}",
                    userId,
                    connection.getId(),
                    getConnectionCount());
        }
    }

    /** Sends the event to every open connection of the user. Never throws. */
    public void emit(String userId, RealtimeEventType eventType, Object payload) {
        Set<PushConnection> userConnections = userId != null ? connections.get(userId) : null;
        if (userConnections == null || userConnections.isEmpty()) {
            return;
        }

        String frame = frameOf(RealtimeMessage.of(eventType, payload, now()));
        if (frame == null) {
            return;
        }

        List<PushConnection> snapshot = new ArrayList<>(userConnections);
        log.debug(
                "Emitting event: eventType={}, userId={}, connections={}",
                eventType.getWireName(),
                userId,
                snapshot.size());

        List<PushConnection> dead = new ArrayList<>();
        for (PushConnection connection : snapshot) {
            try {
                connection.send(frame);
            } catch (Exception e) {
                log.warn(
                        "Error emitting to connection: eventType={}, userId={}, connectionId={}, error={}",
                        eventType.getWireName(),
                        userId,
                        connection.getId(),
                        e.getMessage());
                dead.add(connection);
            }
        }
        prune(userId, dead);
    }

    /** Writes the keep-alive frame to every connection of every user, pruning dead ones. */
    public int sendHeartbeat() {
        int sent = 0;
        int pruned = 0;
        for (Map.Entry<String, Set<PushConnection>> entry : connections.entrySet()) {
            List<PushConnection> dead = new ArrayList<>();
            for (PushConnection connection : new ArrayList<>(entry.getValue())) {
                try {
                    connection.send(SseFrames.HEARTBEAT);
                    sent++;
                } catch (Exception e) {
                    dead.add(connection);
                }
            }
            pruned += dead.size();
            prune(entry.getKey(), dead);
        }
        if (sent > 0 || pruned > 0) {
            log.debug("Heartbeat sent: connections={}, pruned={}", sent, pruned);
        }
        return sent;
    }

    public int getConnectionCount() {
        int total = 0;
        for (Set<PushConnection> userConnections : connections.values()) {
            total += userConnections.size();
        }
        return total;
    }

    public int getUserConnectionCount(String userId) {
        Set<PushConnection> userConnections = connections.get(userId);
        return userConnections != null ? userConnections.size() : 0;
    }

    /** Connection count per user, for the admin endpoint. */
    public Map<String, Integer> snapshot() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        connections.forEach((userId, userConnections) -> counts.put(userId, userConnections.size()));
        return counts;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        if (realtimeConfig.isHeartbeatEnabled()) {
            scheduleHeartbeat();
            log.info("Realtime broadcaster started: heartbeatIntervalMs={}", realtimeConfig.getHeartbeatIntervalMs());
        } else {
            log.info("Realtime broadcaster started with heartbeat disabled");
        }
    }

    /** Cancels the heartbeat, closes and forgets every connection. Idempotent. */
    @Override
    public void stop() {
        ScheduledFuture<?> task = heartbeatTask;
        if (task != null) {
            task.cancel(false);
            heartbeatTask = null;
        }
        boolean wasRunning = running.getAndSet(false);

        int closed = 0;
        for (Set<PushConnection> userConnections : connections.values()) {
            for (PushConnection connection : userConnections) {
                connection.close();
                closed++;
            }
        }
        connections.clear();
        if (wasRunning || closed > 0) {
            log.info("Realtime broadcaster stopped: closedConnections={}", closed);
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    private void scheduleHeartbeat() {
        if (!running.get() || !realtimeConfig.isHeartbeatEnabled()) {
            return;
        }
        long intervalMs = Math.max(1, realtimeConfig.getHeartbeatIntervalMs());
        try {
            heartbeatTask = heartbeatScheduler.schedule(this::heartbeatTick, intervalMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.info("Heartbeat scheduler shut down, heartbeat stopped");
        }
    }

    private void heartbeatTick() {
        try {
            sendHeartbeat();
        } catch (RuntimeException e) {
            log.error("Heartbeat tick failed", e);
        }
        // Re-read the interval every tick so a config change applies without restart.
        scheduleHeartbeat();
    }

    private boolean removeConnection(String userId, PushConnection connection) {
        AtomicBoolean removed = new AtomicBoolean(false);
        connections.computeIfPresent(userId, (key, set) -> {
            removed.set(set.remove(connection));
            return set.isEmpty() ? null : set;
        });
        return removed.get();
    }

    private void prune(String userId, List<PushConnection> dead) {
        if (dead.isEmpty()) {
            return;
        }
        for (PushConnection connection : dead) {
            removeConnection(userId, connection);
            connection.close();
        }
        log.warn("Cleaned up dead connections: userId={}, count={}", userId, dead.size());
    }

    private String frameOf(RealtimeMessage message) {
        try {
            return SseFrames.data(objectMapper.writeValueAsString(message));
        } catch (JacksonException e) {
            log.error("Failed to serialize realtime message: eventType={}", message.getEventType(), e);
            return null;
        }
    }

    private String now() {
        return Instant.now(clock).toString();
    }
}
