package com.vtrader.api.controller;

import com.vtrader.config.RealtimeConfig;
import com.vtrader.exception.UnauthorizedException;
import com.vtrader.realtime.RealtimeEventBroadcaster;
import com.vtrader.realtime.SseEmitterConnection;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;

/**
 * Long-lived push stream of realtime events for one user.
 *
 * <p>GET /api/realtime/stream?userId=... opens a {@code text/event-stream} response that stays
 * open until the client goes away. The first frame is the {@code connected} event; after that
 * the stream carries whatever {@link RealtimeEventBroadcaster#emit} sends to the user, plus
 * heartbeat comments. A request without a userId is refused with 401.
 */
@RestController
@RequestMapping("/api/realtime")
public class RealtimeStreamController {

    private final RealtimeEventBroadcaster realtimeEventBroadcaster;
    private final RealtimeConfig realtimeConfig;

    public RealtimeStreamController(RealtimeEventBroadcaster realtimeEventBroadcaster, RealtimeConfig realtimeConfig) {
        this.realtimeEventBroadcaster = realtimeEventBroadcaster;
        this.realtimeConfig = realtimeConfig;
    }

    @GetMapping("/stream")
    public ResponseEntity<ResponseBodyEmitter> stream(@RequestParam(required = false) String userId) {
        if (userId == null || userId.isBlank()) {
            throw new UnauthorizedException("Authentication required");
        }

        ResponseBodyEmitter emitter = new ResponseBodyEmitter(realtimeConfig.getEmitterTimeoutMs());
        SseEmitterConnection connection = new SseEmitterConnection(emitter);
        emitter.onCompletion(() -> realtimeEventBroadcaster.unsubscribe(userId, connection));
        emitter.onTimeout(() -> realtimeEventBroadcaster.unsubscribe(userId, connection));
        emitter.onError(error -> realtimeEventBroadcaster.unsubscribe(userId, connection));

        realtimeEventBroadcaster.subscribe(userId, connection);

        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_EVENT_STREAM)
                .header(HttpHeaders.CACHE_CONTROL, "no-cache")
                .header(HttpHeaders.CONNECTION, "keep-alive")
                .header("X-Accel-Buffering", "no")
                .body(emitter);
    }
}
