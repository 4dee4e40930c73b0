package com.vtrader.api.controller;

import com.vtrader.api.dto.response.RealtimeStatusResponse;
import com.vtrader.config.RealtimeConfig;
import com.vtrader.realtime.RealtimeEventBroadcaster;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin/realtime")
public class RealtimeAdminController {

    private final RealtimeEventBroadcaster realtimeEventBroadcaster;
    private final RealtimeConfig realtimeConfig;

    public RealtimeAdminController(RealtimeEventBroadcaster realtimeEventBroadcaster, RealtimeConfig realtimeConfig) {
        this.realtimeEventBroadcaster = realtimeEventBroadcaster;
        this.realtimeConfig = realtimeConfig;
    }

    @GetMapping
    public RealtimeStatusResponse getStatus() {
        return RealtimeStatusResponse.builder()
                .totalConnections(realtimeEventBroadcaster.getConnectionCount())
                .connectionsByUser(realtimeEventBroadcaster.snapshot())
                .heartbeatEnabled(realtimeConfig.isHeartbeatEnabled())
                .heartbeatIntervalMs(realtimeConfig.getHeartbeatIntervalMs())
                .build();
    }
}
