package com.vtrader.api.dto.response;

import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RealtimeStatusResponse {

    private int totalConnections;
    private Map<String, Integer> connectionsByUser;
    private boolean heartbeatEnabled;
    private long heartbeatIntervalMs;
}
