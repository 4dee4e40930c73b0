package com.vtrader.realtime;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Envelope of every pushed event: {@code {"eventType", "payload", "timestamp"}}.
 * The timestamp is ISO-8601 UTC, taken at emission.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RealtimeMessage {

    private String eventType;
    private Object payload;
    private String timestamp;

    public static RealtimeMessage of(RealtimeEventType eventType, Object payload, String timestamp) {
        return new RealtimeMessage(eventType.getWireName(), payload, timestamp);
    }
}
