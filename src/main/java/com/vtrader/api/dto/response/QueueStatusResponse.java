package com.vtrader.api.dto.response;

import com.vtrader.dispatch.DispatchQueueStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Dispatch queue snapshot plus operator hints derived from the current request rate.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueStatusResponse {

    private DispatchQueueStatus queue;
    private Recommendations recommendations;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Recommendations {

        /** Short queue and a rate comfortably under the upstream cap. */
        private boolean healthy;

        private boolean shouldSlowDown;
        private boolean critical;
    }

    public static QueueStatusResponse of(DispatchQueueStatus status) {
        int rate = status.getRequestsInWindow();
        Recommendations recommendations = Recommendations.builder()
                .healthy(status.getQueueLength() < 10 && rate < 25)
                .shouldSlowDown(rate > 20)
                .critical(rate > 30)
                .build();
        return new QueueStatusResponse(status, recommendations);
    }
}
