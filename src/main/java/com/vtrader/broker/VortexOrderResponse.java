package com.vtrader.broker;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Wire shape of {@code POST /trading/orders/regular}. */
@Data
@NoArgsConstructor
class VortexOrderResponse {

    private String status;
    private OrderData data;

    @Data
    @NoArgsConstructor
    static class OrderData {

        @JsonProperty("order_id")
        private String orderId;
    }
}
