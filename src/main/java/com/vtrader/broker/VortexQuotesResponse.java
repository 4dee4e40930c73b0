package com.vtrader.broker;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.util.Map;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Wire shape of {@code GET /data/quotes}: {@code {"status": "success", "data": {id: quote}}}. */
@Data
@NoArgsConstructor
class VortexQuotesResponse {

    private String status;
    private Map<String, QuoteData> data;

    @Data
    @NoArgsConstructor
    static class QuoteData {

        @JsonProperty("last_trade_price")
        private BigDecimal lastTradePrice;

        @JsonProperty("open_price")
        private BigDecimal openPrice;

        @JsonProperty("high_price")
        private BigDecimal highPrice;

        @JsonProperty("low_price")
        private BigDecimal lowPrice;

        @JsonProperty("close_price")
        private BigDecimal closePrice;

        private Long volume;

        @JsonProperty("net_change")
        private BigDecimal netChange;

        @JsonProperty("net_change_percent")
        private BigDecimal netChangePercent;

        @JsonProperty("last_trade_time")
        private String lastTradeTime;
    }
}
