package com.vtrader.domain.model;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One instrument's market snapshot as returned by the Vortex quotes endpoint.
 *
 * <p>Which fields are present depends on the requested mode: {@code ltp} fills only
 * {@link #lastTradePrice}; {@code ohlc} and {@code full} add the daily bar and volume.
 * The instrument id has the Vortex form {@code EXCHANGE-TOKEN} (e.g. {@code NSE_EQ-22}).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Quote {

    private String instrument;

    private BigDecimal lastTradePrice;
    private BigDecimal open;
    private BigDecimal high;
    private BigDecimal low;

    /** Previous session close. */
    private BigDecimal close;

    private Long volume;
    private BigDecimal change;
    private BigDecimal changePercent;

    /** Exchange timestamp of the last trade, as sent upstream. */
    private String lastTradeTime;
}
