package com.vtrader.domain.model;

import com.vtrader.domain.enums.OrderSide;
import com.vtrader.domain.enums.OrderType;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Parameters for one regular order sent to the broker.
 *
 * <p>Order submission shares the upstream rate budget with quote fetches, so it is
 * always routed through the dispatch queue, at a higher priority than market data.
 */
@Data
@Builder
public class OrderSubmission {

    /** Vortex exchange segment, e.g. "NSE_EQ", "NSE_FO". */
    private String exchange;

    /** Exchange token of the instrument. */
    private long token;

    private OrderSide side;
    private OrderType type;

    /** "INTRADAY" or "DELIVERY". */
    @Builder.Default
    private String product = "INTRADAY";

    private int quantity;

    /** Limit price. Ignored for MARKET orders. */
    private BigDecimal price;

    /** Trigger price for SL / SL_M orders. */
    private BigDecimal triggerPrice;

    @Builder.Default
    private String validity = "DAY";

    /** Client-side correlation tag echoed back by the broker. */
    private String tag;
}
