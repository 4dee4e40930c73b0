package com.vtrader.broker;

import com.vtrader.domain.model.OrderSubmission;
import com.vtrader.domain.model.Quote;
import java.util.List;
import java.util.Map;

/**
 * Raw access to the market-data/broker API. Each call is one HTTP round trip and
 * consumes upstream rate budget, so callers must go through the
 * {@link com.vtrader.dispatch.DispatchQueue} instead of invoking this directly.
 */
public interface UpstreamClient {

    /**
     * Fetches quotes for the given instrument ids.
     *
     * @return quotes keyed by instrument id; ids the upstream does not know are absent
     * @throws com.vtrader.exception.RateLimitExceededException on HTTP 429
     * @throws com.vtrader.exception.BrokerException on any other failure
     */
    Map<String, Quote> fetchQuotes(List<String> instrumentIds, String mode);

    /** Places a regular order and returns the broker order id. */
    String submitOrder(OrderSubmission submission);
}
