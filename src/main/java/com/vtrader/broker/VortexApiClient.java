package com.vtrader.broker;

import com.vtrader.config.VortexConfig;
import com.vtrader.domain.model.OrderSubmission;
import com.vtrader.domain.model.Quote;
import com.vtrader.exception.BrokerException;
import com.vtrader.exception.RateLimitExceededException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Vortex REST client over Spring {@link RestClient}.
 *
 * <p>Every method is one blocking HTTP round trip with no retry. HTTP 429 becomes
 * {@link RateLimitExceededException}; every other failure (network, non-2xx, a body
 * without {@code status=success}) becomes {@link BrokerException}. Callers reach this
 * class only through the dispatch queue.
 */
@Service
public class VortexApiClient implements UpstreamClient {

    private static final Logger log = LoggerFactory.getLogger(VortexApiClient.class);

    static final String QUOTES_PATH = "/data/quotes";
    static final String ORDERS_PATH = "/trading/orders/regular";

    private final RestClient restClient;
    private final VortexConfig vortexConfig;

    public VortexApiClient(@Qualifier("vortexRestClient") RestClient restClient, VortexConfig vortexConfig) {
        this.restClient = restClient;
        this.vortexConfig = vortexConfig;
    }

    @Override
    public Map<String, Quote> fetchQuotes(List<String> instrumentIds, String mode) {
        log.info("Fetching quotes: instruments={}, mode={}", instrumentIds.size(), mode);
        VortexQuotesResponse response;
        try {
            response = restClient
                    .get()
                    .uri(uriBuilder -> uriBuilder
                            .path(QUOTES_PATH)
                            .queryParam("q", instrumentIds.toArray())
                            .queryParam("mode", mode)
                            .build())
                    .headers(this::applyAuth)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .body(VortexQuotesResponse.class);
        } catch (RestClientException e) {
            throw translate(e, "GET", QUOTES_PATH);
        }

        if (response == null || !"success".equalsIgnoreCase(response.getStatus())) {
            throw new BrokerException(
                    "Quotes request rejected: status=" + (response != null ? response.getStatus() : "empty"));
        }

        Map<String, Quote> quotes = new LinkedHashMap<>();
        if (response.getData() != null) {
            response.getData().forEach((id, data) -> {
                if (data != null) {
                    quotes.put(id, toQuote(id, data));
                }
            });
        }
        log.info("Quotes fetched successfully: requested={}, returned={}", instrumentIds.size(), quotes.size());
        return quotes;
    }

    @Override
    public String submitOrder(OrderSubmission submission) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("exchange", submission.getExchange());
        body.put("token", submission.getToken());
        body.put("transaction_type", submission.getSide().name());
        body.put("product", submission.getProduct());
        body.put("variety", varietyOf(submission));
        body.put("quantity", submission.getQuantity());
        body.put("price", submission.getPrice() != null ? submission.getPrice() : 0);
        body.put("trigger_price", submission.getTriggerPrice() != null ? submission.getTriggerPrice() : 0);
        body.put("disclosed_quantity", 0);
        body.put("validity", submission.getValidity());
        body.put("validity_days", 1);
        body.put("is_amo", false);
        if (submission.getTag() != null) {
            body.put("tag", submission.getTag());
        }

        VortexOrderResponse response;
        try {
            response = restClient
                    .post()
                    .uri(ORDERS_PATH)
                    .headers(this::applyAuth)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(VortexOrderResponse.class);
        } catch (RestClientException e) {
            throw translate(e, "POST", ORDERS_PATH);
        }

        if (response == null
                || !"success".equalsIgnoreCase(response.getStatus())
                || response.getData() == null
                || response.getData().getOrderId() == null) {
            throw new BrokerException("Order placement rejected: token=" + submission.getToken());
        }
        String orderId = response.getData().getOrderId();
        log.info(
                "Order placed: orderId={}, token={}, side={}, qty={}",
                orderId,
                submission.getToken(),
                submission.getSide(),
                submission.getQuantity());
        return orderId;
    }

    private void applyAuth(HttpHeaders headers) {
        if (vortexConfig.getApiKey() != null) {
            headers.set("x-api-key", vortexConfig.getApiKey());
        }
        if (vortexConfig.getAccessToken() != null) {
            headers.setBearerAuth(vortexConfig.getAccessToken());
        }
    }

    private RuntimeException translate(RestClientException e, String method, String path) {
        if (e instanceof RestClientResponseException responseException) {
            int status = responseException.getStatusCode().value();
            if (status == HttpStatus.TOO_MANY_REQUESTS.value()) {
                String retryAfter = responseException.getResponseHeaders() != null
                        ? responseException.getResponseHeaders().getFirst(HttpHeaders.RETRY_AFTER)
                        : null;
                log.warn("Rate limit exceeded: method={}, path={}, retryAfter={}", method, path, retryAfter);
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("method", method);
                details.put("path", path);
                if (retryAfter != null) {
                    details.put("retryAfter", retryAfter);
                }
                return new RateLimitExceededException("Rate limit exceeded, please try again later", details, e);
            }
            log.error("API request failed: method={}, path={}, status={}", method, path, status);
            return new BrokerException(
                    "Vortex request failed with HTTP " + status,
                    Map.of("method", method, "path", path, "status", status),
                    e);
        }
        log.error("API request failed: method={}, path={}, error={}", method, path, e.getMessage());
        return new BrokerException("Vortex request failed: " + e.getMessage(), e);
    }

    private static String varietyOf(OrderSubmission submission) {
        if (submission.getType() == null) {
            return "RL";
        }
        return switch (submission.getType()) {
            case MARKET -> "RL-MKT";
            case LIMIT -> "RL";
            case SL -> "SL";
            case SL_M -> "SL-MKT";
        };
    }

    private static Quote toQuote(String id, VortexQuotesResponse.QuoteData data) {
        return Quote.builder()
                .instrument(id)
                .lastTradePrice(data.getLastTradePrice())
                .open(data.getOpenPrice())
                .high(data.getHighPrice())
                .low(data.getLowPrice())
                .close(data.getClosePrice())
                .volume(data.getVolume())
                .change(data.getNetChange())
                .changePercent(data.getNetChangePercent())
                .lastTradeTime(data.getLastTradeTime())
                .build();
    }
}
