package com.vtrader.unit.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.vtrader.api.controller.QuoteController;
import com.vtrader.domain.model.Quote;
import com.vtrader.exception.CircuitOpenException;
import com.vtrader.exception.GlobalExceptionHandler;
import com.vtrader.exception.QuoteRequestTimeoutException;
import com.vtrader.exception.RateLimitExceededException;
import com.vtrader.quote.BatchRequestOptions;
import com.vtrader.quote.QuoteBatcher;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Unit tests for QuoteController: parameter handling, async results and error mapping.
 */
class QuoteControllerTest {

    private MockMvc mockMvc;

    @Mock
    private QuoteBatcher quoteBatcher;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        mockMvc = MockMvcBuilders.standaloneSetup(new QuoteController(quoteBatcher))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void getQuotes_returnsQuotesKeyedByInstrument() throws Exception {
        Quote quote = Quote.builder()
                .instrument("NSE_EQ-22")
                .lastTradePrice(new BigDecimal("1523.40"))
                .build();
        when(quoteBatcher.requestQuotes(anyList(), anyString(), any(BatchRequestOptions.class)))
                .thenReturn(CompletableFuture.completedFuture(Map.of("NSE_EQ-22", quote)));

        MvcResult result = mockMvc.perform(get("/api/quotes")
                        .param("instruments", "NSE_EQ-22,NSE_EQ-2885")
                        .param("clientId", "watchlist-panel")
                        .param("timeoutMs", "1500"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$['NSE_EQ-22'].lastTradePrice").value(1523.40))
                .andExpect(jsonPath("$['NSE_EQ-2885']").doesNotExist());

        ArgumentCaptor<BatchRequestOptions> options = ArgumentCaptor.forClass(BatchRequestOptions.class);
        verify(quoteBatcher).requestQuotes(eq(List.of("NSE_EQ-22", "NSE_EQ-2885")), eq("ltp"), options.capture());
        assertThat(options.getValue().getClientId()).isEqualTo("watchlist-panel");
        assertThat(options.getValue().getTimeoutMs()).isEqualTo(1500L);
    }

    @Test
    void getQuotes_circuitOpen_returns503() throws Exception {
        when(quoteBatcher.requestQuotes(anyList(), eq("full"), any(BatchRequestOptions.class)))
                .thenReturn(CompletableFuture.failedFuture(new CircuitOpenException("full")));

        MvcResult result = mockMvc.perform(
                        get("/api/quotes").param("instruments", "NSE_EQ-22").param("mode", "full"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("UPSTREAM_UNAVAILABLE"))
                .andExpect(jsonPath("$.error.retryable").value(true));
    }

    @Test
    void getQuotes_upstreamRateLimited_returns429WithRetryAfter() throws Exception {
        when(quoteBatcher.requestQuotes(anyList(), anyString(), any(BatchRequestOptions.class)))
                .thenReturn(CompletableFuture.failedFuture(new RateLimitExceededException(
                        "Vortex rate limit exceeded", Map.of("retryAfter", "2"), null)));

        MvcResult result = mockMvc.perform(get("/api/quotes").param("instruments", "NSE_EQ-22"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "2"))
                .andExpect(jsonPath("$.error.code").value("RATE_LIMITED"));
    }

    @Test
    void getQuotes_timeout_returns504() throws Exception {
        when(quoteBatcher.requestQuotes(anyList(), anyString(), any(BatchRequestOptions.class)))
                .thenReturn(CompletableFuture.failedFuture(new QuoteRequestTimeoutException("ltp", 4000)));

        MvcResult result = mockMvc.perform(get("/api/quotes").param("instruments", "NSE_EQ-22"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.error.code").value("GATEWAY_TIMEOUT"));
    }

    @Test
    void getQuotes_missingInstruments_returns400() throws Exception {
        mockMvc.perform(get("/api/quotes"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.details.parameter").value("instruments"))
                .andExpect(jsonPath("$.error.retryable").value(false));
    }
}
