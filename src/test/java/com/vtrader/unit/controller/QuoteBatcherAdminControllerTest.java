package com.vtrader.unit.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.vtrader.api.controller.QuoteBatcherAdminController;
import com.vtrader.config.QuoteBatcherConfig;
import com.vtrader.exception.GlobalExceptionHandler;
import com.vtrader.quote.QuoteBatcher;
import com.vtrader.quote.QuoteBatcherState;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Unit tests for QuoteBatcherAdminController: diagnostics, manual flush and validated
 * config updates against a real QuoteBatcherConfig.
 */
class QuoteBatcherAdminControllerTest {

    private MockMvc mockMvc;

    @Mock
    private QuoteBatcher quoteBatcher;

    private QuoteBatcherConfig config;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        config = new QuoteBatcherConfig();
        when(quoteBatcher.getState()).thenAnswer(invocation -> stateOf(config));
        mockMvc = MockMvcBuilders.standaloneSetup(new QuoteBatcherAdminController(quoteBatcher, config))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private static QuoteBatcherState stateOf(QuoteBatcherConfig config) {
        return QuoteBatcherState.builder()
                .activeBatches(Map.of(
                        "ltp",
                        QuoteBatcherState.ActiveBatch.builder()
                                .batchId("ltp-1767584700000-a1b2c3")
                                .uniqueInstrumentCount(4)
                                .requestCount(2)
                                .ageMs(120)
                                .windowMs(config.getWindowMs())
                                .maxUnion(config.getMaxUnion())
                                .build()))
                .metrics(Map.of("totalBatches", 7L))
                .circuitBreaker(QuoteBatcherState.CircuitView.builder()
                        .state("CLOSED")
                        .failureThreshold(config.getCircuitBreaker().getFailureThreshold())
                        .halfOpenAfterMs(config.getCircuitBreaker().getHalfOpenAfterMs())
                        .build())
                .config(QuoteBatcherState.ConfigView.builder()
                        .windowMs(config.getWindowMs())
                        .maxUnion(config.getMaxUnion())
                        .requestTimeoutMs(config.getRequestTimeoutMs())
                        .microCacheTtlMs(config.getMicroCacheTtlMs())
                        .failureThreshold(config.getCircuitBreaker().getFailureThreshold())
                        .halfOpenAfterMs(config.getCircuitBreaker().getHalfOpenAfterMs())
                        .build())
                .build();
    }

    @Test
    void getState_returnsBatchesCircuitAndConfig() throws Exception {
        mockMvc.perform(get("/api/admin/quotes-batcher"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.activeBatches.ltp.uniqueInstrumentCount").value(4))
                .andExpect(jsonPath("$.activeBatches.ltp.requestCount").value(2))
                .andExpect(jsonPath("$.metrics.totalBatches").value(7))
                .andExpect(jsonPath("$.circuitBreaker.state").value("CLOSED"))
                .andExpect(jsonPath("$.config.windowMs").value(1000));
    }

    @Test
    void flush_withMode_flushesThatMode() throws Exception {
        when(quoteBatcher.manualFlush("full")).thenReturn(CompletableFuture.completedFuture(null));

        MvcResult result = mockMvc.perform(post("/api/admin/quotes-batcher/flush")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"mode\":\"full\"}"))
                .andReturn();

        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.circuitBreaker.state").value("CLOSED"));
        verify(quoteBatcher).manualFlush("full");
    }

    @Test
    void flush_withoutBody_flushesDefaultMode() throws Exception {
        when(quoteBatcher.manualFlush("ltp")).thenReturn(CompletableFuture.completedFuture(null));

        MvcResult result = mockMvc.perform(post("/api/admin/quotes-batcher/flush")).andReturn();

        mockMvc.perform(asyncDispatch(result)).andExpect(status().isOk());
        verify(quoteBatcher).manualFlush("ltp");
    }

    @Test
    void updateConfig_partialUpdateKeepsOtherValues() throws Exception {
        mockMvc.perform(put("/api/admin/quotes-batcher/config")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"windowMs\":250,\"circuitBreaker\":{\"failureThreshold\":3}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.windowMs").value(250))
                .andExpect(jsonPath("$.maxUnion").value(1000))
                .andExpect(jsonPath("$.failureThreshold").value(3))
                .andExpect(jsonPath("$.halfOpenAfterMs").value(10000));

        assertThat(config.getWindowMs()).isEqualTo(250);
        assertThat(config.getCircuitBreaker().getFailureThreshold()).isEqualTo(3);
        assertThat(config.getRequestTimeoutMs()).isEqualTo(4000);
    }

    @Test
    void updateConfig_outOfRangeRejectsWholeUpdate() throws Exception {
        mockMvc.perform(put("/api/admin/quotes-batcher/config")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"windowMs\":250,\"maxUnion\":5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error.details.maxUnion").exists());

        assertThat(config.getWindowMs()).isEqualTo(1000);
        assertThat(config.getMaxUnion()).isEqualTo(1000);
    }

    @Test
    void updateConfig_nestedViolationRejected() throws Exception {
        mockMvc.perform(put("/api/admin/quotes-batcher/config")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"circuitBreaker\":{\"halfOpenAfterMs\":500}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.details['circuitBreaker.halfOpenAfterMs']").exists());

        assertThat(config.getCircuitBreaker().getHalfOpenAfterMs()).isEqualTo(10_000);
    }
}
