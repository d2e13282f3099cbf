package com.panwatch.unit.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.panwatch.agent.AgentRunResult;
import com.panwatch.api.controller.InstrumentController;
import com.panwatch.api.dto.request.InstrumentAgentRequest;
import com.panwatch.api.dto.response.AgentRunResponse;
import com.panwatch.config.ApiResponseAdvice;
import com.panwatch.domain.enums.ExecutionState;
import com.panwatch.domain.enums.FailureReason;
import com.panwatch.domain.enums.Market;
import com.panwatch.domain.model.Instrument;
import com.panwatch.domain.model.InstrumentAgentBinding;
import com.panwatch.exception.BusinessException;
import com.panwatch.exception.ErrorCode;
import com.panwatch.exception.GlobalExceptionHandler;
import com.panwatch.mapper.AgentRunResultMapper;
import com.panwatch.service.InstrumentService;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Standalone MockMvc tests for the InstrumentController: watchlist CRUD, agent bindings
 * and the per-instrument trigger.
 */
@ExtendWith(MockitoExtension.class)
class InstrumentControllerTest {

    private MockMvc mockMvc;

    @Mock
    private InstrumentService instrumentService;

    @Mock
    private AgentRunResultMapper agentRunResultMapper;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new InstrumentController(instrumentService, agentRunResultMapper))
                .setControllerAdvice(new GlobalExceptionHandler(), new ApiResponseAdvice())
                .build();
    }

    private static Instrument moutai(boolean enabled) {
        return Instrument.builder().id(7L).symbol("600519").name("贵州茅台").market(Market.CN).enabled(enabled).build();
    }

    @Test
    @DisplayName("POST /api/instruments creates an enabled instrument by default")
    void createDefaultsToEnabled() throws Exception {
        when(instrumentService.create(any(Instrument.class))).thenReturn(moutai(true));

        mockMvc.perform(post("/api/instruments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"symbol":"600519","name":"贵州茅台","market":"CN"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.id").value(7))
                .andExpect(jsonPath("$.data.symbol").value("600519"));

        ArgumentCaptor<Instrument> created = ArgumentCaptor.forClass(Instrument.class);
        verify(instrumentService).create(created.capture());
        assertThat(created.getValue().isEnabled()).isTrue();
        assertThat(created.getValue().getMarket()).isEqualTo(Market.CN);
    }

    @Test
    @DisplayName("POST /api/instruments without a symbol fails validation")
    void createWithoutSymbolIsRejected() throws Exception {
        mockMvc.perform(post("/api/instruments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name":"贵州茅台","market":"CN"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error.details.symbol").value("Symbol is required"));

        verify(instrumentService, never()).create(any());
    }

    @Test
    @DisplayName("POST /api/instruments with a duplicate symbol is 409")
    void duplicateIsConflict() throws Exception {
        when(instrumentService.create(any(Instrument.class)))
                .thenThrow(new BusinessException(ErrorCode.CONFLICT, "Instrument 600519 (CN) already exists"));

        mockMvc.perform(post("/api/instruments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"symbol":"600519","market":"CN"}
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error.code").value("CONFLICT"));
    }

    @Test
    @DisplayName("PUT /api/instruments/{id} can disable without resending symbol and market")
    void updateTogglesEnabled() throws Exception {
        when(instrumentService.update(7L, null, false)).thenReturn(moutai(false));

        mockMvc.perform(put("/api/instruments/7")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"enabled":false}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.enabled").value(false));
    }

    @Test
    @DisplayName("DELETE /api/instruments/{id} deletes the instrument")
    void deleteReturnsMessage() throws Exception {
        mockMvc.perform(delete("/api/instruments/7"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.message").value("Instrument deleted"));

        verify(instrumentService).delete(7L);
    }

    @Test
    @DisplayName("PUT /api/instruments/{id}/agents replaces the bindings")
    void replaceBindings() throws Exception {
        InstrumentAgentBinding binding = InstrumentAgentBinding.builder()
                .id(1L)
                .instrumentId(7L)
                .agentName("intraday_monitor")
                .schedule("*/10 9-15 * * 1-5")
                .build();
        when(instrumentService.replaceBindings(eq(7L), anyList())).thenReturn(List.of(binding));

        mockMvc.perform(put("/api/instruments/7/agents")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                [{"agentName":"intraday_monitor","schedule":"*/10 9-15 * * 1-5"}]
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].agentName").value("intraday_monitor"))
                .andExpect(jsonPath("$.data[0].schedule").value("*/10 9-15 * * 1-5"));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<InstrumentAgentRequest>> requests = ArgumentCaptor.forClass(List.class);
        verify(instrumentService).replaceBindings(eq(7L), requests.capture());
        assertThat(requests.getValue()).singleElement()
                .extracting(InstrumentAgentRequest::getAgentName)
                .isEqualTo("intraday_monitor");
    }

    @Test
    @DisplayName("POST /api/instruments/{id}/agents/{agent}/trigger returns the run, failed or not")
    void triggerReturnsRun() throws Exception {
        AgentRunResult result = AgentRunResult.builder()
                .runId("r-2")
                .agentName("intraday_monitor")
                .instrumentId(7L)
                .state(ExecutionState.FAILED)
                .failureReason(FailureReason.DATA_UNAVAILABLE)
                .build();
        AgentRunResponse response = AgentRunResponse.builder()
                .runId("r-2")
                .agentName("intraday_monitor")
                .instrumentId(7L)
                .state(ExecutionState.FAILED)
                .failureReason(FailureReason.DATA_UNAVAILABLE)
                .build();
        when(instrumentService.trigger(7L, "intraday_monitor", true)).thenReturn(result);
        when(agentRunResultMapper.toResponse(result)).thenReturn(response);

        mockMvc.perform(post("/api/instruments/7/agents/intraday_monitor/trigger"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.state").value("FAILED"))
                .andExpect(jsonPath("$.data.failureReason").value("DATA_UNAVAILABLE"));
    }
}
