package com.panwatch.unit.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.panwatch.agent.IntradayScanner;
import com.panwatch.api.controller.AgentController;
import com.panwatch.api.dto.request.AgentUpdateRequest;
import com.panwatch.api.dto.response.AgentRunResponse;
import com.panwatch.api.dto.response.IntradayScanResponse;
import com.panwatch.api.dto.response.MoveAlert;
import com.panwatch.config.ApiResponseAdvice;
import com.panwatch.domain.enums.DispatchStatus;
import com.panwatch.domain.enums.ExecutionMode;
import com.panwatch.domain.enums.ExecutionState;
import com.panwatch.domain.model.AgentDefinition;
import com.panwatch.exception.GlobalExceptionHandler;
import com.panwatch.exception.InvalidScheduleException;
import com.panwatch.exception.ResourceNotFoundException;
import com.panwatch.mapper.AgentRunResultMapper;
import com.panwatch.service.AgentService;
import java.math.BigDecimal;
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
 * Standalone MockMvc tests for the AgentController.
 */
@ExtendWith(MockitoExtension.class)
class AgentControllerTest {

    private MockMvc mockMvc;

    @Mock
    private AgentService agentService;

    @Mock
    private AgentRunResultMapper agentRunResultMapper;

    @Mock
    private IntradayScanner intradayScanner;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new AgentController(agentService, agentRunResultMapper, intradayScanner))
                .setControllerAdvice(new GlobalExceptionHandler(), new ApiResponseAdvice())
                .build();
    }

    private static AgentDefinition intraday(boolean enabled, String schedule) {
        return AgentDefinition.builder()
                .id(2L)
                .name("intraday_monitor")
                .displayName("盘中监测")
                .enabled(enabled)
                .executionMode(ExecutionMode.SINGLE)
                .schedule(schedule)
                .build();
    }

    @Test
    @DisplayName("GET /api/agents lists agents")
    void getAllReturnsAgents() throws Exception {
        when(agentService.getAll()).thenReturn(List.of(intraday(true, "*/5 9-15 * * 1-5")));

        mockMvc.perform(get("/api/agents"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data[0].name").value("intraday_monitor"))
                .andExpect(jsonPath("$.data[0].executionMode").value("SINGLE"));
    }

    @Test
    @DisplayName("GET /api/agents/{name} for an unknown agent is 404")
    void unknownAgentIsNotFound() throws Exception {
        when(agentService.get("nope")).thenThrow(new ResourceNotFoundException("Agent", "nope"));

        mockMvc.perform(get("/api/agents/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("PUT /api/agents/{name} passes only the given fields")
    void updatePassesRequest() throws Exception {
        when(agentService.update(eq("intraday_monitor"), any(AgentUpdateRequest.class)))
                .thenReturn(intraday(false, "*/10 9-15 * * 1-5"));

        mockMvc.perform(put("/api/agents/intraday_monitor")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"enabled":false,"schedule":"*/10 9-15 * * 1-5"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.enabled").value(false))
                .andExpect(jsonPath("$.data.schedule").value("*/10 9-15 * * 1-5"));

        ArgumentCaptor<AgentUpdateRequest> request = ArgumentCaptor.forClass(AgentUpdateRequest.class);
        verify(agentService).update(eq("intraday_monitor"), request.capture());
        assertThat(request.getValue().getEnabled()).isFalse();
        assertThat(request.getValue().getAiModelId()).isNull();
    }

    @Test
    @DisplayName("PUT /api/agents/{name} with a malformed schedule is a config error")
    void invalidScheduleIsRejected() throws Exception {
        when(agentService.update(eq("intraday_monitor"), any(AgentUpdateRequest.class)))
                .thenThrow(new InvalidScheduleException("61 * * * *", "value 61 out of range [0-59] in minute"));

        mockMvc.perform(put("/api/agents/intraday_monitor")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"schedule":"61 * * * *"}
                                """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error.code").value("CONFIG_ERROR"))
                .andExpect(jsonPath("$.error.details.schedule").value("61 * * * *"));
    }

    @Test
    @DisplayName("POST /api/agents/{name}/trigger bypasses the throttle by default")
    void triggerDefaultsToBypass() throws Exception {
        AgentRunResponse response = AgentRunResponse.builder()
                .runId("r-1")
                .agentName("intraday_monitor")
                .state(ExecutionState.DONE)
                .dispatchStatus(DispatchStatus.DELIVERED)
                .notified(true)
                .build();
        when(agentService.trigger("intraday_monitor", true)).thenReturn(List.of());
        when(agentRunResultMapper.toResponseList(anyList())).thenReturn(List.of(response));

        mockMvc.perform(post("/api/agents/intraday_monitor/trigger"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].runId").value("r-1"))
                .andExpect(jsonPath("$.data[0].dispatchStatus").value("DELIVERED"))
                .andExpect(jsonPath("$.data[0].notified").value(true));
    }

    @Test
    @DisplayName("POST /api/agents/{name}/trigger?bypassThrottle=false respects the throttle")
    void triggerCanRespectThrottle() throws Exception {
        when(agentService.trigger("intraday_monitor", false)).thenReturn(List.of());
        when(agentRunResultMapper.toResponseList(anyList())).thenReturn(List.of());

        mockMvc.perform(post("/api/agents/intraday_monitor/trigger").param("bypassThrottle", "false"))
                .andExpect(status().isOk());

        verify(agentService).trigger("intraday_monitor", false);
    }

    @Test
    @DisplayName("GET /api/agents/{name}/history uses the default limit")
    void historyDefaultLimit() throws Exception {
        when(agentService.history("intraday_monitor", 20)).thenReturn(List.of());

        mockMvc.perform(get("/api/agents/intraday_monitor/history"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").isEmpty());
    }

    @Test
    @DisplayName("POST /api/agents/intraday/scan returns movers without analysis by default")
    void intradayScanDefaultsToNoAnalysis() throws Exception {
        MoveAlert alert = MoveAlert.builder()
                .symbol("600519")
                .name("贵州茅台")
                .alertType("急跌")
                .changePct(new BigDecimal("-4.10"))
                .message("贵州茅台 急跌 -4.10%")
                .build();
        when(intradayScanner.scan(false)).thenReturn(IntradayScanResponse.builder()
                .alerts(List.of(alert))
                .scannedCount(2)
                .alertCount(1)
                .hasWatchlist(true)
                .trading(true)
                .build());

        mockMvc.perform(post("/api/agents/intraday/scan"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.alertCount").value(1))
                .andExpect(jsonPath("$.data.hasWatchlist").value(true))
                .andExpect(jsonPath("$.data.trading").value(true))
                .andExpect(jsonPath("$.data.alerts[0].message").value("贵州茅台 急跌 -4.10%"))
                .andExpect(jsonPath("$.data.alerts[0].hasPosition").value(false));
    }

    @Test
    @DisplayName("POST /api/agents/intraday/scan?analyze=true asks for comments")
    void intradayScanWithAnalysis() throws Exception {
        when(intradayScanner.scan(true)).thenReturn(IntradayScanResponse.builder().hasWatchlist(true).build());

        mockMvc.perform(post("/api/agents/intraday/scan").param("analyze", "true"))
                .andExpect(status().isOk());

        verify(intradayScanner).scan(true);
    }
}
