package com.panwatch.unit.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.panwatch.api.dto.request.AgentUpdateRequest;
import com.panwatch.core.engine.AgentScheduler;
import com.panwatch.domain.enums.ExecutionMode;
import com.panwatch.domain.model.AgentDefinition;
import com.panwatch.domain.model.RuntimeOverride;
import com.panwatch.entity.AgentConfigEntity;
import com.panwatch.exception.InvalidScheduleException;
import com.panwatch.exception.ResourceNotFoundException;
import com.panwatch.mapper.AgentConfigMapper;
import com.panwatch.repository.jpa.AgentConfigJpaRepository;
import com.panwatch.repository.jpa.AiModelJpaRepository;
import com.panwatch.repository.jpa.NotifyChannelJpaRepository;
import com.panwatch.service.AgentRunService;
import com.panwatch.service.AgentService;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class AgentServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 6, 3, 12, 0);

    @Mock
    private AgentConfigJpaRepository agentConfigJpaRepository;

    @Mock
    private AiModelJpaRepository aiModelJpaRepository;

    @Mock
    private NotifyChannelJpaRepository notifyChannelJpaRepository;

    @Mock
    private AgentRunService agentRunService;

    @Mock
    private AgentScheduler agentScheduler;

    private AgentService agentService;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        ZoneId zone = ZoneId.of("Asia/Shanghai");
        agentService = new AgentService(
                agentConfigJpaRepository,
                aiModelJpaRepository,
                notifyChannelJpaRepository,
                Mappers.getMapper(AgentConfigMapper.class),
                agentRunService,
                agentScheduler,
                Clock.fixed(ZonedDateTime.of(NOW, zone).toInstant(), zone));

        when(agentConfigJpaRepository.findByName(anyString())).thenReturn(Optional.empty());
        when(agentConfigJpaRepository.findByName("intraday_monitor")).thenReturn(Optional.of(stored()));
        when(agentConfigJpaRepository.save(any(AgentConfigEntity.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private static AgentConfigEntity stored() {
        return AgentConfigEntity.builder()
                .id(2L)
                .name("intraday_monitor")
                .displayName("盘中监测")
                .enabled(true)
                .executionMode(ExecutionMode.SINGLE)
                .schedule("*/5 9-15 * * 1-5")
                .notifyChannelIds("[]")
                .config("{\"price_alert_threshold\":3.0}")
                .build();
    }

    private AgentConfigEntity saved() {
        ArgumentCaptor<AgentConfigEntity> captor = ArgumentCaptor.forClass(AgentConfigEntity.class);
        verify(agentConfigJpaRepository).save(captor.capture());
        return captor.getValue();
    }

    @Test
    @DisplayName("An equivalent schedule keeps the stored text")
    void equivalentScheduleIsNoOp() {
        agentService.update("intraday_monitor",
                AgentUpdateRequest.builder().schedule("*/5  9-15 * * 1,2,3,4,5").build());

        assertThat(saved().getSchedule()).isEqualTo("*/5 9-15 * * 1-5");
    }

    @Test
    void newScheduleIsStoredTrimmed() {
        AgentDefinition updated = agentService.update("intraday_monitor",
                AgentUpdateRequest.builder().schedule("  */10 9-15 * * 1-5 ").build());

        assertThat(updated.getSchedule()).isEqualTo("*/10 9-15 * * 1-5");
        assertThat(updated.getUpdatedAt()).isEqualTo(NOW);
    }

    @Test
    void invalidScheduleIsRejectedWithoutSaving() {
        AgentUpdateRequest request = AgentUpdateRequest.builder().schedule("*/5 25 * * *").build();

        assertThatThrownBy(() -> agentService.update("intraday_monitor", request))
                .isInstanceOf(InvalidScheduleException.class);
        verify(agentConfigJpaRepository, never()).save(any());
    }

    @Test
    @DisplayName("Omitted fields are left unchanged")
    void partialUpdateKeepsOtherFields() {
        AgentDefinition updated = agentService.update("intraday_monitor",
                AgentUpdateRequest.builder().enabled(false).build());

        assertThat(updated.isEnabled()).isFalse();
        assertThat(updated.getSchedule()).isEqualTo("*/5 9-15 * * 1-5");
        assertThat(updated.getConfig()).containsEntry("price_alert_threshold", 3.0);
    }

    @Test
    void channelIdsAreDedupedInOrder() {
        when(notifyChannelJpaRepository.existsById(any())).thenReturn(true);

        AgentDefinition updated = agentService.update("intraday_monitor",
                AgentUpdateRequest.builder().notifyChannelIds(List.of(3L, 1L, 3L)).build());

        assertThat(updated.getNotifyChannelIds()).containsExactly(3L, 1L);
    }

    @Test
    void unknownChannelIsRejected() {
        when(notifyChannelJpaRepository.existsById(9L)).thenReturn(false);
        AgentUpdateRequest request = AgentUpdateRequest.builder().notifyChannelIds(List.of(9L)).build();

        assertThatThrownBy(() -> agentService.update("intraday_monitor", request))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void unknownModelIsRejected() {
        when(aiModelJpaRepository.existsById(5L)).thenReturn(false);
        AgentUpdateRequest request = AgentUpdateRequest.builder().aiModelId(5L).build();

        assertThatThrownBy(() -> agentService.update("intraday_monitor", request))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void configIsReplacedWholesale() {
        AgentDefinition updated = agentService.update("intraday_monitor",
                AgentUpdateRequest.builder().config(Map.of("throttle_minutes", 10)).build());

        assertThat(updated.getConfig()).containsOnlyKeys("throttle_minutes");
    }

    @Test
    void triggerDelegatesWithManualOverride() {
        agentService.trigger("intraday_monitor", false);

        verify(agentScheduler).runAgentNow("intraday_monitor", RuntimeOverride.manual(false));
    }

    @Test
    void unknownAgentIsNotFound() {
        assertThatThrownBy(() -> agentService.trigger("nope", true)).isInstanceOf(ResourceNotFoundException.class);
        verify(agentScheduler, never()).runAgentNow(any(), any());
    }
}
