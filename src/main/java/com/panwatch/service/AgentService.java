package com.panwatch.service;

import com.panwatch.agent.AgentRunResult;
import com.panwatch.api.dto.request.AgentUpdateRequest;
import com.panwatch.core.engine.AgentScheduler;
import com.panwatch.domain.model.AgentDefinition;
import com.panwatch.domain.model.AgentRun;
import com.panwatch.domain.model.RuntimeOverride;
import com.panwatch.entity.AgentConfigEntity;
import com.panwatch.exception.ResourceNotFoundException;
import com.panwatch.mapper.AgentConfigMapper;
import com.panwatch.repository.jpa.AgentConfigJpaRepository;
import com.panwatch.repository.jpa.AiModelJpaRepository;
import com.panwatch.repository.jpa.NotifyChannelJpaRepository;
import com.panwatch.schedule.CronSchedule;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Agent configuration and manual runs.
 *
 * <p>The agent set itself is fixed (seeded at startup); this service only edits the
 * user-facing fields: enabled flag, default schedule, AI model, channels and parameters.
 */
@Service
public class AgentService {

    private static final Logger log = LoggerFactory.getLogger(AgentService.class);

    private final AgentConfigJpaRepository agentConfigJpaRepository;
    private final AiModelJpaRepository aiModelJpaRepository;
    private final NotifyChannelJpaRepository notifyChannelJpaRepository;
    private final AgentConfigMapper agentConfigMapper;
    private final AgentRunService agentRunService;
    private final AgentScheduler agentScheduler;
    private final Clock clock;

    public AgentService(
            AgentConfigJpaRepository agentConfigJpaRepository,
            AiModelJpaRepository aiModelJpaRepository,
            NotifyChannelJpaRepository notifyChannelJpaRepository,
            AgentConfigMapper agentConfigMapper,
            AgentRunService agentRunService,
            AgentScheduler agentScheduler,
            Clock clock) {
        this.agentConfigJpaRepository = agentConfigJpaRepository;
        this.aiModelJpaRepository = aiModelJpaRepository;
        this.notifyChannelJpaRepository = notifyChannelJpaRepository;
        this.agentConfigMapper = agentConfigMapper;
        this.agentRunService = agentRunService;
        this.agentScheduler = agentScheduler;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<AgentDefinition> getAll() {
        return agentConfigMapper.toDomainList(agentConfigJpaRepository.findAll()).stream()
                .sorted((a, b) -> a.getName().compareTo(b.getName()))
                .toList();
    }

    @Transactional(readOnly = true)
    public AgentDefinition get(String name) {
        return agentConfigMapper.toDomain(find(name));
    }

    /**
     * Applies the non-null fields of {@code request}. A schedule that parses to the same
     * normalized form as the stored one leaves the stored text untouched.
     *
     * @throws com.panwatch.exception.InvalidScheduleException if the new schedule does not parse
     * @throws ResourceNotFoundException if the agent, model or a channel does not exist
     */
    @Transactional
    public AgentDefinition update(String name, AgentUpdateRequest updates) {
        AgentDefinition existing = agentConfigMapper.toDomain(find(name));

        if (updates.getSchedule() != null) {
            CronSchedule requested = CronSchedule.parse(updates.getSchedule());
            boolean unchanged = CronSchedule.tryParse(existing.getSchedule())
                    .map(requested::equals)
                    .orElse(false);
            if (!unchanged) {
                existing.setSchedule(updates.getSchedule().trim());
            }
        }
        if (updates.getAiModelId() != null) {
            if (!aiModelJpaRepository.existsById(updates.getAiModelId())) {
                throw new ResourceNotFoundException("AI model", updates.getAiModelId());
            }
            existing.setAiModelId(updates.getAiModelId());
        }
        if (updates.getNotifyChannelIds() != null) {
            existing.setNotifyChannelIds(validChannelIds(updates.getNotifyChannelIds()));
        }
        if (updates.getConfig() != null) {
            existing.setConfig(updates.getConfig());
        }
        if (updates.getEnabled() != null) {
            existing.setEnabled(updates.getEnabled());
        }
        existing.setUpdatedAt(LocalDateTime.now(clock));

        AgentConfigEntity saved = agentConfigJpaRepository.save(agentConfigMapper.toEntity(existing));
        log.info("Agent updated: name={}, enabled={}, schedule={}, aiModelId={}, channels={}",
                saved.getName(), saved.isEnabled(), saved.getSchedule(), saved.getAiModelId(),
                existing.getNotifyChannelIds());
        return agentConfigMapper.toDomain(saved);
    }

    /** Runs the agent over all of its enrolled instruments now. */
    public List<AgentRunResult> trigger(String name, boolean bypassThrottle) {
        find(name);
        log.info("Manual trigger: agent={}, bypassThrottle={}", name, bypassThrottle);
        return agentScheduler.runAgentNow(name, RuntimeOverride.manual(bypassThrottle));
    }

    public List<AgentRun> history(String name, int limit) {
        find(name);
        return agentRunService.history(name, limit);
    }

    private AgentConfigEntity find(String name) {
        return agentConfigJpaRepository.findByName(name).orElseThrow(() -> new ResourceNotFoundException("Agent", name));
    }

    private List<Long> validChannelIds(List<Long> ids) {
        List<Long> result = new ArrayList<>(new LinkedHashSet<>(ids));
        for (Long id : result) {
            if (!notifyChannelJpaRepository.existsById(id)) {
                throw new ResourceNotFoundException("Notify channel", id);
            }
        }
        return result;
    }
}
