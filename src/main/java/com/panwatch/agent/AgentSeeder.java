package com.panwatch.agent;

import com.panwatch.entity.AgentConfigEntity;
import com.panwatch.mapper.JsonHelper;
import com.panwatch.repository.jpa.AgentConfigJpaRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Inserts missing built-in agents at startup and re-syncs the fields owned by code
 * (execution mode, display name, description) on existing rows. User-owned fields
 * (enabled, schedule, model, channels, config) are left alone.
 */
@Component
public class AgentSeeder implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(AgentSeeder.class);

    private final AgentConfigJpaRepository agentConfigJpaRepository;
    private final Clock clock;

    public AgentSeeder(AgentConfigJpaRepository agentConfigJpaRepository, Clock clock) {
        this.agentConfigJpaRepository = agentConfigJpaRepository;
        this.clock = clock;
    }

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        seed();
    }

    @Transactional
    public void seed() {
        LocalDateTime now = LocalDateTime.now(clock);
        int inserted = 0;
        for (BuiltinAgent agent : BuiltinAgent.values()) {
            Optional<AgentConfigEntity> existing = agentConfigJpaRepository.findByName(agent.getKey());
            if (existing.isEmpty()) {
                agentConfigJpaRepository.save(AgentConfigEntity.builder()
                        .name(agent.getKey())
                        .displayName(agent.getDisplayName())
                        .description(agent.getDescription())
                        .enabled(agent.isEnabledByDefault())
                        .executionMode(agent.getExecutionMode())
                        .schedule(agent.getDefaultSchedule())
                        .notifyChannelIds(JsonHelper.toJson(List.of()))
                        .config(JsonHelper.toJson(agent.getDefaultConfig()))
                        .createdAt(now)
                        .updatedAt(now)
                        .build());
                inserted++;
            } else {
                AgentConfigEntity entity = existing.get();
                entity.setExecutionMode(agent.getExecutionMode());
                entity.setDisplayName(agent.getDisplayName());
                entity.setDescription(agent.getDescription());
                agentConfigJpaRepository.save(entity);
            }
        }
        log.info("Agent seeding complete: {} inserted, {} total", inserted, BuiltinAgent.values().length);
    }
}
