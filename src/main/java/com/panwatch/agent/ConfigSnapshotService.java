package com.panwatch.agent;

import com.panwatch.domain.model.ConfigSnapshot;
import com.panwatch.mapper.AgentConfigMapper;
import com.panwatch.mapper.AiModelMapper;
import com.panwatch.mapper.DataSourceMapper;
import com.panwatch.mapper.NotifyChannelMapper;
import com.panwatch.repository.jpa.AgentConfigJpaRepository;
import com.panwatch.repository.jpa.AiModelJpaRepository;
import com.panwatch.repository.jpa.DataSourceJpaRepository;
import com.panwatch.repository.jpa.NotifyChannelJpaRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Reads the configuration tables into one consistent {@link ConfigSnapshot}. */
@Service
public class ConfigSnapshotService {

    private final AgentConfigJpaRepository agentConfigJpaRepository;
    private final NotifyChannelJpaRepository notifyChannelJpaRepository;
    private final AiModelJpaRepository aiModelJpaRepository;
    private final DataSourceJpaRepository dataSourceJpaRepository;
    private final AgentConfigMapper agentConfigMapper;
    private final NotifyChannelMapper notifyChannelMapper;
    private final AiModelMapper aiModelMapper;
    private final DataSourceMapper dataSourceMapper;
    private final Clock clock;

    public ConfigSnapshotService(
            AgentConfigJpaRepository agentConfigJpaRepository,
            NotifyChannelJpaRepository notifyChannelJpaRepository,
            AiModelJpaRepository aiModelJpaRepository,
            DataSourceJpaRepository dataSourceJpaRepository,
            AgentConfigMapper agentConfigMapper,
            NotifyChannelMapper notifyChannelMapper,
            AiModelMapper aiModelMapper,
            DataSourceMapper dataSourceMapper,
            Clock clock) {
        this.agentConfigJpaRepository = agentConfigJpaRepository;
        this.notifyChannelJpaRepository = notifyChannelJpaRepository;
        this.aiModelJpaRepository = aiModelJpaRepository;
        this.dataSourceJpaRepository = dataSourceJpaRepository;
        this.agentConfigMapper = agentConfigMapper;
        this.notifyChannelMapper = notifyChannelMapper;
        this.aiModelMapper = aiModelMapper;
        this.dataSourceMapper = dataSourceMapper;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public ConfigSnapshot capture() {
        return new ConfigSnapshot(
                LocalDateTime.now(clock),
                agentConfigMapper.toDomainList(agentConfigJpaRepository.findAll()),
                notifyChannelMapper.toDomainList(notifyChannelJpaRepository.findAll()),
                aiModelMapper.toDomainList(aiModelJpaRepository.findAll()),
                dataSourceMapper.toDomainList(dataSourceJpaRepository.findAll()));
    }
}
