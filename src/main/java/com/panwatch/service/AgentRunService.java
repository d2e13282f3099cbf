package com.panwatch.service;

import com.panwatch.domain.enums.ExecutionState;
import com.panwatch.domain.model.AgentRun;
import com.panwatch.entity.AgentRunEntity;
import com.panwatch.mapper.ExecutionRecordMapper;
import com.panwatch.repository.jpa.AgentRunJpaRepository;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Run history of agents: written once per finished run, read newest first. */
@Service
public class AgentRunService {

    private final AgentRunJpaRepository agentRunJpaRepository;
    private final ExecutionRecordMapper executionRecordMapper;

    public AgentRunService(AgentRunJpaRepository agentRunJpaRepository, ExecutionRecordMapper executionRecordMapper) {
        this.agentRunJpaRepository = agentRunJpaRepository;
        this.executionRecordMapper = executionRecordMapper;
    }

    @Transactional
    public AgentRun save(AgentRun run) {
        AgentRunEntity saved = agentRunJpaRepository.save(executionRecordMapper.toEntity(run));
        return executionRecordMapper.toDomain(saved);
    }

    @Transactional(readOnly = true)
    public List<AgentRun> history(String agentName, int limit) {
        return executionRecordMapper.toRunList(agentRunJpaRepository.findByAgentNameOrderByCreatedAtDescIdDesc(
                agentName, PageRequest.of(0, Math.max(1, Math.min(limit, 200)))));
    }

    /** Content of the most recent successful run of an agent, if any. */
    @Transactional(readOnly = true)
    public Optional<String> latestContent(String agentName) {
        return agentRunJpaRepository.findByAgentNameOrderByCreatedAtDescIdDesc(agentName, PageRequest.of(0, 10)).stream()
                .filter(run -> run.getStatus() == ExecutionState.DONE)
                .map(AgentRunEntity::getContent)
                .filter(content -> content != null && !content.isBlank())
                .findFirst();
    }
}
