package com.panwatch.repository.jpa;

import com.panwatch.entity.AgentRunEntity;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** JPA repository for agent_runs; history is read newest first. */
@Repository
public interface AgentRunJpaRepository extends JpaRepository<AgentRunEntity, Long> {

    List<AgentRunEntity> findByAgentNameOrderByCreatedAtDescIdDesc(String agentName, Pageable pageable);
}
