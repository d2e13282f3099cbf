package com.panwatch.repository.jpa;

import com.panwatch.entity.AgentConfigEntity;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** JPA repository for the agent_configs table. */
@Repository
public interface AgentConfigJpaRepository extends JpaRepository<AgentConfigEntity, Long> {

    Optional<AgentConfigEntity> findByName(String name);

    List<AgentConfigEntity> findByEnabledTrue();

    boolean existsByName(String name);
}
