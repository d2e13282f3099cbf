package com.panwatch.repository.jpa;

import com.panwatch.entity.NotifyThrottleEntity;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** JPA repository for notify_throttles, keyed by (agent_name, instrument_key). */
@Repository
public interface NotifyThrottleJpaRepository extends JpaRepository<NotifyThrottleEntity, Long> {

    Optional<NotifyThrottleEntity> findByAgentNameAndInstrumentKey(String agentName, String instrumentKey);
}
