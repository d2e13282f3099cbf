package com.panwatch.repository.jpa;

import com.panwatch.entity.InstrumentAgentEntity;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the instrument_agents table.
 * Bindings are read per agent by the scheduler and per instrument by the API.
 */
@Repository
public interface InstrumentAgentJpaRepository extends JpaRepository<InstrumentAgentEntity, Long> {

    List<InstrumentAgentEntity> findByInstrumentId(Long instrumentId);

    List<InstrumentAgentEntity> findByAgentName(String agentName);

    Optional<InstrumentAgentEntity> findByInstrumentIdAndAgentName(Long instrumentId, String agentName);

    @Modifying
    void deleteByInstrumentId(Long instrumentId);
}
