package com.panwatch.repository.jpa;

import com.panwatch.entity.PositionEntity;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the positions table.
 * Positions are read per account and instrument by the API and per instrument set by runs.
 */
@Repository
public interface PositionJpaRepository extends JpaRepository<PositionEntity, Long> {

    List<PositionEntity> findByAccountId(Long accountId);

    List<PositionEntity> findByInstrumentId(Long instrumentId);

    List<PositionEntity> findByAccountIdAndInstrumentId(Long accountId, Long instrumentId);

    List<PositionEntity> findByAccountIdInAndInstrumentIdIn(Collection<Long> accountIds, Collection<Long> instrumentIds);

    boolean existsByAccountIdAndInstrumentId(Long accountId, Long instrumentId);

    @Modifying
    void deleteByAccountId(Long accountId);

    @Modifying
    void deleteByInstrumentId(Long instrumentId);
}
