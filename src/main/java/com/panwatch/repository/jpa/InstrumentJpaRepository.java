package com.panwatch.repository.jpa;

import com.panwatch.domain.enums.Market;
import com.panwatch.entity.InstrumentEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface InstrumentJpaRepository extends JpaRepository<InstrumentEntity, Long> {

    List<InstrumentEntity> findByEnabledTrue();

    boolean existsBySymbolAndMarket(String symbol, Market market);
}
