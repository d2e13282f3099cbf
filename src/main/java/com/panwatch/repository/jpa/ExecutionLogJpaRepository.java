package com.panwatch.repository.jpa;

import com.panwatch.entity.ExecutionLogEntity;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ExecutionLogJpaRepository extends JpaRepository<ExecutionLogEntity, Long> {

    List<ExecutionLogEntity> findByRunIdOrderByIdAsc(String runId);

    List<ExecutionLogEntity> findAllByOrderByIdDesc(Pageable pageable);
}
