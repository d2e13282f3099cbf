package com.panwatch.repository.jpa;

import com.panwatch.domain.enums.DataSourceType;
import com.panwatch.entity.DataSourceEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface DataSourceJpaRepository extends JpaRepository<DataSourceEntity, Long> {

    List<DataSourceEntity> findByTypeOrderByPriorityAsc(DataSourceType type);
}
