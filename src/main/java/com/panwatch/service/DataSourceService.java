package com.panwatch.service;

import com.panwatch.datasource.DataSourceRouter;
import com.panwatch.domain.model.ConnectionTestResult;
import com.panwatch.domain.model.DataSourceBinding;
import com.panwatch.entity.DataSourceEntity;
import com.panwatch.exception.ResourceNotFoundException;
import com.panwatch.mapper.DataSourceMapper;
import com.panwatch.repository.jpa.DataSourceJpaRepository;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** CRUD and connectivity test for data source bindings. */
@Service
public class DataSourceService {

    private static final Logger log = LoggerFactory.getLogger(DataSourceService.class);

    private final DataSourceJpaRepository dataSourceJpaRepository;
    private final DataSourceMapper dataSourceMapper;
    private final DataSourceRouter dataSourceRouter;

    public DataSourceService(
            DataSourceJpaRepository dataSourceJpaRepository,
            DataSourceMapper dataSourceMapper,
            DataSourceRouter dataSourceRouter) {
        this.dataSourceJpaRepository = dataSourceJpaRepository;
        this.dataSourceMapper = dataSourceMapper;
        this.dataSourceRouter = dataSourceRouter;
    }

    @Transactional(readOnly = true)
    public List<DataSourceBinding> getAll() {
        return dataSourceMapper.toDomainList(dataSourceJpaRepository.findAll()).stream()
                .sorted(DataSourceRouter.TRIAL_ORDER)
                .toList();
    }

    @Transactional
    public DataSourceBinding create(DataSourceBinding binding) {
        binding.setId(null);
        DataSourceEntity saved = dataSourceJpaRepository.save(dataSourceMapper.toEntity(binding));
        log.info("Data source created: id={}, type={}, provider={}, priority={}",
                saved.getId(), saved.getType(), saved.getProvider(), saved.getPriority());
        return dataSourceMapper.toDomain(saved);
    }

    @Transactional
    public DataSourceBinding update(Long id, DataSourceBinding updates) {
        find(id);
        updates.setId(id);
        DataSourceEntity saved = dataSourceJpaRepository.save(dataSourceMapper.toEntity(updates));
        log.info("Data source updated: id={}, enabled={}, priority={}", saved.getId(), saved.isEnabled(), saved.getPriority());
        return dataSourceMapper.toDomain(saved);
    }

    @Transactional
    public void delete(Long id) {
        find(id);
        dataSourceJpaRepository.deleteById(id);
        log.info("Data source deleted: id={}", id);
    }

    /** Fetches the binding's test symbols through its provider; never throws for provider failures. */
    public ConnectionTestResult test(Long id) {
        DataSourceBinding binding = dataSourceMapper.toDomain(find(id));
        return dataSourceRouter.test(binding);
    }

    private DataSourceEntity find(Long id) {
        return dataSourceJpaRepository.findById(id).orElseThrow(() -> new ResourceNotFoundException("Data source", id));
    }
}
