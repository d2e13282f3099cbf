package com.panwatch.observability;

import com.panwatch.domain.model.ExecutionLogEntry;
import com.panwatch.entity.ExecutionLogEntity;
import com.panwatch.mapper.ExecutionRecordMapper;
import com.panwatch.repository.jpa.ExecutionLogJpaRepository;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Persists run trails to execution_logs and serves them back to the log viewer.
 * Rows are only ever inserted or cleared in bulk.
 */
@Service
public class ExecutionLogService {

    private static final Logger log = LoggerFactory.getLogger(ExecutionLogService.class);

    private final ExecutionLogJpaRepository executionLogJpaRepository;
    private final ExecutionRecordMapper executionRecordMapper;

    public ExecutionLogService(
            ExecutionLogJpaRepository executionLogJpaRepository, ExecutionRecordMapper executionRecordMapper) {
        this.executionLogJpaRepository = executionLogJpaRepository;
        this.executionRecordMapper = executionRecordMapper;
    }

    @Transactional
    public void save(ExecutionTrail trail) {
        List<ExecutionLogEntity> rows = trail.entries().stream()
                .map(entry -> executionRecordMapper.toLogEntity(entry, trail.getRunId()))
                .toList();
        executionLogJpaRepository.saveAll(rows);
        log.debug("Persisted {} log entries for run {}", rows.size(), trail.getRunId());
    }

    @Transactional(readOnly = true)
    public List<ExecutionLogEntry> findByRun(String runId) {
        return executionRecordMapper.toLogEntries(executionLogJpaRepository.findByRunIdOrderByIdAsc(runId));
    }

    /** Most recent entries across all runs, newest first. */
    @Transactional(readOnly = true)
    public List<ExecutionLogEntry> findRecent(int limit) {
        return executionRecordMapper.toLogEntries(
                executionLogJpaRepository.findAllByOrderByIdDesc(PageRequest.of(0, Math.max(1, limit))));
    }

    @Transactional
    public long clear() {
        long count = executionLogJpaRepository.count();
        executionLogJpaRepository.deleteAllInBatch();
        log.info("Cleared {} execution log entries", count);
        return count;
    }
}
