package com.panwatch.api.controller;

import com.panwatch.domain.model.ExecutionLogEntry;
import com.panwatch.observability.ExecutionLogService;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for execution logs. With {@code runId} returns that run's trail in order,
 * otherwise the most recent entries across runs.
 */
@RestController
@RequestMapping("/api/logs")
public class LogController {

    private static final int MAX_LIMIT = 1000;

    private final ExecutionLogService executionLogService;

    public LogController(ExecutionLogService executionLogService) {
        this.executionLogService = executionLogService;
    }

    @GetMapping
    public List<ExecutionLogEntry> getLogs(
            @RequestParam(required = false) String runId, @RequestParam(defaultValue = "200") int limit) {
        if (runId != null && !runId.isBlank()) {
            return executionLogService.findByRun(runId);
        }
        return executionLogService.findRecent(Math.min(limit, MAX_LIMIT));
    }

    @DeleteMapping
    public Map<String, Long> clear() {
        return Map.of("deleted", executionLogService.clear());
    }
}
