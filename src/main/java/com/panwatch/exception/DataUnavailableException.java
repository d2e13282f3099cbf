package com.panwatch.exception;

import com.panwatch.domain.model.ExecutionLogEntry;
import java.util.List;

/**
 * Every provider bound to a data type failed. Carries the full attempt trail so the caller
 * can show exactly which providers were tried and why each one failed.
 */
public class DataUnavailableException extends BaseException {

    private final List<ExecutionLogEntry> logs;

    public DataUnavailableException(String message, List<ExecutionLogEntry> logs) {
        super(ErrorCode.DATA_UNAVAILABLE, message);
        this.logs = logs != null ? List.copyOf(logs) : List.of();
    }

    public List<ExecutionLogEntry> getLogs() {
        return logs;
    }
}
