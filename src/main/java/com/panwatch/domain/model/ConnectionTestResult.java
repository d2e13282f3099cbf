package com.panwatch.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Result of a manual "test" of a data source, channel or model, as shown in the settings UI.
 * {@code count} is the number of items fetched or channels delivered to.
 */
@Value
@Builder
public class ConnectionTestResult {

    boolean success;
    int count;
    long durationMs;
    String error;
    List<ExecutionLogEntry> logs;
}
