package com.panwatch.agent;

import com.panwatch.domain.enums.ExecutionState;
import com.panwatch.domain.enums.FailureReason;
import com.panwatch.domain.enums.TriggerSource;
import com.panwatch.domain.model.ExecutionLogEntry;
import com.panwatch.domain.model.Suggestion;
import com.panwatch.notification.DispatchOutcome;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one run. {@code instrumentId} is null for a batch run; {@code suggestions} then
 * holds one entry per enrolled instrument.
 */
@Value
@Builder
public class AgentRunResult {

    String runId;
    String agentName;
    Long instrumentId;
    TriggerSource trigger;
    ExecutionState state;
    FailureReason failureReason;
    String error;
    String content;
    Map<Long, Suggestion> suggestions;
    DispatchOutcome dispatch;
    boolean notified;
    long durationMs;
    List<ExecutionLogEntry> logs;

    public boolean isSuccess() {
        return state == ExecutionState.DONE;
    }
}
