package com.panwatch.domain.model;

import com.panwatch.domain.enums.ExecutionState;
import com.panwatch.domain.enums.FailureReason;
import com.panwatch.domain.enums.SuggestionAction;
import com.panwatch.domain.enums.TriggerSource;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Persisted summary of one agent execution, shown in the agent history view.
 * {@code instrumentId} is null for batch runs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentRun {

    private Long id;
    private String runId;
    private String agentName;
    private Long instrumentId;
    private TriggerSource trigger;
    private ExecutionState status;
    private FailureReason failureReason;
    private SuggestionAction action;
    private boolean shouldAlert;
    private boolean notified;
    private String content;
    private String error;
    private long durationMs;
    private LocalDateTime createdAt;
}
