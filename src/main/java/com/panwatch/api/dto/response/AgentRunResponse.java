package com.panwatch.api.dto.response;

import com.panwatch.domain.enums.DispatchStatus;
import com.panwatch.domain.enums.ExecutionState;
import com.panwatch.domain.enums.FailureReason;
import com.panwatch.domain.enums.TriggerSource;
import com.panwatch.domain.model.ExecutionLogEntry;
import com.panwatch.domain.model.Suggestion;
import com.panwatch.notification.ChannelResult;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Result of a manual trigger as shown by the UI: final state, per-instrument suggestions,
 * notification outcome and the full log trail of the run.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AgentRunResponse {

    private String runId;
    private String agentName;
    private Long instrumentId;
    private TriggerSource trigger;
    private ExecutionState state;
    private FailureReason failureReason;
    private String error;
    private String content;
    private Map<Long, Suggestion> suggestions;
    private DispatchStatus dispatchStatus;
    private List<ChannelResult> channelResults;
    private boolean notified;
    private long durationMs;
    private List<ExecutionLogEntry> logs;
}
