package com.panwatch.domain.model;

import com.panwatch.domain.enums.ExecutionMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A schedulable analysis agent with its default configuration.
 *
 * <p>The set of agents is fixed at startup (see BuiltinAgent); users only toggle them and
 * change the default schedule, AI model and notification channels. Per-instrument
 * overrides live in {@link InstrumentAgentBinding}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentDefinition {

    private Long id;

    /** Unique agent key (e.g., "intraday_monitor"). */
    private String name;

    private String displayName;
    private String description;
    private boolean enabled;
    private ExecutionMode executionMode;

    /** Default five-field cron expression. */
    private String schedule;

    /** Default AI model; null means fall back to the installation default model. */
    private Long aiModelId;

    /** Default channels in notification order; empty means the installation default channel. */
    @Builder.Default
    private List<Long> notifyChannelIds = new ArrayList<>();

    /** Free-form agent parameters (thresholds etc.). */
    @Builder.Default
    private Map<String, Object> config = new HashMap<>();

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
