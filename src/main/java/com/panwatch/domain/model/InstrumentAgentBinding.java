package com.panwatch.domain.model;

import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Enrolment of one instrument in one agent, optionally overriding the agent defaults.
 * Blank schedule, null model and empty channel list all mean "inherit".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InstrumentAgentBinding {

    private Long id;
    private Long instrumentId;
    private String agentName;
    private String schedule;
    private Long aiModelId;

    @Builder.Default
    private List<Long> notifyChannelIds = new ArrayList<>();

    public boolean hasScheduleOverride() {
        return schedule != null && !schedule.isBlank();
    }

    public boolean hasChannelOverride() {
        return notifyChannelIds != null && !notifyChannelIds.isEmpty();
    }
}
