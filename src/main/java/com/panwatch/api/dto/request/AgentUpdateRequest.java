package com.panwatch.api.dto.request;

import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update of an agent. Null fields keep their current value; an empty channel list
 * means "use the installation default channel".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentUpdateRequest {

    private Boolean enabled;

    /** Five-field cron expression, e.g. "30 15 * * 1-5". */
    @Size(max = 100)
    private String schedule;

    private Long aiModelId;

    private List<Long> notifyChannelIds;

    private Map<String, Object> config;
}
