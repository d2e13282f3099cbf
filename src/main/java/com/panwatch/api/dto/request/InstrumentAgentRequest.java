package com.panwatch.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One agent enrolment of an instrument. Blank schedule, null model and an empty channel
 * list inherit the agent's defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InstrumentAgentRequest {

    @NotBlank(message = "Agent name is required")
    private String agentName;

    @Size(max = 100)
    private String schedule;

    private Long aiModelId;

    private List<Long> notifyChannelIds;
}
