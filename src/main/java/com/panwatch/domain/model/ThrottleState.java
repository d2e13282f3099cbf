package com.panwatch.domain.model;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Last automatic notification for one (agent, instrument) pair. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThrottleState {

    private String agentName;

    /** Instrument id as text, or "*" for a batch-wide alert. */
    private String instrumentKey;

    private LocalDateTime lastNotifiedAt;

    /** Automatic notifications sent on the day of lastNotifiedAt. */
    private int notifyCount;
}
