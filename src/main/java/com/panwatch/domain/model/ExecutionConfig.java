package com.panwatch.domain.model;

import com.panwatch.domain.enums.ExecutionMode;
import com.panwatch.schedule.CronSchedule;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Effective configuration of one (agent, instrument) run after layering runtime override,
 * binding override and agent defaults. {@code instrumentId} is null for a batch run.
 */
@Value
@Builder
public class ExecutionConfig {

    String agentName;
    Long instrumentId;
    CronSchedule schedule;
    Long aiModelId;
    List<NotifyChannel> notifyChannels;
    ExecutionMode executionMode;
    boolean bypassThrottle;

    public boolean canNotify() {
        return notifyChannels != null && !notifyChannels.isEmpty();
    }
}
