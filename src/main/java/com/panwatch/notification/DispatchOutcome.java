package com.panwatch.notification;

import com.panwatch.domain.enums.DispatchStatus;
import com.panwatch.domain.model.ExecutionLogEntry;
import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DispatchOutcome {

    DispatchStatus status;
    List<ChannelResult> channelResults;
    List<ExecutionLogEntry> logs;

    public boolean isDelivered() {
        return status == DispatchStatus.DELIVERED || status == DispatchStatus.PARTIAL;
    }

    public long deliveredCount() {
        return channelResults.stream().filter(ChannelResult::isSuccess).count();
    }

    /** Status of an attempted fan-out from its per-channel results. */
    static DispatchStatus summarize(List<ChannelResult> results) {
        long ok = results.stream().filter(ChannelResult::isSuccess).count();
        if (ok == results.size()) {
            return DispatchStatus.DELIVERED;
        }
        return ok == 0 ? DispatchStatus.FAILED : DispatchStatus.PARTIAL;
    }
}
