package com.panwatch.datasource;

import com.panwatch.domain.model.DataSourceBinding;
import com.panwatch.domain.model.ExecutionLogEntry;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Items from the first binding that succeeded, plus the trail of every attempt. */
@Value
@Builder
public class FetchResult {

    DataSourceBinding binding;
    List<DataItem> items;
    List<ExecutionLogEntry> logs;
    long durationMs;
}
