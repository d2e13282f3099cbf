package com.panwatch.mapper;

import com.panwatch.domain.model.AgentRun;
import com.panwatch.domain.model.ExecutionLogEntry;
import com.panwatch.domain.model.ThrottleState;
import com.panwatch.entity.AgentRunEntity;
import com.panwatch.entity.ExecutionLogEntity;
import com.panwatch.entity.NotifyThrottleEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper for the run bookkeeping tables: agent runs, execution log rows and
 * throttle state.
 */
@Mapper
public interface ExecutionRecordMapper {

    AgentRunEntity toEntity(AgentRun run);

    AgentRun toDomain(AgentRunEntity entity);

    List<AgentRun> toRunList(List<AgentRunEntity> entities);

    @Mapping(target = "id", ignore = true)
    ExecutionLogEntity toLogEntity(ExecutionLogEntry entry, String runId);

    ExecutionLogEntry toLogEntry(ExecutionLogEntity entity);

    List<ExecutionLogEntry> toLogEntries(List<ExecutionLogEntity> entities);

    ThrottleState toThrottleState(NotifyThrottleEntity entity);

    @Mapping(target = "id", ignore = true)
    NotifyThrottleEntity toThrottleEntity(ThrottleState state);
}
