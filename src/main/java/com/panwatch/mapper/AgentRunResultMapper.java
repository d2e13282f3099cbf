package com.panwatch.mapper;

import com.panwatch.agent.AgentRunResult;
import com.panwatch.api.dto.response.AgentRunResponse;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper
public interface AgentRunResultMapper {

    @Mapping(source = "dispatch.status", target = "dispatchStatus")
    @Mapping(source = "dispatch.channelResults", target = "channelResults")
    AgentRunResponse toResponse(AgentRunResult result);

    List<AgentRunResponse> toResponseList(List<AgentRunResult> results);
}
