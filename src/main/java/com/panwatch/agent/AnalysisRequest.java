package com.panwatch.agent;

import com.panwatch.domain.model.AiModel;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Prompt pair plus optional images, addressed to one configured model. */
@Value
@Builder
public class AnalysisRequest {

    AiModel model;
    String systemPrompt;
    String userPrompt;

    @Builder.Default
    List<String> imageUrls = List.of();
}
