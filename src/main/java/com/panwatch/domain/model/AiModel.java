package com.panwatch.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An AI model the analysis step can be pointed at. {@code providerId} selects the
 * AnalysisProvider implementation; {@code model} is passed through to it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AiModel {

    private Long id;
    private String name;
    private String providerId;
    private String model;
    private boolean defaultModel;

    public String label() {
        return providerId + "/" + model;
    }
}
