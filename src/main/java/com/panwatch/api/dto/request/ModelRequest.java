package com.panwatch.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelRequest {

    @NotBlank(message = "Name is required")
    private String name;

    /** Registered AnalysisProvider id. */
    @NotBlank(message = "Provider is required")
    private String providerId;

    @NotBlank(message = "Model is required")
    private String model;

    private boolean defaultModel;
}
