package com.panwatch.api.dto.request;

import com.panwatch.domain.enums.DataSourceType;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataSourceRequest {

    @NotBlank(message = "Name is required")
    private String name;

    @NotNull(message = "Type is required")
    private DataSourceType type;

    /** Registered DataProvider id (e.g., "xueqiu"). */
    @NotBlank(message = "Provider is required")
    private String provider;

    /** Lower is tried first. */
    @Min(0)
    private int priority;

    private boolean supportsBatch;

    private Boolean enabled;

    private List<String> testSymbols;

    private Map<String, Object> config;
}
