package com.panwatch.api.dto.request;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Symbol and market are immutable; null fields are left unchanged. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InstrumentUpdateRequest {

    @Size(max = 100)
    private String name;

    private Boolean enabled;
}
