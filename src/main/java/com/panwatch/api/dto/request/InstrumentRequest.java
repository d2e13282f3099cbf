package com.panwatch.api.dto.request;

import com.panwatch.domain.enums.Market;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InstrumentRequest {

    @NotBlank(message = "Symbol is required")
    @Size(max = 20)
    private String symbol;

    @Size(max = 100)
    private String name;

    @NotNull(message = "Market is required")
    private Market market;

    private Boolean enabled;
}
