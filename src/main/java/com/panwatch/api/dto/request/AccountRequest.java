package com.panwatch.api.dto.request;

import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Create or update body for an account; on update a null field is left unchanged. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountRequest {

    @Size(max = 100)
    private String name;

    @PositiveOrZero
    private BigDecimal availableFunds;

    private Boolean enabled;
}
