package com.panwatch.domain.model;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A brokerage account the user holds positions in. Disabled accounts are left out of prompts. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Account {

    private Long id;
    private String name;

    @Builder.Default
    private BigDecimal availableFunds = BigDecimal.ZERO;

    @Builder.Default
    private boolean enabled = true;
}
