package com.panwatch.api.dto.request;

import com.panwatch.domain.enums.TradingStyle;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Create or update body for a position. Account and instrument are required on create and
 * ignored on update; on update a null field is left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PositionRequest {

    private Long accountId;
    private Long instrumentId;

    @Positive
    private BigDecimal costPrice;

    @PositiveOrZero
    private Integer quantity;

    @PositiveOrZero
    private BigDecimal investedAmount;

    private TradingStyle tradingStyle;
}
