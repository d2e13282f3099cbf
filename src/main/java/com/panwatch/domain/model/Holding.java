package com.panwatch.domain.model;

import com.panwatch.domain.enums.TradingStyle;
import java.math.BigDecimal;
import java.math.RoundingMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A position joined with its account and instrument, as listed by the API and quoted in prompts. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Holding {

    private Long positionId;
    private Long accountId;
    private String accountName;
    private Long instrumentId;
    private String symbol;
    private String instrumentName;
    private BigDecimal costPrice;
    private int quantity;
    private BigDecimal investedAmount;
    private TradingStyle tradingStyle;

    public BigDecimal marketValue(BigDecimal price) {
        return price.multiply(BigDecimal.valueOf(quantity));
    }

    /** Unrealised gain against cost in percent, or null when the cost price is not positive. */
    public BigDecimal pnlPercent(BigDecimal price) {
        if (costPrice == null || costPrice.signum() <= 0) {
            return null;
        }
        return price.subtract(costPrice)
                .multiply(BigDecimal.valueOf(100))
                .divide(costPrice, 2, RoundingMode.HALF_UP);
    }
}
