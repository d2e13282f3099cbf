package com.panwatch.domain.model;

import com.panwatch.domain.enums.TradingStyle;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Shares of one watchlist instrument held in one account. An account holds at most one
 * position per instrument; prices are in the instrument's own currency.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    private Long id;
    private Long accountId;
    private Long instrumentId;
    private BigDecimal costPrice;
    private int quantity;

    /** Cash put in, when it differs from cost x quantity (fees, averaged buys). */
    private BigDecimal investedAmount;

    @Builder.Default
    private TradingStyle tradingStyle = TradingStyle.SWING;
}
