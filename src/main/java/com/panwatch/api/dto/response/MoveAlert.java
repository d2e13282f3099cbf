package com.panwatch.api.dto.response;

import com.panwatch.domain.enums.TradingStyle;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One watchlist stock whose day change crossed the alert threshold. Position fields come from
 * the first enabled account holding it and are null when nobody does.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MoveAlert {

    private Long instrumentId;
    private String symbol;
    private String name;

    /** 急涨 or 急跌. */
    private String alertType;

    private BigDecimal currentPrice;
    private BigDecimal changePct;
    private String message;
    private boolean hasPosition;
    private BigDecimal costPrice;
    private BigDecimal pnlPct;
    private TradingStyle tradingStyle;

    /** Short AI comment, only when analysis was requested and the stock is held. */
    private String suggestion;
}
