package com.panwatch.datasource;

import com.panwatch.domain.enums.DataSourceType;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One unit of market data returned by a provider: a quote, a kline bar series, a news
 * article, a capital-flow summary or a chart image.
 *
 * <p>{@code summary} is the text quoted into prompts; {@code attributes} keeps the structured
 * values (prices, volumes) for agents that format their own tables.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataItem {

    /** Last traded price attribute of QUOTE items. */
    public static final String CURRENT_PRICE = "current_price";

    /** Day change in percent attribute of QUOTE items. */
    public static final String CHANGE_PCT = "change_pct";

    private DataSourceType type;
    private String symbol;
    private String title;
    private String summary;
    private LocalDateTime publishedAt;

    /** Image location for CHART items. */
    private String imageUrl;

    @Builder.Default
    private Map<String, Object> attributes = new HashMap<>();

    /** A numeric attribute, or null when it is absent or does not parse. */
    public BigDecimal decimal(String key) {
        Object value = attributes == null ? null : attributes.get(key);
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return new BigDecimal(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
