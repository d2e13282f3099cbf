package com.panwatch.agent;

import com.panwatch.config.AnalysisProperties;
import com.panwatch.datasource.DataItem;
import com.panwatch.domain.enums.DataSourceType;
import com.panwatch.domain.enums.ExecutionMode;
import com.panwatch.domain.model.AiModel;
import com.panwatch.domain.model.Holding;
import com.panwatch.domain.model.Instrument;
import com.panwatch.domain.model.Portfolio;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.springframework.stereotype.Component;

/**
 * Builds the system and user prompts of a run from the agent's instructions, the fetched
 * data, the user's holdings and excerpts of earlier analyses by related agents.
 *
 * <p>Each instrument section states whether it is held. Held instruments list every enabled
 * account's cost, quantity and style; market value and floating P&L are added when the run
 * fetched a quote carrying {@link DataItem#CURRENT_PRICE}.
 */
@Component
public class PromptComposer {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    static final String SINGLE_FORMAT = "\n\n回复格式：第一行写「建议：买入/加仓/减仓/卖出/持有/观望」之一，随后给出理由。"
            + "如果没有值得提醒用户的信号，请以 [无需提醒] 开头。";

    static final String BATCH_FORMAT = "\n\n回复格式：每只股票单独一节，以「## 股票名称（代码）」开头，"
            + "节内包含一行「建议：买入/加仓/减仓/卖出/持有/观望」并说明理由。"
            + "没有值得提醒信号的股票，在该节内注明 [无需提醒]。";

    private static final Map<DataSourceType, String> SECTION_TITLES = Map.of(
            DataSourceType.QUOTE, "行情",
            DataSourceType.KLINE, "K 线",
            DataSourceType.CAPITAL_FLOW, "资金流向",
            DataSourceType.NEWS, "相关新闻",
            DataSourceType.CHART, "K 线图");

    private static final List<DataSourceType> SECTION_ORDER = List.of(
            DataSourceType.QUOTE, DataSourceType.KLINE, DataSourceType.CAPITAL_FLOW, DataSourceType.NEWS, DataSourceType.CHART);

    private final AnalysisProperties analysisProperties;

    public PromptComposer(AnalysisProperties analysisProperties) {
        this.analysisProperties = analysisProperties;
    }

    public AnalysisRequest compose(
            BuiltinAgent agent,
            ExecutionMode mode,
            AiModel model,
            List<Instrument> instruments,
            CollectedData data,
            Portfolio portfolio,
            Map<String, String> previousAnalyses,
            LocalDateTime now) {
        String system = agent.getInstructions() + (mode == ExecutionMode.BATCH ? BATCH_FORMAT : SINGLE_FORMAT);

        StringBuilder user = new StringBuilder();
        user.append("## 时间：").append(now.format(TIME_FORMAT)).append('\n');

        for (Instrument instrument : instruments) {
            user.append("\n## ").append(displayName(instrument)).append('\n');
            appendHoldings(user, portfolio.holdingsFor(instrument.getId()), currentPrice(data, instrument));
            for (DataSourceType type : SECTION_ORDER) {
                List<DataItem> items = data.forSymbol(type, instrument.getSymbol());
                if (items.isEmpty() || type == DataSourceType.CHART) {
                    continue;
                }
                user.append("### ").append(SECTION_TITLES.get(type)).append('\n');
                for (DataItem item : items) {
                    user.append("- ").append(describe(item)).append('\n');
                }
            }
        }

        if (!previousAnalyses.isEmpty()) {
            user.append("\n## 历史分析参考\n");
            previousAnalyses.forEach((agentName, content) -> user.append("\n### ")
                    .append(BuiltinAgent.fromKey(agentName).map(BuiltinAgent::getDisplayName).orElse(agentName))
                    .append("摘要\n")
                    .append(excerpt(content))
                    .append('\n'));
        }

        List<String> images = data.get(DataSourceType.CHART).stream()
                .map(DataItem::getImageUrl)
                .filter(Objects::nonNull)
                .toList();

        return AnalysisRequest.builder()
                .model(model)
                .systemPrompt(system)
                .userPrompt(user.toString())
                .imageUrls(images)
                .build();
    }

    private static void appendHoldings(StringBuilder user, List<Holding> holdings, BigDecimal price) {
        if (holdings.isEmpty()) {
            user.append("### 未持仓（仅关注）\n");
            return;
        }
        user.append("### 持仓情况（共 ").append(holdings.size()).append(" 个账户）\n");
        for (Holding holding : holdings) {
            user.append("- ").append(holding.getAccountName())
                    .append("：交易风格 ").append(holding.getTradingStyle().getLabel())
                    .append("，成本价 ").append(plain(holding.getCostPrice()))
                    .append("，持仓量 ").append(holding.getQuantity()).append(" 股");
            if (price != null) {
                user.append("，持仓市值 ")
                        .append(plain(holding.marketValue(price).setScale(2, RoundingMode.HALF_UP))).append(" 元");
                BigDecimal pnl = holding.pnlPercent(price);
                if (pnl != null) {
                    user.append("，浮动盈亏 ").append(signed(pnl.setScale(1, RoundingMode.HALF_UP))).append('%');
                }
            }
            user.append('\n');
        }
    }

    private static BigDecimal currentPrice(CollectedData data, Instrument instrument) {
        return data.forSymbol(DataSourceType.QUOTE, instrument.getSymbol()).stream()
                .map(item -> item.decimal(DataItem.CURRENT_PRICE))
                .filter(Objects::nonNull)
                .findFirst()
                .orElse(null);
    }

    private static String plain(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }

    static String signed(BigDecimal value) {
        return (value.signum() >= 0 ? "+" : "") + value.toPlainString();
    }

    static String displayName(Instrument instrument) {
        if (instrument.getName() == null || instrument.getName().isBlank()) {
            return instrument.getSymbol();
        }
        return instrument.getName() + "（" + instrument.getSymbol() + "）";
    }

    private static String describe(DataItem item) {
        String text = item.getSummary() != null ? item.getSummary() : item.getTitle();
        if (text == null) {
            text = item.getAttributes().toString();
        }
        if (item.getPublishedAt() != null) {
            return "[" + item.getPublishedAt().format(TIME_FORMAT) + "] " + text;
        }
        return text;
    }

    private String excerpt(String content) {
        int limit = analysisProperties.getContextExcerptLength();
        return content.length() > limit ? content.substring(0, limit) + "..." : content;
    }
}
