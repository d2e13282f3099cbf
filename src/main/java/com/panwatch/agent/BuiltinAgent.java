package com.panwatch.agent;

import com.panwatch.domain.enums.DataSourceType;
import com.panwatch.domain.enums.ExecutionMode;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The fixed set of agents the engine knows how to run. Seeded into agent_configs at startup;
 * users can only toggle them and change schedule, model and channels.
 */
public enum BuiltinAgent {
    DAILY_REPORT(
            "daily_report",
            "盘后日报",
            "每日收盘后生成自选股日报，包含大盘概览、个股分析和明日关注",
            true,
            "30 15 * * 1-5",
            ExecutionMode.BATCH,
            EnumSet.of(DataSourceType.QUOTE),
            EnumSet.of(DataSourceType.KLINE, DataSourceType.NEWS, DataSourceType.CAPITAL_FLOW),
            List.of(),
            Map.of(),
            "你是一名专业的 A 股/港股/美股投资顾问。请根据收盘行情、K 线、资金流向和新闻，"
                    + "为每只自选股撰写简明的盘后点评，并给出明日操作建议。"),
    INTRADAY_MONITOR(
            "intraday_monitor",
            "盘中监测",
            "交易时段实时监控，AI 智能判断是否有值得关注的信号",
            false,
            "*/5 9-15 * * 1-5",
            ExecutionMode.SINGLE,
            EnumSet.of(DataSourceType.QUOTE),
            EnumSet.of(DataSourceType.KLINE, DataSourceType.CAPITAL_FLOW),
            List.of("daily_report", "premarket_outlook"),
            Map.of(
                    "price_alert_threshold", 3.0,
                    "volume_alert_ratio", 2.0,
                    "stop_loss_warning", -5.0,
                    "take_profit_warning", 10.0,
                    "throttle_minutes", 30),
            "你是一名盘中盯盘助手。请结合实时行情和历史分析，判断这只股票当前是否出现值得提醒用户的信号。"
                    + "如果没有明显信号，请以 [无需提醒] 开头回复。"),
    NEWS_DIGEST(
            "news_digest",
            "新闻速递",
            "定时抓取与持仓相关的新闻资讯并推送摘要",
            false,
            "0 9-18/2 * * 1-5",
            ExecutionMode.BATCH,
            EnumSet.of(DataSourceType.NEWS),
            EnumSet.noneOf(DataSourceType.class),
            List.of(),
            Map.of("news_hours", 2),
            "你是一名财经新闻编辑。请筛选与自选股相关的重要新闻，按股票归类给出摘要，并评估其影响。"),
    PREMARKET_OUTLOOK(
            "premarket_outlook",
            "盘前分析",
            "开盘前综合昨日分析和隔夜信息，展望今日走势",
            false,
            "0 9 * * 1-5",
            ExecutionMode.BATCH,
            EnumSet.of(DataSourceType.QUOTE),
            EnumSet.of(DataSourceType.NEWS, DataSourceType.KLINE),
            List.of("daily_report"),
            Map.of(),
            "你是一名投资顾问。请结合昨日盘后分析和隔夜消息，展望每只自选股今日的走势并给出开盘策略。"),
    CHART_ANALYST(
            "chart_analyst",
            "技术分析",
            "截取 K 线图并使用多模态 AI 进行技术分析",
            false,
            "0 15 * * 1-5",
            ExecutionMode.SINGLE,
            EnumSet.of(DataSourceType.CHART),
            EnumSet.of(DataSourceType.QUOTE, DataSourceType.KLINE),
            List.of(),
            Map.of(),
            "你是一名技术分析师。请根据 K 线图识别趋势、支撑与压力位以及形态信号，给出操作建议。");

    private final String key;
    private final String displayName;
    private final String description;
    private final boolean enabledByDefault;
    private final String defaultSchedule;
    private final ExecutionMode executionMode;
    private final Set<DataSourceType> requiredData;
    private final Set<DataSourceType> optionalData;
    private final List<String> contextAgents;
    private final Map<String, Object> defaultConfig;
    private final String instructions;

    BuiltinAgent(
            String key,
            String displayName,
            String description,
            boolean enabledByDefault,
            String defaultSchedule,
            ExecutionMode executionMode,
            EnumSet<DataSourceType> requiredData,
            EnumSet<DataSourceType> optionalData,
            List<String> contextAgents,
            Map<String, Object> defaultConfig,
            String instructions) {
        this.key = key;
        this.displayName = displayName;
        this.description = description;
        this.enabledByDefault = enabledByDefault;
        this.defaultSchedule = defaultSchedule;
        this.executionMode = executionMode;
        this.requiredData = Collections.unmodifiableSet(requiredData);
        this.optionalData = Collections.unmodifiableSet(optionalData);
        this.contextAgents = contextAgents;
        this.defaultConfig = defaultConfig;
        this.instructions = instructions;
    }

    public static Optional<BuiltinAgent> fromKey(String key) {
        return Arrays.stream(values()).filter(a -> a.key.equals(key)).findFirst();
    }

    public String getKey() {
        return key;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    public boolean isEnabledByDefault() {
        return enabledByDefault;
    }

    public String getDefaultSchedule() {
        return defaultSchedule;
    }

    public ExecutionMode getExecutionMode() {
        return executionMode;
    }

    /** Fetched in {@link DataSourceType} declaration order, like {@link #getOptionalData()}. */
    public Set<DataSourceType> getRequiredData() {
        return requiredData;
    }

    public Set<DataSourceType> getOptionalData() {
        return optionalData;
    }

    /** Scheduled runs are skipped while no market is in a trading session; manual runs are not. */
    public boolean isTradingHoursOnly() {
        return this == INTRADAY_MONITOR;
    }

    /** Agents whose latest finished analysis is quoted into this agent's prompt. */
    public List<String> getContextAgents() {
        return contextAgents;
    }

    public Map<String, Object> getDefaultConfig() {
        return defaultConfig;
    }

    public String getInstructions() {
        return instructions;
    }
}
