package com.panwatch.agent;

import com.panwatch.api.dto.response.IntradayScanResponse;
import com.panwatch.api.dto.response.MoveAlert;
import com.panwatch.calendar.TradingCalendarService;
import com.panwatch.datasource.DataItem;
import com.panwatch.domain.enums.DataSourceType;
import com.panwatch.domain.enums.ExecutionMode;
import com.panwatch.domain.model.AgentDefinition;
import com.panwatch.domain.model.AiModel;
import com.panwatch.domain.model.ConfigSnapshot;
import com.panwatch.domain.model.Holding;
import com.panwatch.domain.model.Instrument;
import com.panwatch.domain.model.InstrumentAgentBinding;
import com.panwatch.domain.model.Portfolio;
import com.panwatch.domain.model.RuntimeOverride;
import com.panwatch.exception.BaseException;
import com.panwatch.exception.ConfigException;
import com.panwatch.exception.ResourceNotFoundException;
import com.panwatch.mapper.InstrumentMapper;
import com.panwatch.observability.ExecutionTrail;
import com.panwatch.repository.jpa.InstrumentAgentJpaRepository;
import com.panwatch.repository.jpa.InstrumentJpaRepository;
import com.panwatch.service.PortfolioService;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * On-demand sweep of the intraday watchlist for sharp moves.
 *
 * <p>The watchlist is every enabled instrument enrolled in {@code intraday_monitor}. Quotes are
 * fetched in one pass and a stock is reported when the absolute day change reaches the agent's
 * {@code price_alert_threshold} (3% unless configured). With analysis requested, each held
 * mover also gets a one-line AI comment; a failed analysis is reported in place of the comment.
 * Nothing is notified or recorded as a run.
 */
@Service
public class IntradayScanner {

    private static final Logger log = LoggerFactory.getLogger(IntradayScanner.class);

    static final String PRICE_ALERT_THRESHOLD = "price_alert_threshold";
    static final BigDecimal DEFAULT_THRESHOLD = new BigDecimal("3.0");
    static final int SUGGESTION_LENGTH = 100;

    private static final String NO_ALERT_MARKER = "[无需提醒]";

    private final ConfigSnapshotService configSnapshotService;
    private final ConfigResolver configResolver;
    private final InstrumentJpaRepository instrumentJpaRepository;
    private final InstrumentAgentJpaRepository instrumentAgentJpaRepository;
    private final InstrumentMapper instrumentMapper;
    private final AgentDataCollector agentDataCollector;
    private final PortfolioService portfolioService;
    private final PromptComposer promptComposer;
    private final AnalysisService analysisService;
    private final TradingCalendarService tradingCalendarService;
    private final Clock clock;

    public IntradayScanner(
            ConfigSnapshotService configSnapshotService,
            ConfigResolver configResolver,
            InstrumentJpaRepository instrumentJpaRepository,
            InstrumentAgentJpaRepository instrumentAgentJpaRepository,
            InstrumentMapper instrumentMapper,
            AgentDataCollector agentDataCollector,
            PortfolioService portfolioService,
            PromptComposer promptComposer,
            AnalysisService analysisService,
            TradingCalendarService tradingCalendarService,
            Clock clock) {
        this.configSnapshotService = configSnapshotService;
        this.configResolver = configResolver;
        this.instrumentJpaRepository = instrumentJpaRepository;
        this.instrumentAgentJpaRepository = instrumentAgentJpaRepository;
        this.instrumentMapper = instrumentMapper;
        this.agentDataCollector = agentDataCollector;
        this.portfolioService = portfolioService;
        this.promptComposer = promptComposer;
        this.analysisService = analysisService;
        this.tradingCalendarService = tradingCalendarService;
        this.clock = clock;
    }

    /**
     * @param analyze ask the model for a short comment on each held mover
     * @throws com.panwatch.exception.DataUnavailableException if no quote could be fetched
     */
    public IntradayScanResponse scan(boolean analyze) {
        String agentName = BuiltinAgent.INTRADAY_MONITOR.getKey();
        ConfigSnapshot snapshot = configSnapshotService.capture();
        AgentDefinition agent = snapshot.agent(agentName)
                .orElseThrow(() -> new ResourceNotFoundException("Agent", agentName));

        Map<Long, Instrument> enabled = instrumentMapper.toDomainList(instrumentJpaRepository.findByEnabledTrue())
                .stream()
                .collect(Collectors.toMap(Instrument::getId, Function.identity()));
        List<InstrumentAgentBinding> bindings = instrumentMapper
                .toBindingList(instrumentAgentJpaRepository.findByAgentName(agentName))
                .stream()
                .filter(b -> enabled.containsKey(b.getInstrumentId()))
                .toList();
        if (bindings.isEmpty()) {
            return IntradayScanResponse.builder().message("请先为股票启用「盘中监测」Agent").build();
        }
        if (!tradingCalendarService.isAnyMarketTrading(clock.instant())) {
            return IntradayScanResponse.builder().message("当前非交易时段").hasWatchlist(true).build();
        }

        List<Instrument> watchlist = bindings.stream().map(b -> enabled.get(b.getInstrumentId())).toList();
        ExecutionTrail trail = ExecutionTrail.newRun(clock);
        CollectedData quotes = agentDataCollector.collect(DataSourceType.QUOTE, watchlist, snapshot.dataSources(), trail);
        Portfolio portfolio = portfolioService.loadPortfolio(
                watchlist.stream().map(Instrument::getId).toList());
        BigDecimal threshold = threshold(agent);

        List<MoveAlert> alerts = new ArrayList<>();
        for (InstrumentAgentBinding binding : bindings) {
            Instrument instrument = enabled.get(binding.getInstrumentId());
            DataItem quote = quoteOf(quotes, instrument);
            if (quote == null || quote.decimal(DataItem.CHANGE_PCT).abs().compareTo(threshold) < 0) {
                continue;
            }
            MoveAlert alert = toAlert(instrument, quote, portfolio.holdingsFor(instrument.getId()));
            if (analyze && alert.isHasPosition()) {
                alert.setSuggestion(suggest(agent, binding, snapshot, instrument, quotes, portfolio, trail));
            }
            alerts.add(alert);
        }

        log.info("Intraday scan: {} instrument(s), {} mover(s) at threshold {}%",
                watchlist.size(), alerts.size(), threshold);
        return IntradayScanResponse.builder()
                .alerts(alerts)
                .scannedCount(watchlist.size())
                .alertCount(alerts.size())
                .hasWatchlist(true)
                .trading(true)
                .build();
    }

    private static MoveAlert toAlert(Instrument instrument, DataItem quote, List<Holding> holdings) {
        BigDecimal changePct = quote.decimal(DataItem.CHANGE_PCT);
        BigDecimal price = quote.decimal(DataItem.CURRENT_PRICE);
        String name = instrument.getName() == null || instrument.getName().isBlank()
                ? instrument.getSymbol()
                : instrument.getName();
        String type = changePct.signum() > 0 ? "急涨" : "急跌";

        MoveAlert alert = MoveAlert.builder()
                .instrumentId(instrument.getId())
                .symbol(instrument.getSymbol())
                .name(name)
                .alertType(type)
                .currentPrice(price)
                .changePct(changePct)
                .message(String.format("%s %s %+.2f%%", name, type, changePct.doubleValue()))
                .hasPosition(!holdings.isEmpty())
                .build();
        if (!holdings.isEmpty()) {
            Holding first = holdings.get(0);
            alert.setCostPrice(first.getCostPrice());
            alert.setTradingStyle(first.getTradingStyle());
            alert.setPnlPct(price == null ? null : first.pnlPercent(price));
        }
        return alert;
    }

    private String suggest(
            AgentDefinition agent,
            InstrumentAgentBinding binding,
            ConfigSnapshot snapshot,
            Instrument instrument,
            CollectedData quotes,
            Portfolio portfolio,
            ExecutionTrail trail) {
        try {
            Long modelId = configResolver.resolve(agent, binding, RuntimeOverride.NONE, snapshot).getAiModelId();
            AiModel model = snapshot.model(modelId)
                    .orElseThrow(() -> new ConfigException("AI model " + modelId + " is not configured"));
            AnalysisRequest request = promptComposer.compose(BuiltinAgent.INTRADAY_MONITOR, ExecutionMode.SINGLE,
                    model, List.of(instrument), quotes, portfolio, Map.of(), LocalDateTime.now(clock));
            return shorten(analysisService.analyze(request, trail));
        } catch (BaseException e) {
            log.warn("Intraday scan analysis failed for {}: {}", instrument.getSymbol(), e.getMessage());
            return "分析失败: " + e.getMessage();
        }
    }

    static String shorten(String content) {
        String text = content.strip();
        if (text.startsWith(NO_ALERT_MARKER)) {
            text = text.substring(NO_ALERT_MARKER.length()).strip();
        }
        return text.length() > SUGGESTION_LENGTH ? text.substring(0, SUGGESTION_LENGTH) : text;
    }

    private static DataItem quoteOf(CollectedData quotes, Instrument instrument) {
        return quotes.forSymbol(DataSourceType.QUOTE, instrument.getSymbol()).stream()
                .filter(item -> item.decimal(DataItem.CHANGE_PCT) != null)
                .findFirst()
                .orElse(null);
    }

    private static BigDecimal threshold(AgentDefinition agent) {
        Object configured = agent.getConfig() == null ? null : agent.getConfig().get(PRICE_ALERT_THRESHOLD);
        if (configured instanceof Number number && number.doubleValue() > 0) {
            return new BigDecimal(number.toString());
        }
        return DEFAULT_THRESHOLD;
    }
}
