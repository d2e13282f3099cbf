package com.panwatch.agent;

import com.panwatch.domain.enums.DispatchStatus;
import com.panwatch.domain.enums.ExecutionMode;
import com.panwatch.domain.enums.ExecutionState;
import com.panwatch.domain.enums.FailureReason;
import com.panwatch.domain.enums.TriggerSource;
import com.panwatch.domain.model.AgentDefinition;
import com.panwatch.domain.model.AgentRun;
import com.panwatch.domain.model.AiModel;
import com.panwatch.domain.model.ConfigSnapshot;
import com.panwatch.domain.model.ExecutionConfig;
import com.panwatch.domain.model.Instrument;
import com.panwatch.domain.model.InstrumentAgentBinding;
import com.panwatch.domain.model.Portfolio;
import com.panwatch.domain.model.RuntimeOverride;
import com.panwatch.domain.model.Suggestion;
import com.panwatch.exception.AnalysisException;
import com.panwatch.exception.BaseException;
import com.panwatch.exception.ConfigException;
import com.panwatch.exception.DataUnavailableException;
import com.panwatch.exception.ResourceNotFoundException;
import com.panwatch.notification.Alert;
import com.panwatch.notification.DispatchOutcome;
import com.panwatch.notification.NotificationDispatcher;
import com.panwatch.notification.ThrottleKey;
import com.panwatch.observability.AgentMetricsService;
import com.panwatch.observability.ExecutionLogService;
import com.panwatch.observability.ExecutionTrail;
import com.panwatch.service.AgentRunService;
import com.panwatch.service.PortfolioService;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs one agent execution end to end:
 * RESOLVING, FETCHING, ANALYZING, CLASSIFYING, then NOTIFYING when something should alert,
 * ending in DONE, or FAILED from whichever state hit the error.
 *
 * <p>Phases are strictly sequential within a run. Configuration is snapshotted once while
 * resolving and used for the rest of the run. Every transition and every terminal outcome
 * goes to the run's trail, which is persisted together with an {@link AgentRun} record
 * whether the run succeeds or not.
 *
 * <p>A single run covers one instrument; a batch run analyses all of its instruments in one
 * call and is throttled under the agent-wide key.
 */
@Service
public class AgentExecutor {

    private static final Logger log = LoggerFactory.getLogger(AgentExecutor.class);

    static final String THROTTLE_MINUTES = "throttle_minutes";

    private final ConfigSnapshotService configSnapshotService;
    private final ConfigResolver configResolver;
    private final AgentDataCollector agentDataCollector;
    private final PortfolioService portfolioService;
    private final PromptComposer promptComposer;
    private final AnalysisService analysisService;
    private final SuggestionClassifier suggestionClassifier;
    private final NotificationDispatcher notificationDispatcher;
    private final AgentRunService agentRunService;
    private final ExecutionLogService executionLogService;
    private final AgentMetricsService agentMetricsService;
    private final Clock clock;

    public AgentExecutor(
            ConfigSnapshotService configSnapshotService,
            ConfigResolver configResolver,
            AgentDataCollector agentDataCollector,
            PortfolioService portfolioService,
            PromptComposer promptComposer,
            AnalysisService analysisService,
            SuggestionClassifier suggestionClassifier,
            NotificationDispatcher notificationDispatcher,
            AgentRunService agentRunService,
            ExecutionLogService executionLogService,
            AgentMetricsService agentMetricsService,
            Clock clock) {
        this.configSnapshotService = configSnapshotService;
        this.configResolver = configResolver;
        this.agentDataCollector = agentDataCollector;
        this.portfolioService = portfolioService;
        this.promptComposer = promptComposer;
        this.analysisService = analysisService;
        this.suggestionClassifier = suggestionClassifier;
        this.notificationDispatcher = notificationDispatcher;
        this.agentRunService = agentRunService;
        this.executionLogService = executionLogService;
        this.agentMetricsService = agentMetricsService;
        this.clock = clock;
    }

    public AgentRunResult runSingle(
            String agentName,
            Instrument instrument,
            InstrumentAgentBinding binding,
            RuntimeOverride override,
            TriggerSource trigger,
            LocalDateTime now) {
        return execute(new RunSpec(agentName, List.of(instrument), binding, override, trigger, now, ExecutionMode.SINGLE));
    }

    public AgentRunResult runBatch(
            String agentName,
            List<Instrument> instruments,
            RuntimeOverride override,
            TriggerSource trigger,
            LocalDateTime now) {
        return execute(new RunSpec(agentName, instruments, null, override, trigger, now, ExecutionMode.BATCH));
    }

    private record RunSpec(
            String agentName,
            List<Instrument> instruments,
            InstrumentAgentBinding binding,
            RuntimeOverride override,
            TriggerSource trigger,
            LocalDateTime now,
            ExecutionMode mode) {

        Long instrumentId() {
            return mode == ExecutionMode.SINGLE ? instruments.get(0).getId() : null;
        }
    }

    private AgentRunResult execute(RunSpec spec) {
        ExecutionTrail trail = ExecutionTrail.newRun(clock);
        String actor = "agent:" + spec.agentName();
        long started = System.currentTimeMillis();

        ExecutionState state = ExecutionState.RESOLVING;
        FailureReason failureReason = null;
        String error = null;
        String content = null;
        Map<Long, Suggestion> suggestions = Map.of();
        DispatchOutcome dispatch = null;

        try {
            enter(trail, actor, state);
            ConfigSnapshot snapshot = configSnapshotService.capture();
            AgentDefinition agent = snapshot.agent(spec.agentName())
                    .orElseThrow(() -> new ResourceNotFoundException("Agent", spec.agentName()));
            BuiltinAgent builtin = BuiltinAgent.fromKey(spec.agentName())
                    .orElseThrow(() -> new ConfigException("Agent '" + spec.agentName() + "' has no implementation"));
            if (spec.instruments().isEmpty()) {
                throw new ConfigException("Agent '" + spec.agentName() + "' has no instruments to analyse");
            }
            ExecutionConfig config = configResolver.resolve(agent, spec.binding(), spec.override(), snapshot);
            AiModel model = snapshot.model(config.getAiModelId())
                    .orElseThrow(() -> new ConfigException("AI model " + config.getAiModelId() + " disappeared"));
            if (config.canNotify()) {
                trail.success(actor, "Resolved model " + model.label() + ", channels " + channelNames(config), 0,
                        config.getNotifyChannels().size());
            } else {
                trail.success(actor, "Resolved model " + model.label() + " without notification channels: "
                        + "no default channel configured, results are recorded only", 0, 0);
            }

            state = ExecutionState.FETCHING;
            enter(trail, actor, state);
            CollectedData data = agentDataCollector.collect(
                    builtin, spec.instruments(), snapshot.dataSources(), agent.getConfig(), trail);
            Portfolio portfolio = portfolioService.loadPortfolio(
                    spec.instruments().stream().map(Instrument::getId).toList());

            state = ExecutionState.ANALYZING;
            enter(trail, actor, state);
            AnalysisRequest request = promptComposer.compose(builtin, spec.mode(), model, spec.instruments(),
                    data, portfolio, previousAnalyses(builtin), spec.now());
            content = analysisService.analyze(request, trail);

            state = ExecutionState.CLASSIFYING;
            enter(trail, actor, state);
            suggestions = classify(spec, content);
            trail.success(actor, "Classified: " + describe(suggestions, spec.instruments()), 0, suggestions.size());

            boolean alert = suggestions.values().stream().anyMatch(Suggestion::isShouldAlert);
            if (alert) {
                state = ExecutionState.NOTIFYING;
                enter(trail, actor, state);
                if (!config.canNotify()) {
                    trail.error(actor, "Alert not sent: no notification channel available", 0);
                } else {
                    ThrottleKey key = spec.mode() == ExecutionMode.BATCH
                            ? ThrottleKey.batch(spec.agentName())
                            : ThrottleKey.of(spec.agentName(), spec.instrumentId());
                    Alert message = buildAlert(agent, spec, suggestions, content, model);
                    dispatch = notificationDispatcher.dispatch(message, config.getNotifyChannels(),
                            config.isBypassThrottle(), key, spec.now(), throttleInterval(agent));
                    trail.appendAll(dispatch.getLogs());
                    if (dispatch.getStatus() == DispatchStatus.THROTTLED) {
                        trail.success(actor, "Notification throttled for " + key, 0, 0);
                    }
                }
            } else {
                trail.success(actor, "No alert needed", 0, 0);
            }

            state = ExecutionState.DONE;
            trail.success(actor, "Run completed", System.currentTimeMillis() - started, suggestions.size());
        } catch (BaseException e) {
            failureReason = failureReasonOf(e);
            error = e.getMessage();
            trail.error(actor, state + " failed: " + e.getMessage(), System.currentTimeMillis() - started);
            log.warn("Agent run failed: agent={}, instrument={}, state={}, reason={}, message={}",
                    spec.agentName(), spec.instrumentId(), state, failureReason, e.getMessage());
            state = ExecutionState.FAILED;
        } catch (RuntimeException e) {
            failureReason = FailureReason.INTERNAL_ERROR;
            error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            trail.error(actor, state + " failed unexpectedly: " + error, System.currentTimeMillis() - started);
            log.error("Agent run crashed: agent={}, instrument={}, state={}",
                    spec.agentName(), spec.instrumentId(), state, e);
            state = ExecutionState.FAILED;
        }

        AgentRunResult result = AgentRunResult.builder()
                .runId(trail.getRunId())
                .agentName(spec.agentName())
                .instrumentId(spec.instrumentId())
                .trigger(spec.trigger())
                .state(state)
                .failureReason(failureReason)
                .error(error)
                .content(content)
                .suggestions(suggestions)
                .dispatch(dispatch)
                .notified(dispatch != null && dispatch.isDelivered())
                .durationMs(System.currentTimeMillis() - started)
                .logs(trail.entries())
                .build();

        record(result, trail);
        agentMetricsService.recordRun(state);
        return result;
    }

    private Map<Long, Suggestion> classify(RunSpec spec, String content) {
        if (spec.mode() == ExecutionMode.BATCH) {
            return suggestionClassifier.classifyBatch(content, spec.instruments());
        }
        Map<Long, Suggestion> single = new LinkedHashMap<>();
        single.put(spec.instrumentId(), suggestionClassifier.classify(content));
        return single;
    }

    private Map<String, String> previousAnalyses(BuiltinAgent agent) {
        Map<String, String> previous = new LinkedHashMap<>();
        for (String contextAgent : agent.getContextAgents()) {
            agentRunService.latestContent(contextAgent).ifPresent(content -> previous.put(contextAgent, content));
        }
        return previous;
    }

    private Alert buildAlert(
            AgentDefinition agent, RunSpec spec, Map<Long, Suggestion> suggestions, String content, AiModel model) {
        String title;
        if (spec.mode() == ExecutionMode.SINGLE) {
            Instrument instrument = spec.instruments().get(0);
            Suggestion suggestion = suggestions.get(instrument.getId());
            title = String.format("【%s】%s %s", agent.getDisplayName(), PromptComposer.displayName(instrument),
                    suggestion.getAction().getLabel());
        } else {
            long alerting = suggestions.values().stream().filter(Suggestion::isShouldAlert).count();
            title = String.format("【%s】%d 只股票有操作建议", agent.getDisplayName(), alerting);
        }
        return Alert.builder()
                .agentName(spec.agentName())
                .title(title)
                .content(content.strip() + "\n\n---\nAI: " + model.label())
                .timestamp(spec.now())
                .build();
    }

    private void record(AgentRunResult result, ExecutionTrail trail) {
        Suggestion single = result.getInstrumentId() != null ? result.getSuggestions().get(result.getInstrumentId()) : null;
        boolean shouldAlert = result.getSuggestions().values().stream().anyMatch(Suggestion::isShouldAlert);
        AgentRun run = AgentRun.builder()
                .runId(result.getRunId())
                .agentName(result.getAgentName())
                .instrumentId(result.getInstrumentId())
                .trigger(result.getTrigger())
                .status(result.getState())
                .failureReason(result.getFailureReason())
                .action(single != null ? single.getAction() : null)
                .shouldAlert(shouldAlert)
                .notified(result.isNotified())
                .content(result.getContent())
                .error(result.getError())
                .durationMs(result.getDurationMs())
                .createdAt(LocalDateTime.now(clock))
                .build();
        try {
            agentRunService.save(run);
            executionLogService.save(trail);
        } catch (RuntimeException e) {
            log.error("Failed to persist run {} of agent {}", result.getRunId(), result.getAgentName(), e);
        }
    }

    /** Per-agent "throttle_minutes" parameter, or null for the installation default. */
    private static Duration throttleInterval(AgentDefinition agent) {
        Object minutes = agent.getConfig() != null ? agent.getConfig().get(THROTTLE_MINUTES) : null;
        if (minutes instanceof Number number && number.longValue() > 0) {
            return Duration.ofMinutes(number.longValue());
        }
        return null;
    }

    private static void enter(ExecutionTrail trail, String actor, ExecutionState state) {
        trail.start(actor, state.name());
        log.debug("{} -> {}", actor, state);
    }

    private static FailureReason failureReasonOf(BaseException e) {
        if (e instanceof DataUnavailableException) {
            return FailureReason.DATA_UNAVAILABLE;
        }
        if (e instanceof AnalysisException) {
            return FailureReason.ANALYSIS_ERROR;
        }
        if (e instanceof ConfigException || e instanceof ResourceNotFoundException) {
            return FailureReason.CONFIG_ERROR;
        }
        return FailureReason.INTERNAL_ERROR;
    }

    private static String channelNames(ExecutionConfig config) {
        return config.getNotifyChannels().stream().map(c -> c.getName()).collect(Collectors.joining(", ", "[", "]"));
    }

    private static String describe(Map<Long, Suggestion> suggestions, List<Instrument> instruments) {
        return instruments.stream()
                .filter(i -> suggestions.containsKey(i.getId()))
                .map(i -> i.getSymbol() + "=" + suggestions.get(i.getId()).getAction()
                        + (suggestions.get(i.getId()).isShouldAlert() ? "!" : ""))
                .collect(Collectors.joining(", "));
    }
}
