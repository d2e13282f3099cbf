package com.panwatch.core.engine;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.panwatch.agent.AgentExecutor;
import com.panwatch.agent.AgentRunResult;
import com.panwatch.agent.BuiltinAgent;
import com.panwatch.agent.ConfigResolver;
import com.panwatch.agent.ConfigSnapshotService;
import com.panwatch.calendar.TradingCalendarService;
import com.panwatch.config.SchedulerProperties;
import com.panwatch.domain.enums.ExecutionMode;
import com.panwatch.domain.enums.TriggerSource;
import com.panwatch.domain.model.AgentDefinition;
import com.panwatch.domain.model.Instrument;
import com.panwatch.domain.model.InstrumentAgentBinding;
import com.panwatch.domain.model.RuntimeOverride;
import com.panwatch.exception.ConfigException;
import com.panwatch.exception.ResourceNotFoundException;
import com.panwatch.mapper.InstrumentMapper;
import com.panwatch.repository.jpa.InstrumentAgentJpaRepository;
import com.panwatch.repository.jpa.InstrumentJpaRepository;
import com.panwatch.schedule.CronSchedule;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodic tick that turns due schedules into agent runs.
 *
 * <p>Each tick reads the enabled agents and their bindings, resolves every binding's effective
 * schedule and submits what is due in the current minute to the agent pool. The tick itself
 * never runs an agent.
 *
 * <p><b>At-most-once:</b> a run is identified by the fingerprint
 * {@code agent|instrument-or-group|minute}. Fingerprints are claimed with an atomic
 * putIfAbsent on a Caffeine cache before submission, so the several ticks that fall into the
 * same minute (and overlapping ticks) fire each fingerprint once. A fingerprint whose
 * submission is rejected by the pool is released so a later tick in the same minute can retry.
 *
 * <p>Agents flagged {@link BuiltinAgent#isTradingHoursOnly()} are skipped, before any
 * fingerprint is claimed, while no market is in a trading session.
 *
 * <p>SINGLE agents fire one run per enrolled instrument. BATCH agents group their enrolled
 * instruments by equal effective schedule and fire one run per group.
 */
@Service
public class AgentScheduler {

    private static final Logger log = LoggerFactory.getLogger(AgentScheduler.class);

    private static final DateTimeFormatter MINUTE_KEY = DateTimeFormatter.ofPattern("yyyyMMddHHmm");

    private final ConfigSnapshotService configSnapshotService;
    private final ConfigResolver configResolver;
    private final InstrumentJpaRepository instrumentJpaRepository;
    private final InstrumentAgentJpaRepository instrumentAgentJpaRepository;
    private final InstrumentMapper instrumentMapper;
    private final AgentExecutor agentExecutor;
    private final TaskExecutor agentPool;
    private final TradingCalendarService tradingCalendarService;
    private final SchedulerProperties schedulerProperties;
    private final Clock clock;

    /**
     * Claimed fingerprints; the value is unused. Entries leave by TTL only: a size-based
     * eviction would let the next tick of the same minute claim the fingerprint again.
     */
    private final Cache<String, Boolean> firedFingerprints;

    public AgentScheduler(
            ConfigSnapshotService configSnapshotService,
            ConfigResolver configResolver,
            InstrumentJpaRepository instrumentJpaRepository,
            InstrumentAgentJpaRepository instrumentAgentJpaRepository,
            InstrumentMapper instrumentMapper,
            AgentExecutor agentExecutor,
            @Qualifier("agentExecutor") TaskExecutor agentPool,
            TradingCalendarService tradingCalendarService,
            SchedulerProperties schedulerProperties,
            Clock clock) {
        this.configSnapshotService = configSnapshotService;
        this.configResolver = configResolver;
        this.instrumentJpaRepository = instrumentJpaRepository;
        this.instrumentAgentJpaRepository = instrumentAgentJpaRepository;
        this.instrumentMapper = instrumentMapper;
        this.agentExecutor = agentExecutor;
        this.agentPool = agentPool;
        this.tradingCalendarService = tradingCalendarService;
        this.schedulerProperties = schedulerProperties;
        this.clock = clock;
        this.firedFingerprints = Caffeine.newBuilder()
                .expireAfterWrite(schedulerProperties.getFingerprintTtl())
                .build();
    }

    @Scheduled(fixedRateString = "${panwatch.scheduler.tick:5000}", initialDelayString = "${panwatch.scheduler.tick:5000}")
    public void tick() {
        if (!schedulerProperties.isEnabled()) {
            return;
        }
        try {
            tick(LocalDateTime.now(clock));
        } catch (RuntimeException e) {
            log.error("Scheduler tick failed", e);
        }
    }

    /**
     * Evaluates all schedules against the minute containing {@code now}.
     * Public for testability since the test package differs from the source package.
     *
     * @return number of runs submitted by this tick
     */
    public int tick(LocalDateTime now) {
        LocalDateTime minute = now.truncatedTo(ChronoUnit.MINUTES);
        Map<Long, Instrument> instruments = enabledInstruments();
        Instant instant = minute.atZone(schedulerProperties.zoneId()).toInstant();
        int submitted = 0;

        for (AgentDefinition agent : configSnapshotService.capture().agents()) {
            if (!agent.isEnabled()) {
                continue;
            }
            if (outsideTradingHours(agent, instant)) {
                log.debug("Skipping agent={} at {}: no market is trading", agent.getName(), minute);
                continue;
            }
            List<InstrumentAgentBinding> bindings = bindingsOf(agent.getName(), instruments);
            if (bindings.isEmpty()) {
                continue;
            }
            submitted += agent.getExecutionMode() == ExecutionMode.BATCH
                    ? tickBatch(agent, bindings, instruments, minute)
                    : tickSingle(agent, bindings, instruments, minute);
        }

        if (submitted > 0) {
            log.info("Scheduler tick {}: submitted {} run(s)", minute, submitted);
        }
        return submitted;
    }

    private int tickSingle(
            AgentDefinition agent,
            List<InstrumentAgentBinding> bindings,
            Map<Long, Instrument> instruments,
            LocalDateTime minute) {
        int submitted = 0;
        for (InstrumentAgentBinding binding : bindings) {
            CronSchedule schedule = scheduleOf(agent, binding);
            if (schedule == null || !schedule.matches(minute)) {
                continue;
            }
            Instrument instrument = instruments.get(binding.getInstrumentId());
            String fingerprint = fingerprint(agent.getName(), String.valueOf(instrument.getId()), minute);
            if (submit(fingerprint, () -> agentExecutor.runSingle(
                    agent.getName(), instrument, binding, RuntimeOverride.NONE, TriggerSource.SCHEDULED, minute))) {
                submitted++;
            }
        }
        return submitted;
    }

    private int tickBatch(
            AgentDefinition agent,
            List<InstrumentAgentBinding> bindings,
            Map<Long, Instrument> instruments,
            LocalDateTime minute) {
        Map<CronSchedule, List<Instrument>> groups = new LinkedHashMap<>();
        for (InstrumentAgentBinding binding : bindings) {
            CronSchedule schedule = scheduleOf(agent, binding);
            if (schedule != null) {
                groups.computeIfAbsent(schedule, s -> new ArrayList<>()).add(instruments.get(binding.getInstrumentId()));
            }
        }

        int submitted = 0;
        for (Map.Entry<CronSchedule, List<Instrument>> group : groups.entrySet()) {
            if (!group.getKey().matches(minute)) {
                continue;
            }
            List<Instrument> members = List.copyOf(group.getValue());
            String fingerprint = fingerprint(agent.getName(), "group:" + group.getKey().toExpression(), minute);
            if (submit(fingerprint, () -> agentExecutor.runBatch(
                    agent.getName(), members, RuntimeOverride.NONE, TriggerSource.SCHEDULED, minute))) {
                submitted++;
            }
        }
        return submitted;
    }

    private boolean outsideTradingHours(AgentDefinition agent, Instant instant) {
        return BuiltinAgent.fromKey(agent.getName()).map(BuiltinAgent::isTradingHoursOnly).orElse(false)
                && !tradingCalendarService.isAnyMarketTrading(instant);
    }

    private CronSchedule scheduleOf(AgentDefinition agent, InstrumentAgentBinding binding) {
        try {
            return configResolver.resolveSchedule(agent, binding);
        } catch (ConfigException e) {
            log.error("Skipping agent={} instrument={}: {}", agent.getName(), binding.getInstrumentId(), e.getMessage());
            return null;
        }
    }

    private boolean submit(String fingerprint, Runnable run) {
        if (firedFingerprints.asMap().putIfAbsent(fingerprint, Boolean.TRUE) != null) {
            return false;
        }
        try {
            agentPool.execute(() -> {
                try {
                    run.run();
                } catch (RuntimeException e) {
                    log.error("Scheduled run {} crashed", fingerprint, e);
                }
            });
            log.debug("Submitted {}", fingerprint);
            return true;
        } catch (TaskRejectedException e) {
            firedFingerprints.invalidate(fingerprint);
            log.warn("Agent pool rejected {}, will retry on a later tick: {}", fingerprint, e.getMessage());
            return false;
        }
    }

    /**
     * Runs one agent for one instrument immediately on the calling thread, skipping the
     * fingerprint claim. BATCH agents run a batch of just this instrument.
     */
    public AgentRunResult runNow(String agentName, Long instrumentId, RuntimeOverride override) {
        AgentDefinition agent = requireAgent(agentName);
        Instrument instrument = instrumentJpaRepository.findById(instrumentId)
                .map(instrumentMapper::toDomain)
                .orElseThrow(() -> new ResourceNotFoundException("Instrument", instrumentId));
        LocalDateTime now = LocalDateTime.now(clock);

        if (agent.getExecutionMode() == ExecutionMode.BATCH) {
            return agentExecutor.runBatch(agentName, List.of(instrument), override, TriggerSource.MANUAL, now);
        }
        InstrumentAgentBinding binding = instrumentAgentJpaRepository
                .findByInstrumentIdAndAgentName(instrumentId, agentName)
                .map(instrumentMapper::toBinding)
                .orElse(null);
        return agentExecutor.runSingle(agentName, instrument, binding, override, TriggerSource.MANUAL, now);
    }

    /**
     * Runs an agent over all of its enabled enrolled instruments immediately: one batch run,
     * or one run per instrument for SINGLE agents.
     */
    public List<AgentRunResult> runAgentNow(String agentName, RuntimeOverride override) {
        AgentDefinition agent = requireAgent(agentName);
        Map<Long, Instrument> instruments = enabledInstruments();
        List<InstrumentAgentBinding> bindings = bindingsOf(agentName, instruments);
        LocalDateTime now = LocalDateTime.now(clock);

        if (agent.getExecutionMode() == ExecutionMode.BATCH) {
            List<Instrument> members = bindings.stream().map(b -> instruments.get(b.getInstrumentId())).toList();
            return List.of(agentExecutor.runBatch(agentName, members, override, TriggerSource.MANUAL, now));
        }
        List<AgentRunResult> results = new ArrayList<>();
        for (InstrumentAgentBinding binding : bindings) {
            results.add(agentExecutor.runSingle(
                    agentName, instruments.get(binding.getInstrumentId()), binding, override, TriggerSource.MANUAL, now));
        }
        return results;
    }

    private AgentDefinition requireAgent(String agentName) {
        return configSnapshotService.capture().agent(agentName)
                .orElseThrow(() -> new ResourceNotFoundException("Agent", agentName));
    }

    private Map<Long, Instrument> enabledInstruments() {
        return instrumentMapper.toDomainList(instrumentJpaRepository.findByEnabledTrue()).stream()
                .collect(Collectors.toMap(Instrument::getId, Function.identity(), (a, b) -> a, LinkedHashMap::new));
    }

    private List<InstrumentAgentBinding> bindingsOf(String agentName, Map<Long, Instrument> instruments) {
        return instrumentMapper.toBindingList(instrumentAgentJpaRepository.findByAgentName(agentName)).stream()
                .filter(b -> instruments.containsKey(b.getInstrumentId()))
                .toList();
    }

    private static String fingerprint(String agentName, String target, LocalDateTime minute) {
        return agentName + "|" + target + "|" + minute.format(MINUTE_KEY);
    }
}
