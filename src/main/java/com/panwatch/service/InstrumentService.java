package com.panwatch.service;

import com.panwatch.agent.AgentRunResult;
import com.panwatch.api.dto.request.InstrumentAgentRequest;
import com.panwatch.core.engine.AgentScheduler;
import com.panwatch.domain.model.Instrument;
import com.panwatch.domain.model.InstrumentAgentBinding;
import com.panwatch.domain.model.RuntimeOverride;
import com.panwatch.entity.InstrumentAgentEntity;
import com.panwatch.entity.InstrumentEntity;
import com.panwatch.exception.BusinessException;
import com.panwatch.exception.ErrorCode;
import com.panwatch.exception.ResourceNotFoundException;
import com.panwatch.mapper.InstrumentMapper;
import com.panwatch.repository.jpa.AgentConfigJpaRepository;
import com.panwatch.repository.jpa.AiModelJpaRepository;
import com.panwatch.repository.jpa.InstrumentAgentJpaRepository;
import com.panwatch.repository.jpa.InstrumentJpaRepository;
import com.panwatch.repository.jpa.NotifyChannelJpaRepository;
import com.panwatch.repository.jpa.PositionJpaRepository;
import com.panwatch.schedule.CronSchedule;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Watchlist instruments and their agent enrolments.
 *
 * <p>Deleting an instrument deletes its bindings and the positions held in it. Bindings are replaced as a whole set per
 * instrument; every binding must name a known agent and may override schedule, model and
 * channels.
 */
@Service
public class InstrumentService {

    private static final Logger log = LoggerFactory.getLogger(InstrumentService.class);

    private final InstrumentJpaRepository instrumentJpaRepository;
    private final InstrumentAgentJpaRepository instrumentAgentJpaRepository;
    private final AgentConfigJpaRepository agentConfigJpaRepository;
    private final AiModelJpaRepository aiModelJpaRepository;
    private final NotifyChannelJpaRepository notifyChannelJpaRepository;
    private final PositionJpaRepository positionJpaRepository;
    private final InstrumentMapper instrumentMapper;
    private final AgentScheduler agentScheduler;
    private final Clock clock;

    public InstrumentService(
            InstrumentJpaRepository instrumentJpaRepository,
            InstrumentAgentJpaRepository instrumentAgentJpaRepository,
            AgentConfigJpaRepository agentConfigJpaRepository,
            AiModelJpaRepository aiModelJpaRepository,
            NotifyChannelJpaRepository notifyChannelJpaRepository,
            PositionJpaRepository positionJpaRepository,
            InstrumentMapper instrumentMapper,
            AgentScheduler agentScheduler,
            Clock clock) {
        this.instrumentJpaRepository = instrumentJpaRepository;
        this.instrumentAgentJpaRepository = instrumentAgentJpaRepository;
        this.agentConfigJpaRepository = agentConfigJpaRepository;
        this.aiModelJpaRepository = aiModelJpaRepository;
        this.notifyChannelJpaRepository = notifyChannelJpaRepository;
        this.positionJpaRepository = positionJpaRepository;
        this.instrumentMapper = instrumentMapper;
        this.agentScheduler = agentScheduler;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<Instrument> getAll() {
        return instrumentMapper.toDomainList(instrumentJpaRepository.findAll());
    }

    @Transactional
    public Instrument create(Instrument instrument) {
        String symbol = instrument.getSymbol().trim().toUpperCase();
        if (instrumentJpaRepository.existsBySymbolAndMarket(symbol, instrument.getMarket())) {
            throw new BusinessException(ErrorCode.CONFLICT,
                    "Instrument already exists: " + symbol + " (" + instrument.getMarket() + ")",
                    Map.of("symbol", symbol, "market", instrument.getMarket().name()));
        }
        instrument.setSymbol(symbol);
        instrument.setCreatedAt(LocalDateTime.now(clock));

        InstrumentEntity saved = instrumentJpaRepository.save(instrumentMapper.toEntity(instrument));
        log.info("Instrument created: id={}, symbol={}, market={}", saved.getId(), saved.getSymbol(), saved.getMarket());
        return instrumentMapper.toDomain(saved);
    }

    /** Updates name and enabled flag; symbol and market identify the instrument and stay fixed. */
    @Transactional
    public Instrument update(Long id, String name, Boolean enabled) {
        InstrumentEntity entity = find(id);
        if (name != null) {
            entity.setName(name);
        }
        if (enabled != null) {
            entity.setEnabled(enabled);
        }
        InstrumentEntity saved = instrumentJpaRepository.save(entity);
        log.info("Instrument updated: id={}, enabled={}", saved.getId(), saved.isEnabled());
        return instrumentMapper.toDomain(saved);
    }

    @Transactional
    public void delete(Long id) {
        find(id);
        instrumentAgentJpaRepository.deleteByInstrumentId(id);
        positionJpaRepository.deleteByInstrumentId(id);
        instrumentJpaRepository.deleteById(id);
        log.info("Instrument deleted with its agent bindings and positions: id={}", id);
    }

    @Transactional(readOnly = true)
    public List<InstrumentAgentBinding> getBindings(Long instrumentId) {
        find(instrumentId);
        return instrumentMapper.toBindingList(instrumentAgentJpaRepository.findByInstrumentId(instrumentId));
    }

    /**
     * Replaces all agent bindings of an instrument.
     *
     * @throws ResourceNotFoundException if the instrument, an agent, model or channel is unknown
     * @throws com.panwatch.exception.InvalidScheduleException if a schedule override does not parse
     */
    @Transactional
    public List<InstrumentAgentBinding> replaceBindings(Long instrumentId, List<InstrumentAgentRequest> requests) {
        find(instrumentId);

        Set<String> seen = new HashSet<>();
        List<InstrumentAgentEntity> bindings = new ArrayList<>();
        for (InstrumentAgentRequest request : requests) {
            if (!seen.add(request.getAgentName())) {
                throw new BusinessException("Agent listed twice: " + request.getAgentName());
            }
            bindings.add(instrumentMapper.toBindingEntity(toBinding(instrumentId, request)));
        }

        instrumentAgentJpaRepository.deleteByInstrumentId(instrumentId);
        instrumentAgentJpaRepository.flush();
        List<InstrumentAgentEntity> saved = instrumentAgentJpaRepository.saveAll(bindings);
        log.info("Instrument {} bindings replaced: agents={}", instrumentId, seen);
        return instrumentMapper.toBindingList(saved);
    }

    /** Runs one agent for this instrument now; {@code bypassThrottle} skips the notification throttle. */
    public AgentRunResult trigger(Long instrumentId, String agentName, boolean bypassThrottle) {
        log.info("Manual trigger: agent={}, instrument={}, bypassThrottle={}", agentName, instrumentId, bypassThrottle);
        return agentScheduler.runNow(agentName, instrumentId, RuntimeOverride.manual(bypassThrottle));
    }

    private InstrumentAgentBinding toBinding(Long instrumentId, InstrumentAgentRequest request) {
        if (!agentConfigJpaRepository.existsByName(request.getAgentName())) {
            throw new ResourceNotFoundException("Agent", request.getAgentName());
        }
        String schedule = request.getSchedule() == null || request.getSchedule().isBlank()
                ? null
                : validSchedule(request.getSchedule());
        if (request.getAiModelId() != null && !aiModelJpaRepository.existsById(request.getAiModelId())) {
            throw new ResourceNotFoundException("AI model", request.getAiModelId());
        }
        List<Long> channelIds = new ArrayList<>();
        if (request.getNotifyChannelIds() != null) {
            for (Long channelId : new LinkedHashSet<>(request.getNotifyChannelIds())) {
                if (!notifyChannelJpaRepository.existsById(channelId)) {
                    throw new ResourceNotFoundException("Notify channel", channelId);
                }
                channelIds.add(channelId);
            }
        }
        return InstrumentAgentBinding.builder()
                .instrumentId(instrumentId)
                .agentName(request.getAgentName())
                .schedule(schedule)
                .aiModelId(request.getAiModelId())
                .notifyChannelIds(channelIds)
                .build();
    }

    private static String validSchedule(String schedule) {
        CronSchedule.parse(schedule);
        return schedule.trim();
    }

    private InstrumentEntity find(Long id) {
        return instrumentJpaRepository.findById(id).orElseThrow(() -> new ResourceNotFoundException("Instrument", id));
    }
}
