package com.panwatch.agent;

import com.panwatch.domain.model.AgentDefinition;
import com.panwatch.domain.model.AiModel;
import com.panwatch.domain.model.ConfigSnapshot;
import com.panwatch.domain.model.ExecutionConfig;
import com.panwatch.domain.model.InstrumentAgentBinding;
import com.panwatch.domain.model.NotifyChannel;
import com.panwatch.domain.model.RuntimeOverride;
import com.panwatch.exception.ConfigException;
import com.panwatch.schedule.CronSchedule;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Merges agent defaults, the per-instrument binding and a runtime override into the
 * effective {@link ExecutionConfig} of one run.
 *
 * <p>Each field is resolved left-biased over the layers: runtime override, then binding,
 * then agent default. Null, blank and empty values mean "not set at this layer". A non-empty
 * channel list replaces the lower layers wholesale; lists are never merged.
 *
 * <p>Fallbacks below the agent default:
 * <ul>
 *   <li>model: the installation default model, then the first configured model</li>
 *   <li>channels: the installation default channel; with none the run goes ahead without
 *       notifications</li>
 * </ul>
 * Resolution has no side effects and throws {@link ConfigException} on invalid input.
 */
@Component
public class ConfigResolver {

    private static final Logger log = LoggerFactory.getLogger(ConfigResolver.class);

    public ExecutionConfig resolve(
            AgentDefinition agent, InstrumentAgentBinding binding, RuntimeOverride override, ConfigSnapshot snapshot) {
        RuntimeOverride runtime = override != null ? override : RuntimeOverride.NONE;

        CronSchedule schedule = CronSchedule.parse(resolveScheduleText(agent, binding, runtime));
        AiModel model = resolveModel(agent, binding, runtime, snapshot);
        List<NotifyChannel> channels = resolveChannels(agent, binding, runtime, snapshot);

        return ExecutionConfig.builder()
                .agentName(agent.getName())
                .instrumentId(binding != null ? binding.getInstrumentId() : null)
                .schedule(schedule)
                .aiModelId(model.getId())
                .notifyChannels(channels)
                .executionMode(agent.getExecutionMode())
                .bypassThrottle(runtime.isBypassThrottle())
                .build();
    }

    /**
     * Effective schedule of a binding, without the rest of the resolution. Used by the
     * scheduler tick, which has no runtime override.
     */
    public CronSchedule resolveSchedule(AgentDefinition agent, InstrumentAgentBinding binding) {
        return CronSchedule.parse(resolveScheduleText(agent, binding, RuntimeOverride.NONE));
    }

    private String resolveScheduleText(AgentDefinition agent, InstrumentAgentBinding binding, RuntimeOverride runtime) {
        if (runtime.getSchedule() != null && !runtime.getSchedule().isBlank()) {
            return runtime.getSchedule();
        }
        if (binding != null && binding.hasScheduleOverride()) {
            return binding.getSchedule();
        }
        if (agent.getSchedule() == null || agent.getSchedule().isBlank()) {
            throw new ConfigException(
                    "Agent '" + agent.getName() + "' has no schedule", Map.of("agent", agent.getName()));
        }
        return agent.getSchedule();
    }

    private AiModel resolveModel(
            AgentDefinition agent, InstrumentAgentBinding binding, RuntimeOverride runtime, ConfigSnapshot snapshot) {
        Long explicit = firstNonNull(
                runtime.getAiModelId(), binding != null ? binding.getAiModelId() : null, agent.getAiModelId());
        if (explicit != null) {
            return snapshot.model(explicit)
                    .orElseThrow(() -> new ConfigException(
                            "AI model " + explicit + " referenced by agent '" + agent.getName() + "' does not exist",
                            Map.of("aiModelId", explicit)));
        }
        return snapshot.defaultModel()
                .or(snapshot::firstModel)
                .orElseThrow(() -> new ConfigException("No AI model configured; add one before running agents"));
    }

    private List<NotifyChannel> resolveChannels(
            AgentDefinition agent, InstrumentAgentBinding binding, RuntimeOverride runtime, ConfigSnapshot snapshot) {
        List<Long> ids;
        if (runtime.getNotifyChannelIds() != null && !runtime.getNotifyChannelIds().isEmpty()) {
            ids = runtime.getNotifyChannelIds();
        } else if (binding != null && binding.hasChannelOverride()) {
            ids = binding.getNotifyChannelIds();
        } else {
            ids = agent.getNotifyChannelIds() != null ? agent.getNotifyChannelIds() : List.of();
        }

        List<NotifyChannel> channels = new ArrayList<>();
        for (Long id : new LinkedHashSet<>(ids)) {
            Optional<NotifyChannel> channel = snapshot.channel(id);
            if (channel.isEmpty()) {
                log.warn("Dropping unknown channel id={} for agent={}", id, agent.getName());
            } else if (!channel.get().isEnabled()) {
                log.debug("Dropping disabled channel {} for agent={}", channel.get().getName(), agent.getName());
            } else {
                channels.add(channel.get());
            }
        }

        if (channels.isEmpty()) {
            Optional<NotifyChannel> fallback = snapshot.defaultChannel();
            if (fallback.isPresent()) {
                return List.of(fallback.get());
            }
            log.warn(
                    "No notification channel for agent={} instrument={}: no default channel configured",
                    agent.getName(),
                    binding != null ? binding.getInstrumentId() : "*");
        }
        return List.copyOf(channels);
    }

    @SafeVarargs
    private static <T> T firstNonNull(T... values) {
        for (T value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
