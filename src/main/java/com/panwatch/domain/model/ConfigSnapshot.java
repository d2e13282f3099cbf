package com.panwatch.domain.model;

import com.panwatch.domain.enums.DataSourceType;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Immutable view of the configuration tables taken once when a run starts resolving.
 * Edits made while the run is in flight do not leak into it.
 */
public final class ConfigSnapshot {

    private final LocalDateTime capturedAt;
    private final Map<String, AgentDefinition> agents;
    private final Map<Long, NotifyChannel> channels;
    private final List<AiModel> models;
    private final List<DataSourceBinding> dataSources;

    public ConfigSnapshot(
            LocalDateTime capturedAt,
            List<AgentDefinition> agents,
            List<NotifyChannel> channels,
            List<AiModel> models,
            List<DataSourceBinding> dataSources) {
        this.capturedAt = capturedAt;
        this.agents = agents.stream()
                .collect(Collectors.toUnmodifiableMap(AgentDefinition::getName, Function.identity(), (a, b) -> a));
        this.channels = channels.stream()
                .collect(Collectors.toUnmodifiableMap(NotifyChannel::getId, Function.identity(), (a, b) -> a));
        this.models = models.stream()
                .sorted(Comparator.comparing(AiModel::getId, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
        this.dataSources = List.copyOf(dataSources);
    }

    public LocalDateTime getCapturedAt() {
        return capturedAt;
    }

    public Optional<AgentDefinition> agent(String name) {
        return Optional.ofNullable(agents.get(name));
    }

    public List<AgentDefinition> agents() {
        return agents.values().stream().sorted(Comparator.comparing(AgentDefinition::getName)).toList();
    }

    public Optional<NotifyChannel> channel(Long id) {
        return Optional.ofNullable(channels.get(id));
    }

    public Optional<NotifyChannel> defaultChannel() {
        return channels.values().stream()
                .filter(NotifyChannel::isDefaultChannel)
                .filter(NotifyChannel::isEnabled)
                .min(Comparator.comparing(NotifyChannel::getId));
    }

    public Optional<AiModel> model(Long id) {
        return models.stream().filter(m -> Objects.equals(m.getId(), id)).findFirst();
    }

    public Optional<AiModel> defaultModel() {
        return models.stream().filter(AiModel::isDefaultModel).findFirst();
    }

    public Optional<AiModel> firstModel() {
        return models.stream().findFirst();
    }

    public List<DataSourceBinding> dataSources() {
        return dataSources;
    }

    public List<DataSourceBinding> dataSourcesOf(DataSourceType type) {
        return dataSources.stream().filter(ds -> ds.getType() == type).toList();
    }
}
