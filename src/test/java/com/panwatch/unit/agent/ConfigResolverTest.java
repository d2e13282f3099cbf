package com.panwatch.unit.agent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.panwatch.agent.ConfigResolver;
import com.panwatch.domain.enums.ChannelType;
import com.panwatch.domain.enums.ExecutionMode;
import com.panwatch.domain.model.AgentDefinition;
import com.panwatch.domain.model.AiModel;
import com.panwatch.domain.model.ConfigSnapshot;
import com.panwatch.domain.model.ExecutionConfig;
import com.panwatch.domain.model.InstrumentAgentBinding;
import com.panwatch.domain.model.NotifyChannel;
import com.panwatch.domain.model.RuntimeOverride;
import com.panwatch.exception.ConfigException;
import com.panwatch.exception.InvalidScheduleException;
import com.panwatch.schedule.CronSchedule;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Layering of runtime override, binding override and agent defaults, plus model and
 * channel fallbacks.
 */
class ConfigResolverTest {

    private final ConfigResolver configResolver = new ConfigResolver();

    private AgentDefinition agent;
    private NotifyChannel telegram;
    private NotifyChannel bark;
    private NotifyChannel disabledWecom;
    private AiModel defaultModel;
    private AiModel otherModel;

    @BeforeEach
    void setUp() {
        agent = AgentDefinition.builder()
                .name("intraday_monitor")
                .enabled(true)
                .executionMode(ExecutionMode.SINGLE)
                .schedule("*/5 9-15 * * 1-5")
                .notifyChannelIds(new ArrayList<>())
                .build();
        telegram = channel(1L, "tg", ChannelType.TELEGRAM, true, true);
        bark = channel(2L, "bark", ChannelType.BARK, true, false);
        disabledWecom = channel(3L, "wecom", ChannelType.WECOM, false, false);
        defaultModel = AiModel.builder().id(10L).name("main").providerId("openai").model("gpt-4o").defaultModel(true).build();
        otherModel = AiModel.builder().id(11L).name("alt").providerId("deepseek").model("deepseek-chat").build();
    }

    private ConfigSnapshot snapshot(List<NotifyChannel> channels, List<AiModel> models) {
        return new ConfigSnapshot(LocalDateTime.of(2024, 6, 3, 9, 30), List.of(agent), channels, models, List.of());
    }

    private ConfigSnapshot fullSnapshot() {
        return snapshot(List.of(telegram, bark, disabledWecom), List.of(defaultModel, otherModel));
    }

    private static NotifyChannel channel(Long id, String name, ChannelType type, boolean enabled, boolean isDefault) {
        return NotifyChannel.builder().id(id).name(name).type(type).enabled(enabled).defaultChannel(isDefault).build();
    }

    private static InstrumentAgentBinding binding(String schedule, Long modelId, List<Long> channelIds) {
        return InstrumentAgentBinding.builder()
                .instrumentId(7L)
                .agentName("intraday_monitor")
                .schedule(schedule)
                .aiModelId(modelId)
                .notifyChannelIds(new ArrayList<>(channelIds))
                .build();
    }

    @Nested
    @DisplayName("schedule precedence")
    class Schedule {

        @Test
        void bindingScheduleOverridesAgentDefault() {
            ExecutionConfig config = configResolver.resolve(
                    agent, binding("0 10 * * 1-5", null, List.of()), RuntimeOverride.NONE, fullSnapshot());

            assertThat(config.getSchedule()).isEqualTo(CronSchedule.parse("0 10 * * 1-5"));
            assertThat(config.getInstrumentId()).isEqualTo(7L);
        }

        @Test
        void blankBindingScheduleInheritsAgentDefault() {
            ExecutionConfig config = configResolver.resolve(
                    agent, binding("  ", null, List.of()), RuntimeOverride.NONE, fullSnapshot());

            assertThat(config.getSchedule()).isEqualTo(CronSchedule.parse("*/5 9-15 * * 1-5"));
        }

        @Test
        void runtimeScheduleOverridesBinding() {
            RuntimeOverride override = RuntimeOverride.builder().schedule("0 14 * * *").build();

            ExecutionConfig config = configResolver.resolve(
                    agent, binding("0 10 * * 1-5", null, List.of()), override, fullSnapshot());

            assertThat(config.getSchedule()).isEqualTo(CronSchedule.parse("0 14 * * *"));
        }

        @Test
        void invalidBindingScheduleIsAConfigError() {
            assertThatThrownBy(() -> configResolver.resolveSchedule(agent, binding("99 * * * *", null, List.of())))
                    .isInstanceOf(InvalidScheduleException.class)
                    .isInstanceOf(ConfigException.class);
        }

        @Test
        void agentWithoutScheduleIsAConfigError() {
            agent.setSchedule(null);

            assertThatThrownBy(() -> configResolver.resolveSchedule(agent, null)).isInstanceOf(ConfigException.class);
        }
    }

    @Nested
    @DisplayName("model resolution")
    class Model {

        @Test
        void bindingModelWinsOverAgentModel() {
            agent.setAiModelId(10L);

            ExecutionConfig config = configResolver.resolve(
                    agent, binding(null, 11L, List.of()), RuntimeOverride.NONE, fullSnapshot());

            assertThat(config.getAiModelId()).isEqualTo(11L);
        }

        @Test
        void fallsBackToDefaultModel() {
            ExecutionConfig config = configResolver.resolve(agent, null, RuntimeOverride.NONE, fullSnapshot());

            assertThat(config.getAiModelId()).isEqualTo(10L);
        }

        @Test
        void fallsBackToFirstModelWhenNoDefault() {
            defaultModel.setDefaultModel(false);

            ExecutionConfig config = configResolver.resolve(agent, null, RuntimeOverride.NONE, fullSnapshot());

            assertThat(config.getAiModelId()).isEqualTo(10L);
        }

        @Test
        void danglingModelIdIsAConfigError() {
            agent.setAiModelId(99L);

            assertThatThrownBy(() -> configResolver.resolve(agent, null, RuntimeOverride.NONE, fullSnapshot()))
                    .isInstanceOf(ConfigException.class)
                    .hasMessageContaining("99");
        }

        @Test
        void noModelsIsAConfigError() {
            ConfigSnapshot empty = snapshot(List.of(telegram), List.of());

            assertThatThrownBy(() -> configResolver.resolve(agent, null, RuntimeOverride.NONE, empty))
                    .isInstanceOf(ConfigException.class);
        }
    }

    @Nested
    @DisplayName("channel resolution")
    class Channels {

        @Test
        void emptyListsFallBackToDefaultChannel() {
            ExecutionConfig config = configResolver.resolve(
                    agent, binding(null, null, List.of()), RuntimeOverride.NONE, fullSnapshot());

            assertThat(config.getNotifyChannels()).containsExactly(telegram);
            assertThat(config.canNotify()).isTrue();
        }

        @Test
        void bindingChannelsKeepOrderAndDropDuplicates() {
            ExecutionConfig config = configResolver.resolve(
                    agent, binding(null, null, List.of(2L, 1L, 2L)), RuntimeOverride.NONE, fullSnapshot());

            assertThat(config.getNotifyChannels()).containsExactly(bark, telegram);
        }

        @Test
        void disabledAndUnknownChannelsAreDropped() {
            agent.setNotifyChannelIds(new ArrayList<>(List.of(3L, 42L, 2L)));

            ExecutionConfig config = configResolver.resolve(agent, null, RuntimeOverride.NONE, fullSnapshot());

            assertThat(config.getNotifyChannels()).containsExactly(bark);
        }

        @Test
        void onlyDisabledChannelsFallBackToDefault() {
            agent.setNotifyChannelIds(new ArrayList<>(List.of(3L)));

            ExecutionConfig config = configResolver.resolve(agent, null, RuntimeOverride.NONE, fullSnapshot());

            assertThat(config.getNotifyChannels()).containsExactly(telegram);
        }

        @Test
        void noDefaultChannelMeansNoChannelsRatherThanAnError() {
            ConfigSnapshot noDefault = snapshot(List.of(bark), List.of(defaultModel));

            ExecutionConfig config = configResolver.resolve(agent, null, RuntimeOverride.NONE, noDefault);

            assertThat(config.getNotifyChannels()).isEmpty();
            assertThat(config.canNotify()).isFalse();
        }

        @Test
        void runtimeChannelsAndBypassWin() {
            RuntimeOverride override = RuntimeOverride.builder()
                    .bypassThrottle(true)
                    .notifyChannelIds(List.of(2L))
                    .build();

            ExecutionConfig config = configResolver.resolve(
                    agent, binding(null, null, List.of(1L)), override, fullSnapshot());

            assertThat(config.getNotifyChannels()).containsExactly(bark);
            assertThat(config.isBypassThrottle()).isTrue();
        }
    }
}
