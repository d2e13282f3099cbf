package com.panwatch.unit.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.panwatch.domain.enums.ChannelType;
import com.panwatch.domain.model.ConnectionTestResult;
import com.panwatch.domain.model.NotifyChannel;
import com.panwatch.entity.NotifyChannelEntity;
import com.panwatch.exception.ResourceNotFoundException;
import com.panwatch.mapper.NotifyChannelMapper;
import com.panwatch.notification.NotificationDispatcher;
import com.panwatch.repository.jpa.NotifyChannelJpaRepository;
import com.panwatch.service.ChannelService;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class ChannelServiceTest {

    @Mock
    private NotifyChannelJpaRepository notifyChannelJpaRepository;

    @Mock
    private NotificationDispatcher notificationDispatcher;

    private ChannelService channelService;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        channelService = new ChannelService(
                notifyChannelJpaRepository, Mappers.getMapper(NotifyChannelMapper.class), notificationDispatcher);
        when(notifyChannelJpaRepository.save(any(NotifyChannelEntity.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private static NotifyChannelEntity telegram(Long id, boolean isDefault) {
        return NotifyChannelEntity.builder()
                .id(id)
                .name("tg-" + id)
                .type(ChannelType.TELEGRAM)
                .config("{\"bot_token\":\"123:ABC\",\"chat_id\":\"42\"}")
                .enabled(true)
                .defaultChannel(isDefault)
                .build();
    }

    @Test
    @DisplayName("setDefault swaps the flag with one statement and returns the reloaded row")
    void setDefaultSwapsInOneStatement() {
        when(notifyChannelJpaRepository.findById(3L))
                .thenReturn(Optional.of(telegram(3L, false)), Optional.of(telegram(3L, true)));

        NotifyChannel result = channelService.setDefault(3L);

        assertThat(result.isDefaultChannel()).isTrue();
        InOrder order = inOrder(notifyChannelJpaRepository);
        order.verify(notifyChannelJpaRepository).findById(3L);
        order.verify(notifyChannelJpaRepository).makeDefault(3L);
        order.verify(notifyChannelJpaRepository).findById(3L);
        verify(notifyChannelJpaRepository, never()).save(any(NotifyChannelEntity.class));
    }

    @Test
    void setDefaultOnUnknownChannelChangesNothing() {
        when(notifyChannelJpaRepository.findById(9L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> channelService.setDefault(9L)).isInstanceOf(ResourceNotFoundException.class);
        verify(notifyChannelJpaRepository, never()).makeDefault(any());
    }

    @Test
    @DisplayName("a new default channel is inserted unflagged, then promoted")
    void creatingADefaultChannelPromotesAfterInsert() {
        NotifyChannel channel = NotifyChannel.builder()
                .id(77L)
                .name("bark")
                .type(ChannelType.BARK)
                .config(Map.of("device_key", "k"))
                .enabled(true)
                .defaultChannel(true)
                .build();

        when(notifyChannelJpaRepository.save(any(NotifyChannelEntity.class))).thenAnswer(inv -> {
            NotifyChannelEntity entity = inv.getArgument(0);
            entity.setId(10L);
            return entity;
        });
        NotifyChannelEntity promoted = telegram(10L, true);
        when(notifyChannelJpaRepository.findById(10L)).thenReturn(Optional.of(promoted));

        NotifyChannel created = channelService.create(channel);

        ArgumentCaptor<NotifyChannelEntity> saved = ArgumentCaptor.forClass(NotifyChannelEntity.class);
        verify(notifyChannelJpaRepository).save(saved.capture());
        assertThat(saved.getValue().isDefaultChannel()).isFalse();
        InOrder order = inOrder(notifyChannelJpaRepository);
        order.verify(notifyChannelJpaRepository).save(any(NotifyChannelEntity.class));
        order.verify(notifyChannelJpaRepository).makeDefault(10L);
        assertThat(created.getId()).isEqualTo(10L);
        assertThat(created.isDefaultChannel()).isTrue();
    }

    @Test
    void creatingANonDefaultChannelLeavesTheDefaultAlone() {
        channelService.create(NotifyChannel.builder().name("wecom").type(ChannelType.WECOM).enabled(true).build());

        verify(notifyChannelJpaRepository, never()).makeDefault(any());
    }

    @Test
    void listIsOrderedById() {
        when(notifyChannelJpaRepository.findAll()).thenReturn(List.of(telegram(5L, false), telegram(2L, true)));

        assertThat(channelService.getAll()).extracting(NotifyChannel::getId).containsExactly(2L, 5L);
    }

    @Test
    void testDelegatesToTheDispatcherWithTheStoredChannel() {
        when(notifyChannelJpaRepository.findById(3L)).thenReturn(Optional.of(telegram(3L, false)));
        ConnectionTestResult expected = ConnectionTestResult.builder().success(true).count(1).build();
        when(notificationDispatcher.testChannel(any())).thenReturn(expected);

        assertThat(channelService.test(3L)).isSameAs(expected);

        ArgumentCaptor<NotifyChannel> channel = ArgumentCaptor.forClass(NotifyChannel.class);
        verify(notificationDispatcher).testChannel(channel.capture());
        assertThat(channel.getValue().getConfig()).containsEntry("chat_id", "42");
    }
}
