package com.panwatch.service;

import com.panwatch.domain.model.ConnectionTestResult;
import com.panwatch.domain.model.NotifyChannel;
import com.panwatch.entity.NotifyChannelEntity;
import com.panwatch.exception.ResourceNotFoundException;
import com.panwatch.mapper.NotifyChannelMapper;
import com.panwatch.notification.NotificationDispatcher;
import com.panwatch.repository.jpa.NotifyChannelJpaRepository;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Notification channel CRUD.
 *
 * <p>At most one channel is the default. A row is always saved unflagged and then promoted
 * with {@link NotifyChannelJpaRepository#makeDefault(Long)}, which rewrites the flag of every
 * row in one statement; concurrent requests end with whichever committed last.
 */
@Service
public class ChannelService {

    private static final Logger log = LoggerFactory.getLogger(ChannelService.class);

    private final NotifyChannelJpaRepository notifyChannelJpaRepository;
    private final NotifyChannelMapper notifyChannelMapper;
    private final NotificationDispatcher notificationDispatcher;

    public ChannelService(
            NotifyChannelJpaRepository notifyChannelJpaRepository,
            NotifyChannelMapper notifyChannelMapper,
            NotificationDispatcher notificationDispatcher) {
        this.notifyChannelJpaRepository = notifyChannelJpaRepository;
        this.notifyChannelMapper = notifyChannelMapper;
        this.notificationDispatcher = notificationDispatcher;
    }

    @Transactional(readOnly = true)
    public List<NotifyChannel> getAll() {
        return notifyChannelMapper.toDomainList(notifyChannelJpaRepository.findAll()).stream()
                .sorted(Comparator.comparing(NotifyChannel::getId))
                .toList();
    }

    @Transactional
    public NotifyChannel create(NotifyChannel channel) {
        channel.setId(null);
        boolean promote = channel.isDefaultChannel();
        channel.setDefaultChannel(false);
        NotifyChannelEntity saved = notifyChannelJpaRepository.save(notifyChannelMapper.toEntity(channel));
        if (promote) {
            saved = promote(saved.getId());
        }
        log.info("Notify channel created: id={}, type={}, default={}", saved.getId(), saved.getType(), saved.isDefaultChannel());
        return notifyChannelMapper.toDomain(saved);
    }

    @Transactional
    public NotifyChannel update(Long id, NotifyChannel updates) {
        find(id);
        boolean promote = updates.isDefaultChannel();
        updates.setDefaultChannel(false);
        updates.setId(id);
        NotifyChannelEntity saved = notifyChannelJpaRepository.save(notifyChannelMapper.toEntity(updates));
        if (promote) {
            saved = promote(id);
        }
        log.info("Notify channel updated: id={}, enabled={}, default={}", saved.getId(), saved.isEnabled(), saved.isDefaultChannel());
        return notifyChannelMapper.toDomain(saved);
    }

    @Transactional
    public void delete(Long id) {
        find(id);
        notifyChannelJpaRepository.deleteById(id);
        log.info("Notify channel deleted: id={}", id);
    }

    @Transactional
    public NotifyChannel setDefault(Long id) {
        find(id);
        NotifyChannelEntity saved = promote(id);
        log.info("Default notify channel set: id={}, name={}", saved.getId(), saved.getName());
        return notifyChannelMapper.toDomain(saved);
    }

    /** Sends a test message to this channel only, outside the throttle. */
    public ConnectionTestResult test(Long id) {
        NotifyChannel channel = notifyChannelMapper.toDomain(
                notifyChannelJpaRepository.findById(id)
                        .orElseThrow(() -> new ResourceNotFoundException("Notify channel", id)));
        return notificationDispatcher.testChannel(channel);
    }

    private NotifyChannelEntity promote(Long id) {
        notifyChannelJpaRepository.makeDefault(id);
        return find(id);
    }

    private NotifyChannelEntity find(Long id) {
        return notifyChannelJpaRepository.findById(id).orElseThrow(() -> new ResourceNotFoundException("Notify channel", id));
    }
}
