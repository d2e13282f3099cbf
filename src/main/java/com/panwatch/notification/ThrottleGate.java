package com.panwatch.notification;

import com.panwatch.config.ThrottleProperties;
import com.panwatch.domain.enums.ThrottleDecision;
import com.panwatch.domain.model.ThrottleState;
import com.panwatch.entity.NotifyThrottleEntity;
import com.panwatch.mapper.ExecutionRecordMapper;
import com.panwatch.repository.jpa.NotifyThrottleJpaRepository;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Rate-limits automatic notifications per (agent, instrument).
 *
 * <p>Check and record happen inside one per-key critical section, so two runs racing on the
 * same key can never both be ALLOWED within the interval. Different keys never contend.
 * State lives in notify_throttles and survives restarts.
 *
 * <p>Bypassed (manual) sends are always ALLOWED and leave the state untouched.
 */
@Service
public class ThrottleGate {

    private static final Logger log = LoggerFactory.getLogger(ThrottleGate.class);

    private final NotifyThrottleJpaRepository notifyThrottleJpaRepository;
    private final ExecutionRecordMapper executionRecordMapper;
    private final ThrottleProperties throttleProperties;
    private final ConcurrentHashMap<ThrottleKey, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ThrottleGate(
            NotifyThrottleJpaRepository notifyThrottleJpaRepository,
            ExecutionRecordMapper executionRecordMapper,
            ThrottleProperties throttleProperties) {
        this.notifyThrottleJpaRepository = notifyThrottleJpaRepository;
        this.executionRecordMapper = executionRecordMapper;
        this.throttleProperties = throttleProperties;
    }

    /** Uses the configured minimum interval. */
    public ThrottleDecision tryAcquire(ThrottleKey key, LocalDateTime now, boolean bypass) {
        return tryAcquire(key, now, throttleProperties.getMinInterval(), bypass);
    }

    public ThrottleDecision tryAcquire(ThrottleKey key, LocalDateTime now, Duration minInterval, boolean bypass) {
        if (bypass) {
            log.debug("Throttle bypassed for {}", key);
            return ThrottleDecision.ALLOWED;
        }

        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            Optional<NotifyThrottleEntity> existing =
                    notifyThrottleJpaRepository.findByAgentNameAndInstrumentKey(key.agentName(), key.instrumentKey());

            if (existing.isPresent()) {
                NotifyThrottleEntity entity = existing.get();
                Duration elapsed = Duration.between(entity.getLastNotifiedAt(), now);
                if (elapsed.compareTo(minInterval) < 0) {
                    log.info(
                            "Notification throttled: key={}, lastNotifiedAt={}, minInterval={}",
                            key,
                            entity.getLastNotifiedAt(),
                            minInterval);
                    return ThrottleDecision.THROTTLED;
                }
                // count restarts with each calendar day
                boolean sameDay = entity.getLastNotifiedAt().toLocalDate().equals(now.toLocalDate());
                entity.setNotifyCount(sameDay ? entity.getNotifyCount() + 1 : 1);
                entity.setLastNotifiedAt(now);
                notifyThrottleJpaRepository.save(entity);
            } else {
                notifyThrottleJpaRepository.save(NotifyThrottleEntity.builder()
                        .agentName(key.agentName())
                        .instrumentKey(key.instrumentKey())
                        .lastNotifiedAt(now)
                        .notifyCount(1)
                        .build());
            }
            return ThrottleDecision.ALLOWED;
        } finally {
            lock.unlock();
        }
    }

    public Optional<ThrottleState> state(ThrottleKey key) {
        return notifyThrottleJpaRepository
                .findByAgentNameAndInstrumentKey(key.agentName(), key.instrumentKey())
                .map(executionRecordMapper::toThrottleState);
    }
}
