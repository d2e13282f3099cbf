package com.panwatch.unit.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.panwatch.config.ThrottleProperties;
import com.panwatch.domain.enums.ThrottleDecision;
import com.panwatch.domain.model.ThrottleState;
import com.panwatch.entity.NotifyThrottleEntity;
import com.panwatch.mapper.ExecutionRecordMapper;
import com.panwatch.notification.ThrottleGate;
import com.panwatch.notification.ThrottleKey;
import com.panwatch.repository.jpa.NotifyThrottleJpaRepository;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

/**
 * Unit tests for ThrottleGate.
 *
 * <p>The repository is backed by an in-memory map so decisions can be chained across calls.
 */
class ThrottleGateTest {

    private static final LocalDateTime T = LocalDateTime.of(2024, 6, 3, 10, 0);
    private static final Duration MINUTE = Duration.ofSeconds(60);

    @Mock
    private NotifyThrottleJpaRepository notifyThrottleJpaRepository;

    private final Map<String, NotifyThrottleEntity> rows = new ConcurrentHashMap<>();
    private AutoCloseable mocks;
    private ThrottleGate throttleGate;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        when(notifyThrottleJpaRepository.findByAgentNameAndInstrumentKey(anyString(), anyString()))
                .thenAnswer(inv -> Optional.ofNullable(rows.get(inv.getArgument(0) + "|" + inv.getArgument(1))));
        when(notifyThrottleJpaRepository.save(any(NotifyThrottleEntity.class))).thenAnswer(inv -> {
            NotifyThrottleEntity entity = inv.getArgument(0);
            rows.put(entity.getAgentName() + "|" + entity.getInstrumentKey(), entity);
            return entity;
        });

        ThrottleProperties properties = new ThrottleProperties();
        properties.setMinInterval(Duration.ofMinutes(30));
        throttleGate = new ThrottleGate(
                notifyThrottleJpaRepository, Mappers.getMapper(ExecutionRecordMapper.class), properties);
    }

    @AfterEach
    void tearDown() throws Exception {
        mocks.close();
    }

    private ThrottleState stateOf(ThrottleKey key) {
        return throttleGate.state(key).orElseThrow();
    }

    @Test
    @DisplayName("first send allowed, bypass at t+1s allowed without touching state, t+30s throttled")
    void bypassDoesNotResetTheWindow() {
        ThrottleKey key = ThrottleKey.of("intraday_monitor", 7L);

        assertThat(throttleGate.tryAcquire(key, T, MINUTE, false)).isEqualTo(ThrottleDecision.ALLOWED);
        assertThat(throttleGate.tryAcquire(key, T.plusSeconds(1), MINUTE, true)).isEqualTo(ThrottleDecision.ALLOWED);

        assertThat(stateOf(key).getLastNotifiedAt()).isEqualTo(T);
        assertThat(stateOf(key).getNotifyCount()).isEqualTo(1);

        assertThat(throttleGate.tryAcquire(key, T.plusSeconds(30), MINUTE, false))
                .isEqualTo(ThrottleDecision.THROTTLED);
        assertThat(stateOf(key).getLastNotifiedAt()).isEqualTo(T);
    }

    @Test
    void allowedAgainOnceIntervalHasElapsed() {
        ThrottleKey key = ThrottleKey.of("intraday_monitor", 7L);

        throttleGate.tryAcquire(key, T, MINUTE, false);

        assertThat(throttleGate.tryAcquire(key, T.plusSeconds(60), MINUTE, false)).isEqualTo(ThrottleDecision.ALLOWED);
        assertThat(stateOf(key).getLastNotifiedAt()).isEqualTo(T.plusSeconds(60));
        assertThat(stateOf(key).getNotifyCount()).isEqualTo(2);
    }

    @Test
    void bypassNeverReadsOrWritesState() {
        ThrottleKey key = ThrottleKey.of("intraday_monitor", 7L);

        assertThat(throttleGate.tryAcquire(key, T, MINUTE, true)).isEqualTo(ThrottleDecision.ALLOWED);

        verify(notifyThrottleJpaRepository, never()).findByAgentNameAndInstrumentKey(anyString(), anyString());
        verify(notifyThrottleJpaRepository, never()).save(any());
        assertThat(rows).isEmpty();
    }

    @Test
    void keysAreIndependent() {
        ThrottleKey first = ThrottleKey.of("intraday_monitor", 7L);
        ThrottleKey second = ThrottleKey.of("intraday_monitor", 8L);
        ThrottleKey batch = ThrottleKey.batch("daily_report");

        throttleGate.tryAcquire(first, T, MINUTE, false);

        assertThat(throttleGate.tryAcquire(second, T.plusSeconds(5), MINUTE, false)).isEqualTo(ThrottleDecision.ALLOWED);
        assertThat(throttleGate.tryAcquire(batch, T.plusSeconds(5), MINUTE, false)).isEqualTo(ThrottleDecision.ALLOWED);
        assertThat(batch.instrumentKey()).isEqualTo("*");
    }

    @Test
    void notifyCountRestartsOnNewDay() {
        ThrottleKey key = ThrottleKey.of("intraday_monitor", 7L);

        throttleGate.tryAcquire(key, T, MINUTE, false);
        throttleGate.tryAcquire(key, T.plusHours(1), MINUTE, false);
        assertThat(stateOf(key).getNotifyCount()).isEqualTo(2);

        throttleGate.tryAcquire(key, T.plusDays(1), MINUTE, false);
        assertThat(stateOf(key).getNotifyCount()).isEqualTo(1);
    }

    @Test
    void defaultIntervalComesFromProperties() {
        ThrottleKey key = ThrottleKey.of("intraday_monitor", 7L);

        throttleGate.tryAcquire(key, T, false);

        assertThat(throttleGate.tryAcquire(key, T.plusMinutes(29), false)).isEqualTo(ThrottleDecision.THROTTLED);
        assertThat(throttleGate.tryAcquire(key, T.plusMinutes(30), false)).isEqualTo(ThrottleDecision.ALLOWED);
    }

    @Test
    @DisplayName("racing callers on one key get exactly one ALLOWED")
    void concurrentAcquireAllowsOnlyOne() throws Exception {
        ThrottleKey key = ThrottleKey.of("intraday_monitor", 7L);
        int threads = 8;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<ThrottleDecision>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<ThrottleDecision> call = () -> {
                    start.await();
                    return throttleGate.tryAcquire(key, T, MINUTE, false);
                };
                futures.add(pool.submit(call));
            }
            start.countDown();

            long allowed = 0;
            for (Future<ThrottleDecision> future : futures) {
                if (future.get() == ThrottleDecision.ALLOWED) {
                    allowed++;
                }
            }
            assertThat(allowed).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void unknownKeyHasNoState() {
        assertThat(throttleGate.state(ThrottleKey.of("news_digest", 1L))).isEmpty();
    }
}
