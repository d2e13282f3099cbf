package com.panwatch.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.panwatch.agent.AnalysisService;
import com.panwatch.domain.enums.ChannelType;
import com.panwatch.entity.AiModelEntity;
import com.panwatch.entity.NotifyChannelEntity;
import com.panwatch.mapper.AiModelMapper;
import com.panwatch.mapper.NotifyChannelMapper;
import com.panwatch.notification.NotificationDispatcher;
import com.panwatch.repository.jpa.AiModelJpaRepository;
import com.panwatch.repository.jpa.NotifyChannelJpaRepository;
import com.panwatch.service.ChannelService;
import com.panwatch.service.ModelService;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.LongConsumer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;
import org.mapstruct.factory.Mappers;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Two transactions promoting different rows at the same time must leave exactly one default.
 * Runs against the embedded H2 database with real commits, outside the test transaction.
 */
@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class DefaultFlagConcurrencyTest {

    @Autowired
    private NotifyChannelJpaRepository notifyChannelJpaRepository;

    @Autowired
    private AiModelJpaRepository aiModelJpaRepository;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private ChannelService channelService;
    private ModelService modelService;
    private TransactionTemplate transactionTemplate;

    @BeforeEach
    void setUp() {
        channelService = new ChannelService(
                notifyChannelJpaRepository,
                Mappers.getMapper(NotifyChannelMapper.class),
                mock(NotificationDispatcher.class));
        modelService = new ModelService(
                aiModelJpaRepository, Mappers.getMapper(AiModelMapper.class), mock(AnalysisService.class));
        transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @AfterEach
    void tearDown() {
        notifyChannelJpaRepository.deleteAll();
        aiModelJpaRepository.deleteAll();
    }

    @RepeatedTest(5)
    @DisplayName("concurrent channel setDefault leaves one default channel")
    void concurrentChannelDefaults() throws Exception {
        long first = notifyChannelJpaRepository.saveAndFlush(channel("tg", true)).getId();
        long second = notifyChannelJpaRepository.saveAndFlush(channel("bark", false)).getId();
        long third = notifyChannelJpaRepository.saveAndFlush(channel("wecom", false)).getId();

        int committed = raceInTransactions(channelService::setDefault, second, third);

        assertThat(committed).isPositive();
        assertThat(notifyChannelJpaRepository.findAll())
                .filteredOn(NotifyChannelEntity::isDefaultChannel)
                .singleElement()
                .satisfies(c -> assertThat(c.getId()).isIn(second, third).isNotEqualTo(first));
    }

    @RepeatedTest(5)
    @DisplayName("concurrent model setDefault leaves one default model")
    void concurrentModelDefaults() throws Exception {
        aiModelJpaRepository.saveAndFlush(model("deepseek", true));
        long second = aiModelJpaRepository.saveAndFlush(model("qwen", false)).getId();
        long third = aiModelJpaRepository.saveAndFlush(model("glm", false)).getId();

        int committed = raceInTransactions(modelService::setDefault, second, third);

        assertThat(committed).isPositive();
        assertThat(aiModelJpaRepository.findAll())
                .filteredOn(AiModelEntity::isDefaultModel)
                .singleElement()
                .satisfies(m -> assertThat(m.getId()).isIn(second, third));
    }

    /**
     * Starts one transaction per id, lines them up on a barrier inside the transaction so both
     * are open at once, then lets them run. A transaction the database aborts on a lock
     * conflict is tolerated; the invariant must hold whichever commits.
     *
     * @return how many transactions committed
     */
    private int raceInTransactions(LongConsumer setDefault, long... ids) throws Exception {
        CyclicBarrier barrier = new CyclicBarrier(ids.length);
        ExecutorService pool = Executors.newFixedThreadPool(ids.length);
        List<Throwable> aborted = Collections.synchronizedList(new ArrayList<>());
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (long id : ids) {
                futures.add(pool.submit(() -> {
                    try {
                        transactionTemplate.executeWithoutResult(status -> {
                            try {
                                barrier.await(5, TimeUnit.SECONDS);
                            } catch (Exception e) {
                                throw new IllegalStateException(e);
                            }
                            setDefault.accept(id);
                        });
                    } catch (RuntimeException e) {
                        aborted.add(e);
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(20, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
        return ids.length - aborted.size();
    }

    private static NotifyChannelEntity channel(String name, boolean isDefault) {
        return NotifyChannelEntity.builder()
                .name(name)
                .type(ChannelType.BARK)
                .config("{\"device_key\":\"k\"}")
                .enabled(true)
                .defaultChannel(isDefault)
                .build();
    }

    private static AiModelEntity model(String name, boolean isDefault) {
        return AiModelEntity.builder()
                .name(name)
                .providerId("openai")
                .model(name + "-chat")
                .defaultModel(isDefault)
                .build();
    }
}
