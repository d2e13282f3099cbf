package com.panwatch.config;

import java.lang.reflect.Method;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools of the engine.
 *
 * <ul>
 *   <li>agentExecutor: agent runs handed off by the scheduler tick and manual triggers</li>
 *   <li>notifyExecutor: concurrent channel sends of one dispatch</li>
 *   <li>providerExecutor: bounded data-provider and analysis calls</li>
 * </ul>
 *
 * All pools use AbortPolicy. An overloaded agent pool rejects instead of running on the
 * scheduler thread; a rejected provider or channel call is recorded as a failed attempt by
 * its caller and never runs inline without a deadline.
 */
@Configuration
public class AsyncConfig implements AsyncConfigurer {

    @Value("${panwatch.async.agent.core-pool-size:4}")
    private int agentCorePoolSize;

    @Value("${panwatch.async.agent.max-pool-size:8}")
    private int agentMaxPoolSize;

    @Value("${panwatch.async.agent.queue-capacity:200}")
    private int agentQueueCapacity;

    @Value("${panwatch.async.notify.pool-size:4}")
    private int notifyPoolSize;

    @Value("${panwatch.async.provider.pool-size:8}")
    private int providerPoolSize;

    @Primary
    @Bean("agentExecutor")
    public ThreadPoolTaskExecutor agentExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(agentCorePoolSize);
        executor.setMaxPoolSize(agentMaxPoolSize);
        executor.setQueueCapacity(agentQueueCapacity);
        executor.setThreadNamePrefix("agent-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Bean("notifyExecutor")
    public ThreadPoolTaskExecutor notifyExecutor() {
        return boundedPool("notify-", notifyPoolSize);
    }

    @Bean("providerExecutor")
    public ThreadPoolTaskExecutor providerExecutor() {
        return boundedPool("provider-", providerPoolSize);
    }

    private ThreadPoolTaskExecutor boundedPool(String prefix, int size) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix(prefix);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(15);
        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return agentExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (Throwable throwable, Method method, Object... params) -> {
            Logger logger = LoggerFactory.getLogger(method.getDeclaringClass());
            logger.error("Async error in method {}: {}", method.getName(), throwable.getMessage(), throwable);
        };
    }
}
