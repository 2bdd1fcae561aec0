package com.packsync.config;

import java.lang.reflect.Method;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools for asynchronous work.
 *
 * <p>{@code reconcileExecutor} runs one reconcile-and-sync pass per scrape completion.
 * Passes for different performances run in parallel; passes for the same performance
 * are serialized by the performance lock. {@code eventExecutor} carries notifications
 * and other fire-and-forget listeners.
 */
@Configuration
public class AsyncConfig implements AsyncConfigurer {

    @Value("${packsync.async.core-pool-size:4}")
    private int corePoolSize;

    @Value("${packsync.async.max-pool-size:8}")
    private int maxPoolSize;

    @Value("${packsync.async.queue-capacity:500}")
    private int queueCapacity;

    @Value("${packsync.async.reconcile-pool-size:4}")
    private int reconcilePoolSize;

    @Value("${packsync.async.reconcile-queue-capacity:1000}")
    private int reconcileQueueCapacity;

    @Bean("eventExecutor")
    public ThreadPoolTaskExecutor eventExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("event-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Bean("reconcileExecutor")
    public ThreadPoolTaskExecutor reconcileExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(reconcilePoolSize);
        executor.setMaxPoolSize(reconcilePoolSize);
        executor.setQueueCapacity(reconcileQueueCapacity);
        executor.setThreadNamePrefix("reconcile-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(120);
        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return eventExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (Throwable throwable, Method method, Object... params) -> {
            Logger logger = LoggerFactory.getLogger(method.getDeclaringClass());
            logger.error("Async error in method {}: {}", method.getName(), throwable.getMessage(), throwable);
        };
    }
}
