package com.shopsync.ordersync.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Two pools: per-order tracking analysis runs on one, and each analysis hands its classifier call
 * to the other so the timeout wait never occupies a slot the classifier needs.
 */
@Configuration
public class TaskExecutorConfig {

    @Value("${app.tracking.executor.core-pool-size:5}")
    private int corePoolSize;

    @Value("${app.tracking.executor.max-pool-size:8}")
    private int maxPoolSize;

    @Value("${app.tracking.executor.queue-capacity:500}")
    private int queueCapacity;

    @Bean("trackingAnalysisExecutor")
    public TaskExecutor trackingAnalysisExecutor() {
        return buildExecutor("TrackingWorker-");
    }

    @Bean("classifierExecutor")
    public TaskExecutor classifierExecutor() {
        return buildExecutor("Classifier-");
    }

    private ThreadPoolTaskExecutor buildExecutor(String threadNamePrefix) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(Math.max(corePoolSize, maxPoolSize));
        executor.setQueueCapacity(queueCapacity);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setThreadNamePrefix(threadNamePrefix);
        executor.initialize();
        return executor;
    }
}
