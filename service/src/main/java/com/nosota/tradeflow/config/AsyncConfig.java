package com.nosota.tradeflow.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executor for real-time broadcasts, kept apart from request threads so a slow socket never
 * holds up a transition. When the queue is full the oldest pending broadcast is dropped.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    @Bean(name = "broadcastExecutor")
    public Executor broadcastExecutor(
            @Value("${async.broadcast.core-pool-size:2}") int corePoolSize,
            @Value("${async.broadcast.max-pool-size:8}") int maxPoolSize,
            @Value("${async.broadcast.queue-capacity:1000}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("broadcast-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.DiscardOldestPolicy());
        executor.initialize();
        return executor;
    }
}
