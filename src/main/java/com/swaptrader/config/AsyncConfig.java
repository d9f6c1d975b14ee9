package com.swaptrader.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools for the two fan-out paths: EventBus handler dispatch ({@code eventExecutor})
 * and batch position closes ({@code tradingExecutor}).
 *
 * <p>They are separate so a batch close, which emits events while it runs, never waits on a
 * pool its own tasks occupy. Both fall back to running on the caller when saturated.
 */
@Configuration
public class AsyncConfig {

    @Value("${swaptrader.async.core-pool-size:4}")
    private int corePoolSize;

    @Value("${swaptrader.async.max-pool-size:8}")
    private int maxPoolSize;

    @Value("${swaptrader.async.queue-capacity:500}")
    private int queueCapacity;

    @Bean("eventExecutor")
    public ThreadPoolTaskExecutor eventExecutor() {
        return buildExecutor("event-");
    }

    @Bean("tradingExecutor")
    public ThreadPoolTaskExecutor tradingExecutor() {
        return buildExecutor("trading-");
    }

    private ThreadPoolTaskExecutor buildExecutor(String threadNamePrefix) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(threadNamePrefix);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
