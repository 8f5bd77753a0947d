package com.taxledger.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor for partition workers when {@code taxledger.ledger.parallel} is on.
 * Each worker owns one (account, instrument) partition, so no state is shared between tasks.
 */
@Configuration
public class AsyncConfig {

    @Value("${taxledger.async.core-pool-size}")
    private int corePoolSize;

    @Value("${taxledger.async.max-pool-size}")
    private int maxPoolSize;

    @Value("${taxledger.async.queue-capacity}")
    private int queueCapacity;

    @Bean("ledgerExecutor")
    public ThreadPoolTaskExecutor ledgerExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("ledger-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
