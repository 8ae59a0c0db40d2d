package com.policywatch.ingest.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class AsyncConfig {

    /**
     * Source runs. Pool size caps how many sources are crawled at once.
     */
    @Bean(name = "ingestExecutor")
    public ThreadPoolTaskExecutor ingestExecutor(IngesterProperties properties) {
        int sources = Math.max(1, properties.getScheduling().getMaxConcurrentSources());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(sources);
        executor.setMaxPoolSize(sources);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("ingest-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(120);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    /**
     * Polish calls, so that the gate can stop waiting on a slow provider.
     */
    @Bean(name = "polishExecutor")
    public ThreadPoolTaskExecutor polishExecutor(IngesterProperties properties) {
        int sources = Math.max(1, properties.getScheduling().getMaxConcurrentSources());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(sources);
        executor.setMaxPoolSize(sources * 2);
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("polish-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        // a rejected call surfaces in PolishGate, which hands the draft back at once
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();
        return executor;
    }
}
