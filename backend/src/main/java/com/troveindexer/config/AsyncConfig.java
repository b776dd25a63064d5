package com.troveindexer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Named executors. The tailing loop gets a dedicated single thread: batches must never run concurrently
 * because folding is order-dependent.
 */
@Configuration
public class AsyncConfig {

    public static final String INDEXER_EXECUTOR = "indexer-executor";

    @Bean(name = INDEXER_EXECUTOR)
    public Executor indexerExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(1);
        e.setQueueCapacity(0);
        e.setThreadNamePrefix("indexer-");
        e.setWaitForTasksToCompleteOnShutdown(false);
        e.initialize();
        return e;
    }

    /** Wall clock for history timestamps and audit records; replaced by a fixed clock in tests. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
