/**
 * Executors for work that must not run on reactor-netty event loops
 *
 * @author William Callahan
 *
 * Features:
 * - Bounded pool for background enrichment (usage hints), dropped work runs on the caller
 * - Small pool for blocking durable-cache file I/O
 * - Custom thread naming for easier debugging
 */

package com.williamcallahan.dictionary_engine.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class AsyncConfig {

    /**
     * Executor for background enrichment calls
     *
     * Features:
     * - Core pool of 4 threads, bursting to 16
     * - Queue capacity of 200 tasks
     * - Fallback to caller thread when saturated (CallerRunsPolicy)
     */
    @Bean("enrichmentExecutor")
    public AsyncTaskExecutor enrichmentExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("enrichment-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    /**
     * Executor for durable cache reads and writes
     */
    @Bean("cacheIoExecutor")
    public AsyncTaskExecutor cacheIoExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int processors = Runtime.getRuntime().availableProcessors();
        executor.setCorePoolSize(processors > 1 ? processors : 2);
        executor.setMaxPoolSize(processors > 1 ? processors * 2 : 4);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("cache-io-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }
}
