package com.deepansh.trader.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Thread pools kept apart from the web pool.
 *
 * memoryTaskExecutor: fire-and-forget work (experience embeddings, cycle traces).
 * Core=2, Max=5, queue=50 gives backpressure without dropping tasks.
 *
 * cycleRunnerExecutor: exactly one thread and a single queue slot. The runner's
 * session slot already admits one session at a time; the queue slot absorbs the
 * window where a stopped worker has released the session but its pool thread
 * has not yet returned.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "memoryTaskExecutor")
    public Executor memoryTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(5);
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("memory-async-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean(name = "cycleRunnerExecutor")
    public ThreadPoolTaskExecutor cycleRunnerExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(1);
        executor.setThreadNamePrefix("trading-cycle-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(20);
        executor.initialize();
        return executor;
    }
}
