package com.lemur.backend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor for agent loops. Each running session holds one thread until it ends.
 */
@Configuration
public class AsyncExecutorConfig {

    @Bean(name = "agentLoopExecutor")
    public ThreadPoolTaskExecutor agentLoopExecutor(
            @Value("${agent.executor.core-pool-size:8}") int corePoolSize,
            @Value("${agent.executor.max-pool-size:32}") int maxPoolSize,
            @Value("${agent.executor.queue-capacity:100}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("agent-loop-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
