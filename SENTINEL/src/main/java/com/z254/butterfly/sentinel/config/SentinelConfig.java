package com.z254.butterfly.sentinel.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Core engine beans: the time source and the resolution worker pool.
 */
@Configuration
public class SentinelConfig {

    public static final String RESOLUTION_EXECUTOR = "resolutionTaskExecutor";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Resolution workflows run here. The pool size is the global cap on concurrently
     * resolving incidents; further workflows wait in the queue.
     */
    @Bean(name = RESOLUTION_EXECUTOR)
    public ThreadPoolTaskExecutor resolutionTaskExecutor(SentinelProperties sentinelProperties) {
        int cap = sentinelProperties.getResolution().getMaxConcurrentResolutions();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(cap);
        executor.setMaxPoolSize(cap);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("sentinel-resolution-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
