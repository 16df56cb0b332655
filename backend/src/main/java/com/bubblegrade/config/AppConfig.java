package com.bubblegrade.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Fan-out pool for per-section report computations. Sections per class are
     * few, so the queue stays small and callers never wait on a rejected task.
     */
    @Bean(name = "reportExecutor", destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor reportExecutor(ScanningProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getReportParallelism());
        executor.setMaxPoolSize(properties.getReportParallelism());
        executor.setQueueCapacity(256);
        executor.setThreadNamePrefix("report-");
        executor.initialize();
        return executor;
    }
}
