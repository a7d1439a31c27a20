package com.tracelens.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool used to fan independent analyses out.
 */
@Slf4j
@Configuration
public class AnalysisExecutorConfig {

    @Bean(name = "analysisExecutor")
    public ThreadPoolTaskExecutor analysisExecutor(AnalysisProperties properties) {
        AnalysisProperties.Executor cfg = properties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(cfg.getPoolSize());
        executor.setMaxPoolSize(cfg.getPoolSize());
        executor.setQueueCapacity(cfg.getQueueCapacity());
        executor.setThreadNamePrefix("analysis-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        log.info("Analysis executor initialized with {} workers", cfg.getPoolSize());
        return executor;
    }
}
