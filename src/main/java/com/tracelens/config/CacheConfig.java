package com.tracelens.config;

import com.tracelens.service.cache.AnalysisCache;
import com.tracelens.service.cache.CaffeineAnalysisCache;
import com.tracelens.service.cache.NoOpAnalysisCache;
import com.tracelens.service.log.LogPatternSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Picks the cache implementation from {@code tracelens.cache.enabled}.
 */
@Slf4j
@Configuration
public class CacheConfig {

    @Bean
    @ConditionalOnProperty(name = "tracelens.cache.enabled", havingValue = "true", matchIfMissing = true)
    public AnalysisCache<String, LogPatternSet> logPatternCache(AnalysisProperties properties) {
        AnalysisProperties.Cache cfg = properties.getCache();
        return new CaffeineAnalysisCache<>(cfg.getTtl(), cfg.getMaximumSize());
    }

    @Bean
    @ConditionalOnProperty(name = "tracelens.cache.enabled", havingValue = "false")
    public AnalysisCache<String, LogPatternSet> disabledLogPatternCache() {
        log.info("Analysis cache disabled");
        return new NoOpAnalysisCache<>();
    }
}
