package com.ai.webscraper.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
public class PerformanceConfig {

    // 큐가 차기 전에는 코어 수 이상으로 늘지 않으므로 허용하는 최대 동시 처리 수로 고정
    @Bean(name = "extractionExecutor")
    public Executor extractionExecutor(ScraperConfig scraperConfig) {
        int poolSize = poolSize(scraperConfig);
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("extraction-");
        executor.initialize();
        return executor;
    }

    static int poolSize(ScraperConfig scraperConfig) {
        return Math.max(1, Math.max(scraperConfig.getBatchConcurrency(), scraperConfig.getMaxBatchConcurrency()));
    }
}
