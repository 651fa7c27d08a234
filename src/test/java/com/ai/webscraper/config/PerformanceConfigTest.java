package com.ai.webscraper.config;

import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class PerformanceConfigTest {

    @Test
    void poolIsSizedForLargestAcceptedConcurrency() {
        ScraperConfig config = new ScraperConfig();
        config.setBatchConcurrency(3);
        config.setMaxBatchConcurrency(6);

        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) new PerformanceConfig().extractionExecutor(config);
        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(6);
            assertThat(executor.getMaxPoolSize()).isEqualTo(6);
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void requestAboveDefaultConcurrencyRunsFullyInParallel() throws InterruptedException {
        ScraperConfig config = new ScraperConfig();
        config.setBatchConcurrency(2);
        config.setMaxBatchConcurrency(5);
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) new PerformanceConfig().extractionExecutor(config);

        CountDownLatch started = new CountDownLatch(5);
        CountDownLatch release = new CountDownLatch(1);
        try {
            for (int i = 0; i < 5; i++) {
                executor.execute(() -> {
                    started.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                });
            }

            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            release.countDown();
            executor.shutdown();
        }
    }

    @Test
    void configuredDefaultAboveLimitStillFitsInPool() {
        ScraperConfig config = new ScraperConfig();
        config.setBatchConcurrency(20);
        config.setMaxBatchConcurrency(8);

        assertThat(PerformanceConfig.poolSize(config)).isEqualTo(20);
    }
}
