package com.ai.webscraper.service.impl;

import com.ai.webscraper.concurrent.ConcurrencyLimiter;
import com.ai.webscraper.config.ScraperConfig;
import com.ai.webscraper.dto.BatchExtractionRequest;
import com.ai.webscraper.dto.ExtractionResult;
import com.ai.webscraper.exception.BatchException;
import com.ai.webscraper.exception.SchemaValidationException;
import com.ai.webscraper.exception.ScraperException;
import com.ai.webscraper.exception.ValidationException;
import com.ai.webscraper.service.BatchExtractionService;
import com.ai.webscraper.service.ExtractionService;
import com.ai.webscraper.util.SchemaValidator;
import com.ai.webscraper.util.UrlValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 동시 처리 수를 제한해 여러 URL을 추출한다.
 * 허가는 작업을 실행기에 넘기기 전에 받고, 결과가 기록된 뒤 (성공/실패 모두) 반납한다.
 */
@Slf4j
@Service
public class BatchExtractionServiceImpl implements BatchExtractionService {

    private final ExtractionService extractionService;
    private final Executor executor;
    private final ScraperConfig scraperConfig;

    public BatchExtractionServiceImpl(ExtractionService extractionService,
                                      @Qualifier("extractionExecutor") Executor executor,
                                      ScraperConfig scraperConfig) {
        this.extractionService = extractionService;
        this.executor = executor;
        this.scraperConfig = scraperConfig;
    }

    @Override
    public List<ExtractionResult> extractAll(BatchExtractionRequest request) {
        List<String> urls = request.getUrls();
        if (urls == null || urls.isEmpty()) {
            throw new ValidationException("URLs list cannot be empty");
        }

        int concurrency = request.getConcurrency() != null ? request.getConcurrency() : scraperConfig.getBatchConcurrency();
        if (concurrency < 1) {
            throw new ValidationException("Concurrency must be at least 1");
        }
        int maxConcurrency = Math.max(scraperConfig.getBatchConcurrency(), scraperConfig.getMaxBatchConcurrency());
        if (concurrency > maxConcurrency) {
            throw new ValidationException("Concurrency must not exceed " + maxConcurrency);
        }
        boolean continueOnError = request.getContinueOnError() != null
                ? request.getContinueOnError()
                : scraperConfig.isContinueOnError();

        // 전체 URL/스키마를 먼저 검증
        urls.forEach(UrlValidator::validate);
        Map<String, String> schema = request.getFieldSchema();
        if (schema == null || schema.isEmpty()) {
            throw new SchemaValidationException("Schema cannot be empty");
        }
        SchemaValidator.validateAndNormalize(schema);

        log.info("배치 추출 시작 - URL: {}개, 동시 처리: {}, continueOnError: {}", urls.size(), concurrency, continueOnError);
        long started = System.nanoTime();

        ExtractionResult[] results = new ExtractionResult[urls.size()];
        ConcurrencyLimiter limiter = new ConcurrencyLimiter(concurrency);
        AtomicBoolean aborted = new AtomicBoolean();
        AtomicReference<ExtractionResult> firstFailure = new AtomicReference<>();
        CompletableFuture<Void> failFast = new CompletableFuture<>();
        List<CompletableFuture<Void>> tasks = new ArrayList<>(urls.size());

        try {
            for (int i = 0; i < urls.size() && !aborted.get(); i++) {
                int index = i;
                String url = urls.get(i).trim();
                ConcurrencyLimiter.Permit permit = limiter.acquire();
                if (aborted.get()) {
                    permit.close();
                    break;
                }

                CompletableFuture<Void> task;
                try {
                    task = CompletableFuture
                            .supplyAsync(() -> runOne(request, url, aborted), executor)
                            .thenAccept(result -> {
                                results[index] = result;
                                if (!continueOnError && result != null && !result.success()
                                        && firstFailure.compareAndSet(null, result)) {
                                    aborted.set(true);
                                    failFast.complete(null);
                                }
                            })
                            // 결과 기록 후 반납해야 다음 URL 배정 전에 중단 여부가 보인다
                            .whenComplete((ignored, error) -> permit.close());
                } catch (RejectedExecutionException e) {
                    permit.close();
                    ExtractionResult rejected = failure(url, "Batch executor rejected task: " + e.getMessage());
                    results[index] = rejected;
                    if (!continueOnError && firstFailure.compareAndSet(null, rejected)) {
                        aborted.set(true);
                    }
                    continue;
                }
                tasks.add(task);
            }

            CompletableFuture<Void> all = CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0]));
            CompletableFuture.anyOf(all, failFast).join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            aborted.set(true);
            tasks.forEach(task -> task.cancel(true));
            throw new BatchException("Batch processing interrupted", countSuccesses(results), urls.size(), e);
        }

        if (aborted.get()) {
            // 진행 중/미시작 작업은 버린다
            tasks.forEach(task -> task.cancel(true));
            ExtractionResult failed = firstFailure.get();
            int successCount = countSuccesses(results);
            log.error("배치 추출 중단 - 실패 URL: {}, 성공: {}/{}", failed.url(), successCount, urls.size());
            throw new BatchException("Batch processing failed: " + failed.url() + " - " + failed.error(),
                    successCount, urls.size(), null);
        }

        List<ExtractionResult> ordered = Arrays.asList(results);
        log.info("배치 추출 완료 - 성공: {}/{}, {}ms", countSuccesses(results), urls.size(),
                Duration.ofNanos(System.nanoTime() - started).toMillis());
        return ordered;
    }

    private ExtractionResult runOne(BatchExtractionRequest request, String url, AtomicBoolean aborted) {
        if (aborted.get()) {
            return null;
        }
        try {
            return extractionService.extract(request.toRequest(url));
        } catch (ScraperException e) {
            log.warn("배치 항목 실패: {} - {}", url, e.describe());
            return failure(url, e.describe());
        } catch (RuntimeException e) {
            log.error("배치 항목 처리 중 예상치 못한 오류: {}", url, e);
            return failure(url, "Unexpected error: " + e);
        }
    }

    private ExtractionResult failure(String url, String error) {
        return ExtractionResult.failure(error, Duration.ZERO, extractionService.getProviderId(), url);
    }

    private static int countSuccesses(ExtractionResult[] results) {
        int count = 0;
        for (ExtractionResult result : results) {
            if (result != null && result.success()) {
                count++;
            }
        }
        return count;
    }
}
