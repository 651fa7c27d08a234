package com.ai.webscraper.service.impl;

import com.ai.webscraper.cache.CacheEntry;
import com.ai.webscraper.cache.CacheKeys;
import com.ai.webscraper.cache.ResponseCache;
import com.ai.webscraper.concurrent.ExponentialRetryPolicy;
import com.ai.webscraper.concurrent.Retrier;
import com.ai.webscraper.concurrent.RetryPolicy;
import com.ai.webscraper.config.ScraperConfig;
import com.ai.webscraper.dto.AiExtraction;
import com.ai.webscraper.dto.ExtractionRequest;
import com.ai.webscraper.dto.ExtractionResult;
import com.ai.webscraper.exception.SchemaValidationException;
import com.ai.webscraper.exception.ScrapeException;
import com.ai.webscraper.exception.ScraperException;
import com.ai.webscraper.exception.UrlValidationException;
import com.ai.webscraper.exception.ValidationException;
import com.ai.webscraper.scraping.ContentFetcher;
import com.ai.webscraper.service.AiExtractionService;
import com.ai.webscraper.service.ExtractionService;
import com.ai.webscraper.service.HtmlPreprocessor;
import com.ai.webscraper.util.SchemaValidator;
import com.ai.webscraper.util.UrlValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * URL 하나를 끝까지 처리하는 추출 서비스
 */
@Slf4j
@Service
public class ExtractionServiceImpl implements ExtractionService {

    private final ContentFetcher contentFetcher;
    private final AiExtractionService aiExtractionService;
    private final ResponseCache responseCache;
    private final HtmlPreprocessor htmlPreprocessor;
    private final Retrier retrier;
    private final ScraperConfig scraperConfig;

    /**
     * @param responseCache null이거나 scraper.cache.enabled=false면 캐시 사용 안 함
     */
    public ExtractionServiceImpl(ContentFetcher contentFetcher,
                                 AiExtractionService aiExtractionService,
                                 ResponseCache responseCache,
                                 HtmlPreprocessor htmlPreprocessor,
                                 Retrier retrier,
                                 ScraperConfig scraperConfig) {
        this.contentFetcher = contentFetcher;
        this.aiExtractionService = aiExtractionService;
        this.responseCache = scraperConfig.getCache().isEnabled() ? responseCache : null;
        this.htmlPreprocessor = htmlPreprocessor;
        this.retrier = retrier;
        this.scraperConfig = scraperConfig;
    }

    @Override
    public ExtractionResult extract(ExtractionRequest request) {
        requireContract(request);

        long started = System.nanoTime();
        String url = request.getUrl().trim();

        try {
            UrlValidator.validate(url);
            Map<String, String> schema = SchemaValidator.validateAndNormalize(request.getFieldSchema());

            boolean preferRendered = request.getPreferRendered() != null
                    ? request.getPreferRendered()
                    : scraperConfig.isPreferRendered();

            String html = scrape(url, preferRendered, request);
            AiExtraction extraction = extractWithCache(html, schema, request.getCustomInstructions());

            Duration elapsed = elapsedSince(started);
            log.info("추출 성공: {} ({}개 필드, {}ms)", url, extraction.data().size(), elapsed.toMillis());
            return ExtractionResult.success(extraction.data(), elapsed, getProviderId(), url);

        } catch (ValidationException e) {
            log.warn("입력 검증 실패: {} - {}", url, e.describe());
            return ExtractionResult.failure(e.describe(), elapsedSince(started), getProviderId(), url);
        } catch (ScraperException e) {
            log.error("추출 실패: {} - {}", url, e.describe());
            return ExtractionResult.failure(e.describe(), elapsedSince(started), getProviderId(), url);
        } catch (RuntimeException e) {
            log.error("추출 중 예상치 못한 오류: {}", url, e);
            return ExtractionResult.failure("Unexpected error: " + e, elapsedSince(started), getProviderId(), url);
        }
    }

    /**
     * 호출 계약 위반(빈 URL, 빈 스키마)은 결과가 아니라 예외로 즉시 알린다
     */
    private void requireContract(ExtractionRequest request) {
        if (request == null) {
            throw new ValidationException("Extraction request cannot be null");
        }
        if (request.getUrl() == null || request.getUrl().isBlank()) {
            throw new UrlValidationException("URL cannot be empty", "");
        }
        if (request.getFieldSchema() == null || request.getFieldSchema().isEmpty()) {
            throw new SchemaValidationException("Schema cannot be empty");
        }
    }

    private String scrape(String url, boolean preferRendered, ExtractionRequest request) {
        RetryPolicy policy = ExponentialRetryPolicy.withRetries(
                effectiveMaxRetries(request),
                Duration.ofMillis(scraperConfig.getRetryBaseDelayMs()),
                scraperConfig.getRetryMultiplier(),
                failure -> !(failure instanceof ValidationException));

        try {
            return retrier.execute(policy, "scrape " + url, attempt -> {
                log.debug("수집 시도 {}/{}: {} (렌더링 우선: {})", attempt + 1, policy.maxAttempts(), url, preferRendered);
                return contentFetcher.fetch(url, preferRendered, attempt > 0, request.effectiveRenderOptions());
            });
        } catch (ScraperException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ScrapeException("Scraping interrupted", url);
        } catch (Exception e) {
            throw new ScrapeException("Scraping failed: " + e, url, null, null, e);
        }
    }

    int effectiveMaxRetries(ExtractionRequest request) {
        int requested = request.getMaxRetries() != null ? request.getMaxRetries() : scraperConfig.getMaxRetries();
        int limit = Math.max(0, scraperConfig.getMaxRetriesLimit());
        if (requested > limit) {
            log.warn("재시도 횟수 {}회가 상한을 넘어 {}회로 제한: {}", requested, limit, request.getUrl());
            return limit;
        }
        return Math.max(0, requested);
    }

    private AiExtraction extractWithCache(String html, Map<String, String> schema, String customInstructions) {
        String cacheKey = null;
        if (responseCache != null) {
            cacheKey = CacheKeys.of(html, schema, getProviderId(), cacheOptions(customInstructions));
            Optional<CacheEntry> cached = responseCache.get(cacheKey);
            if (cached.isPresent()) {
                log.info("캐시된 추출 결과 사용: {}", CacheKeys.abbreviate(cacheKey));
                return new AiExtraction(cached.get().data(), cached.get().rawResponse());
            }
        }

        String content = scraperConfig.isPreprocessHtml() ? htmlPreprocessor.clean(html) : html;
        AiExtraction extraction = aiExtractionService.extract(content, schema, customInstructions);

        if (responseCache != null) {
            responseCache.store(cacheKey, extraction.data(), extraction.rawResponse());
        }
        return extraction;
    }

    private Map<String, Object> cacheOptions(String customInstructions) {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("model", aiExtractionService.getModelName());
        if (customInstructions != null) {
            options.put("instructions", customInstructions);
        }
        return options;
    }

    private static Duration elapsedSince(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }

    @Override
    public String getProviderId() {
        return aiExtractionService.getModelType();
    }

    @Override
    public String getProviderInfo() {
        return aiExtractionService.getProviderName();
    }

    @Override
    public int getMaxContentLength() {
        return aiExtractionService.getMaxContentLength();
    }

    @Override
    public boolean isApiKeyValid() {
        return aiExtractionService.validateApiKey();
    }
}
