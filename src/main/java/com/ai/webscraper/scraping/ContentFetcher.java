package com.ai.webscraper.scraping;

import com.ai.webscraper.dto.RenderOptions;
import com.ai.webscraper.exception.ScrapeException;
import com.ai.webscraper.exception.ScraperException;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Predicate;

/**
 * 정적/렌더링 수집 폴백 정책.
 * <ul>
 *   <li>렌더링 우선: 렌더링 → 실패 시 정적, 둘 다 실패하면 두 오류를 합친 예외</li>
 *   <li>정적 우선: 정적 → 재시도 중이거나 동적 콘텐츠로 보이는 오류면 렌더링, 아니면 정적 오류 그대로</li>
 * </ul>
 */
@Slf4j
public class ContentFetcher {

    private final ScrapeStrategy staticFetch;
    private final ScrapeStrategy renderedFetch;
    private final Predicate<ScraperException> fallbackToRendered;

    public ContentFetcher(ScrapeStrategy staticFetch, ScrapeStrategy renderedFetch,
                          Predicate<ScraperException> fallbackToRendered) {
        this.staticFetch = staticFetch;
        this.renderedFetch = renderedFetch;
        this.fallbackToRendered = fallbackToRendered;
    }

    public String fetch(String url, boolean preferRendered, boolean isRetry, RenderOptions options) {
        return preferRendered
                ? renderedFirst(url, options)
                : staticFirst(url, isRetry, options);
    }

    private String renderedFirst(String url, RenderOptions options) {
        try {
            return renderedFetch.fetch(url, options);
        } catch (ScraperException renderedError) {
            log.warn("렌더링 수집 실패, HTTP로 폴백: {} - {}", url, renderedError.describe());
            try {
                return staticFetch.fetch(url, options);
            } catch (ScraperException staticError) {
                throw new ScrapeException(
                        "Both JavaScript and HTTP scraping failed. JS error: " + renderedError.describe()
                                + ", HTTP error: " + staticError.describe(),
                        url, null, null, staticError);
            }
        }
    }

    private String staticFirst(String url, boolean isRetry, RenderOptions options) {
        try {
            return staticFetch.fetch(url, options);
        } catch (ScraperException staticError) {
            if (!isRetry && !fallbackToRendered.test(staticError)) {
                throw staticError;
            }

            log.warn("HTTP 수집 실패, 렌더링으로 폴백 (retry={}): {} - {}", isRetry, url, staticError.describe());
            try {
                return renderedFetch.fetch(url, options);
            } catch (ScraperException renderedError) {
                throw new ScrapeException(
                        "Both HTTP and JavaScript scraping failed. HTTP error: " + staticError.describe()
                                + ", JS error: " + renderedError.describe(),
                        url, null, null, renderedError);
            }
        }
    }
}
