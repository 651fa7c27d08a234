package com.ai.webscraper.exception;

import lombok.Getter;

/**
 * 헤드리스 브라우저 렌더링 수집 실패
 */
@Getter
public class RenderedScrapeException extends ScraperException {

    private final String url;

    public RenderedScrapeException(String message, String url, String context) {
        super(message, context);
        this.url = url;
    }

    public RenderedScrapeException(String message, String url, String context, Throwable cause) {
        super(message, context, cause);
        this.url = url;
    }
}
