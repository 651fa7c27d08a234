package com.ai.webscraper.exception;

import lombok.Getter;

/**
 * 정적 HTTP 수집 실패 (네트워크/HTTP 상태 오류)
 */
@Getter
public class ScrapeException extends ScraperException {

    private final String url;
    private final Integer statusCode;

    public ScrapeException(String message, String url) {
        this(message, url, null, null, null);
    }

    public ScrapeException(String message, String url, Integer statusCode, String context) {
        this(message, url, statusCode, context, null);
    }

    public ScrapeException(String message, String url, Integer statusCode, String context, Throwable cause) {
        super(message, context, cause);
        this.url = url;
        this.statusCode = statusCode;
    }
}
