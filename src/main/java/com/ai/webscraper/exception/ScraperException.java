package com.ai.webscraper.exception;

import lombok.Getter;

/**
 * 스크래핑/추출 파이프라인 공통 예외
 */
@Getter
public class ScraperException extends RuntimeException {

    private final String context;

    public ScraperException(String message) {
        this(message, null, null);
    }

    public ScraperException(String message, String context) {
        this(message, context, null);
    }

    public ScraperException(String message, String context, Throwable cause) {
        super(message, cause);
        this.context = context;
    }

    /**
     * 메시지 + 컨텍스트 (결과 error 필드에 그대로 사용)
     */
    public String describe() {
        if (context == null || context.isBlank()) {
            return getMessage();
        }
        return getMessage() + " (" + context + ")";
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + ": " + describe();
    }
}
