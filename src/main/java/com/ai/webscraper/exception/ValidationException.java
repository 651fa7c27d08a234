package com.ai.webscraper.exception;

/**
 * 입력 검증 실패 - 재시도하지 않음
 */
public class ValidationException extends ScraperException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, String context) {
        super(message, context);
    }
}
