package com.ai.webscraper.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * 네트워크/브라우저 작업 데드라인 초과.
 * 진행 중이던 요청은 중단되지 않고 버려진다.
 */
@Getter
public class OperationTimeoutException extends ScraperException {

    private final String operation;
    private final Duration timeout;

    public OperationTimeoutException(String message, String operation, Duration timeout) {
        super(message, "Operation: " + operation + ", timeout: " + timeout.toSeconds() + "s");
        this.operation = operation;
        this.timeout = timeout;
    }
}
