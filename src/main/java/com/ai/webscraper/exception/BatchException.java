package com.ai.webscraper.exception;

import lombok.Getter;

/**
 * continueOnError=false 일 때 배치 전체 실패
 */
@Getter
public class BatchException extends ScraperException {

    private final int successCount;
    private final int totalCount;

    public BatchException(String message, int successCount, int totalCount, Throwable cause) {
        super(message, "Processed: " + successCount + "/" + totalCount, cause);
        this.successCount = successCount;
        this.totalCount = totalCount;
    }
}
