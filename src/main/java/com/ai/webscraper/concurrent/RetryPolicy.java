package com.ai.webscraper.concurrent;

import java.time.Duration;

/** 재시도 조건/지연을 결정하는 정책 */
public interface RetryPolicy {

    /** 최대 시도 횟수(첫 시도 포함). 예: 3이면 최대 3번 시도. */
    int maxAttempts();

    /** attempt(0부터)번째 시도가 실패한 뒤의 지연 시간. */
    Duration nextDelay(int attempt);

    /** 실패 원인이 재시도 대상인지. */
    default boolean isRetryable(Throwable failure) {
        return true;
    }
}
