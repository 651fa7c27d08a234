package com.ai.webscraper.concurrent;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * baseDelay * multiplier^attempt 지수 백오프 (지터 없음).
 * 기본값 1000ms, 2배: 1s → 2s → 4s
 */
public final class ExponentialRetryPolicy implements RetryPolicy {

    private final int maxAttempts;
    private final Duration baseDelay;
    private final double multiplier;
    private final Predicate<Throwable> retryable;

    public ExponentialRetryPolicy(int maxAttempts, Duration baseDelay, double multiplier) {
        this(maxAttempts, baseDelay, multiplier, failure -> true);
    }

    public ExponentialRetryPolicy(int maxAttempts, Duration baseDelay, double multiplier,
                                  Predicate<Throwable> retryable) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1.0");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay.isNegative() ? Duration.ZERO : baseDelay;
        this.multiplier = multiplier;
        this.retryable = retryable;
    }

    /**
     * maxRetries번 재시도하는 정책 (총 maxRetries + 1회 시도)
     */
    public static ExponentialRetryPolicy withRetries(int maxRetries, Duration baseDelay, double multiplier,
                                                     Predicate<Throwable> retryable) {
        return new ExponentialRetryPolicy(Math.max(0, maxRetries) + 1, baseDelay, multiplier, retryable);
    }

    @Override
    public int maxAttempts() {
        return maxAttempts;
    }

    @Override
    public Duration nextDelay(int attempt) {
        double factor = Math.pow(multiplier, Math.max(0, attempt));
        return Duration.ofMillis((long) (baseDelay.toMillis() * factor));
    }

    @Override
    public boolean isRetryable(Throwable failure) {
        return retryable.test(failure);
    }

    @Override
    public String toString() {
        return "ExponentialRetryPolicy(maxAttempts=" + maxAttempts + ", baseDelay=" + baseDelay.toMillis()
                + "ms, multiplier=" + multiplier + ")";
    }
}
