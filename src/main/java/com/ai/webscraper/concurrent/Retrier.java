package com.ai.webscraper.concurrent;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * {@link RetryPolicy}에 따라 작업을 순차적으로 재시도한다. 같은 작업을 동시에 재시도하지 않는다.
 */
@Slf4j
public class Retrier {

    /**
     * 시도 번호(0부터)를 받는 작업
     */
    @FunctionalInterface
    public interface Attempt<T> {
        T run(int attempt) throws Exception;
    }

    private final Sleeper sleeper;

    public Retrier(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    /**
     * 성공할 때까지 또는 시도 횟수를 다 쓸 때까지 실행.
     * 재시도 대상이 아닌 실패나 마지막 실패는 그대로 던진다.
     */
    public <T> T execute(RetryPolicy policy, String operation, Attempt<T> action) throws Exception {
        Exception lastFailure = null;
        for (int attempt = 0; attempt < policy.maxAttempts(); attempt++) {
            try {
                return action.run(attempt);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw e;
            } catch (Exception e) {
                lastFailure = e;
                boolean attemptsLeft = attempt + 1 < policy.maxAttempts();
                if (!attemptsLeft || !policy.isRetryable(e)) {
                    log.debug("{} 실패 - 재시도 중단 ({}/{}): {}", operation, attempt + 1, policy.maxAttempts(), e.getMessage());
                    throw e;
                }

                Duration delay = policy.nextDelay(attempt);
                log.debug("{} 실패 ({}/{}), {}ms 후 재시도: {}",
                        operation, attempt + 1, policy.maxAttempts(), delay.toMillis(), e.getMessage());
                sleeper.sleep(delay);
            }
        }
        throw lastFailure != null ? lastFailure : new IllegalStateException(operation + " was never attempted");
    }
}
