package com.ai.webscraper.concurrent;

import java.time.Duration;

/**
 * 대기 추상화. 테스트에서는 실제로 잠들지 않는 구현으로 교체한다.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> {
        long ms = Math.max(0, duration.toMillis());
        if (ms > 0) {
            Thread.sleep(ms);
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
