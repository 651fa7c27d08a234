package com.ai.webscraper.concurrent;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 용량 N의 카운팅 세마포어.
 * 공정 모드로 가장 오래 기다린 작업이 먼저 허가를 받고, 과다 release는 무시되어 N을 넘지 않는다.
 */
public class ConcurrencyLimiter {

    private final int capacity;
    private final Semaphore semaphore;
    private final AtomicInteger held = new AtomicInteger();

    public ConcurrencyLimiter(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Concurrency must be at least 1");
        }
        this.capacity = capacity;
        this.semaphore = new Semaphore(capacity, true);
    }

    /**
     * 허가를 얻을 때까지 대기. 반환된 {@link Permit}을 닫으면 반납된다.
     */
    public Permit acquire() throws InterruptedException {
        semaphore.acquire();
        held.incrementAndGet();
        return new Permit();
    }

    /**
     * 허가 반납. 보유 중인 허가가 없으면 아무 일도 하지 않는다.
     */
    public void release() {
        while (true) {
            int current = held.get();
            if (current <= 0) {
                return;
            }
            if (held.compareAndSet(current, current - 1)) {
                semaphore.release();
                return;
            }
        }
    }

    public int capacity() {
        return capacity;
    }

    public int availablePermits() {
        return semaphore.availablePermits();
    }

    public int heldPermits() {
        return held.get();
    }

    /**
     * 허가를 기다리는 작업 수 (추정치)
     */
    public int queueLength() {
        return semaphore.getQueueLength();
    }

    /**
     * 한 번만 반납되는 허가
     */
    public final class Permit implements AutoCloseable {

        private final AtomicBoolean released = new AtomicBoolean();

        private Permit() {
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                release();
            }
        }
    }
}
