package com.ryuqq.lifecycle.adapter.runner;

import java.util.concurrent.TimeUnit;

/**
 * 진행 중인 작업 수 추적기.
 *
 * <p>종료 시 drain 단계가 {@link #awaitIdle(long)}로 진행 중 작업이 끝나기를
 * 제한 시간 동안 기다립니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * try (InFlightTracker.Ticket ticket = tracker.begin()) {
 *     // 작업 수행
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class InFlightTracker {

    private final Object lock = new Object();
    private int inFlight;

    /**
     * 작업 시작 등록.
     *
     * @return 작업 종료 시 닫아야 하는 티켓 (여러 번 닫아도 한 번만 반영)
     */
    public Ticket begin() {
        synchronized (lock) {
            inFlight++;
        }
        return new Ticket();
    }

    public int inFlight() {
        synchronized (lock) {
            return inFlight;
        }
    }

    /**
     * 진행 중 작업이 없어질 때까지 대기.
     *
     * @param timeoutMs 최대 대기 시간 (밀리초)
     * @return 제한 시간 내에 비었으면 true
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    public boolean awaitIdle(long timeoutMs) throws InterruptedException {
        long remainingNanos = TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        synchronized (lock) {
            while (inFlight > 0) {
                if (remainingNanos <= 0) {
                    return false;
                }
                long start = System.nanoTime();
                TimeUnit.NANOSECONDS.timedWait(lock, remainingNanos);
                remainingNanos -= System.nanoTime() - start;
            }
            return true;
        }
    }

    private void end() {
        synchronized (lock) {
            inFlight--;
            if (inFlight == 0) {
                lock.notifyAll();
            }
        }
    }

    /**
     * 진행 중 작업 티켓.
     */
    public final class Ticket implements AutoCloseable {

        private boolean closed;

        private Ticket() {
        }

        @Override
        public void close() {
            synchronized (lock) {
                if (closed) {
                    return;
                }
                closed = true;
            }
            end();
        }
    }
}
