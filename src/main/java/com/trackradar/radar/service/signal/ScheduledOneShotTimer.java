package com.trackradar.radar.service.signal;

import com.trackradar.radar.util.AtomicCell;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 전용 스레드 1개짜리 ScheduledThreadPoolExecutor 위의 단발 타이머.
 */
@Slf4j
public class ScheduledOneShotTimer implements OneShotTimer {

    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(30);

    private final String name;
    private final AtomicCell<Thread> worker = new AtomicCell<>(null);
    private final AtomicCell<ScheduledFuture<?>> pending = new AtomicCell<>(null);
    private final ScheduledThreadPoolExecutor executor;

    public ScheduledOneShotTimer(String name) {
        this.name = name;
        this.executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            worker.set(t);
            return t;
        });
        executor.setRemoveOnCancelPolicy(true);
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        executor.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
    }

    /**
     * @throws java.util.concurrent.RejectedExecutionException close 이후 호출 시
     */
    @Override
    public void schedule(Runnable task, Duration delay) {
        long nanos = Math.max(0, delay.toNanos());
        ScheduledFuture<?> next = executor.schedule(task, nanos, TimeUnit.NANOSECONDS);
        ScheduledFuture<?> previous = pending.exchange(next);
        if (previous != null) {
            previous.cancel(false);
        }
    }

    @Override
    public void close() {
        ScheduledFuture<?> previous = pending.exchange(null);
        if (previous != null) {
            previous.cancel(false);
        }
        executor.shutdown();

        // 타이머 콜백 안에서 닫는 경우 자기 자신을 기다릴 수는 없다
        if (Thread.currentThread() == worker.get()) {
            return;
        }
        try {
            if (!executor.awaitTermination(CLOSE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[TIMER] {} 종료 대기 시간 초과 ({}s)", name, CLOSE_TIMEOUT.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("타이머 종료 대기 중 인터럽트: " + name, e);
        }
    }
}
