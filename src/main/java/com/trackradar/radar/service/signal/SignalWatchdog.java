package com.trackradar.radar.service.signal;

import com.trackradar.radar.util.AtomicCell;
import com.trackradar.radar.util.MonotonicClock;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * GPS 신호 감시 타이머.
 *
 * - update(): fix 수신 시 호출 (fix 처리 스레드)
 * - check() : 단발 타이머가 호출하고, 매번 다음 점검 시각을 스스로 다시 계산해 예약한다
 *
 * 주기 타이머를 쓰지 않는다. fix 직후 신호가 끊기는 경우에도 설정된 타임아웃에
 * 맞춰 알람하려면 매 점검마다 남은 시간을 다시 계산해야 한다.
 * 두 경로가 공유하는 상태는 AtomicCell 의 CAS 로만 바꾼다.
 */
@Slf4j
public class SignalWatchdog {

    static final Duration FALLBACK_DELAY = Duration.ofSeconds(10);

    private final MonotonicClock clock;
    private final OneShotTimer timer;
    private final Supplier<Duration> firstTimeout;
    private final Supplier<Duration> againInterval;
    private final Runnable signalAcquiredAlarm;
    private final Runnable signalLostAlarm;
    private final AtomicCell<WatchdogState> state;
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean disposed = new AtomicBoolean();

    public SignalWatchdog(MonotonicClock clock,
                          OneShotTimer timer,
                          Supplier<Duration> firstTimeout,
                          Supplier<Duration> againInterval,
                          Runnable signalAcquiredAlarm,
                          Runnable signalLostAlarm) {
        this.clock = clock;
        this.timer = timer;
        this.firstTimeout = firstTimeout;
        this.againInterval = againInterval;
        this.signalAcquiredAlarm = signalAcquiredAlarm;
        this.signalLostAlarm = signalLostAlarm;
        this.state = new AtomicCell<>(WatchdogState.initial(clock.nowNanos()));
    }

    /** 첫 점검 예약. 한 번만 유효하다. */
    public void start() {
        ensureActive();
        if (started.compareAndSet(false, true)) {
            reschedule(SignalCheck.checkInterval(firstTimeout.get(), againInterval.get()));
        }
    }

    public boolean hasSignal() {
        ensureActive();
        return state.get().hasSignal();
    }

    /**
     * fix 수신 기록.
     *
     * @param canAlarm false 면 신호 복구 알람을 생략한다 (같은 fix 에 오프트랙 알람이 울릴 때)
     */
    public void update(boolean canAlarm) {
        ensureActive();
        long now = clock.nowNanos();
        WatchdogState previous = state.getAndUpdate(s -> s.withFix(now));
        if (!previous.hasSignal()) {
            log.info("[WATCHDOG] GPS 신호 수신 (연속 미수신 {}회 후)", previous.noSignalCount());
            if (canAlarm) {
                signalAcquiredAlarm.run();
            }
        }
    }

    /** 타이머 콜백 전용 */
    void check() {
        if (disposed.get()) {
            return;
        }

        Duration next;
        try {
            Duration first = firstTimeout.get();
            Duration again = againInterval.get();
            long now = clock.nowNanos();

            SignalCheck.Decision decision;
            WatchdogState current;
            do {
                current = state.get();
                decision = SignalCheck.evaluate(current, now, first, again);
            } while (!state.compareAndSet(current, decision.next()));

            if (log.isDebugEnabled()) {
                log.debug("[WATCHDOG] check hasSignal={} alarmAfter={}s passed={}s nextDelay={}s",
                        current.hasSignal(), decision.alarmAfter().toSeconds(),
                        decision.elapsed().toMillis() / 1000.0, decision.nextDelay().toMillis() / 1000.0);
            }

            if (decision.raiseSignalLost()) {
                log.info("[WATCHDOG] GPS 신호 없음 (연속 {}회)", decision.next().noSignalCount());
                signalLostAlarm.run();
            }
            next = decision.nextDelay();
        } catch (RuntimeException e) {
            log.error("[WATCHDOG] 점검 중 오류, {}s 후 재시도", FALLBACK_DELAY.toSeconds(), e);
            next = FALLBACK_DELAY;
        }

        reschedule(next);
    }

    private void reschedule(Duration delay) {
        if (disposed.get()) {
            return;
        }
        try {
            timer.schedule(this::check, delay);
        } catch (RejectedExecutionException e) {
            if (!disposed.get()) {
                throw e;
            }
            log.debug("[WATCHDOG] 종료 중이라 재예약하지 않습니다.");
        }
    }

    /**
     * 타이머를 정리하고 진행 중인 점검이 끝날 때까지 기다린다. 두 번째 호출부터는 아무것도 하지 않는다.
     */
    public void dispose() {
        if (!disposed.compareAndSet(false, true)) {
            return;
        }
        timer.close();
        log.info("[WATCHDOG] 종료");
    }

    public boolean isDisposed() {
        return disposed.get();
    }

    private void ensureActive() {
        if (disposed.get()) {
            throw new IllegalStateException("이미 종료된 SignalWatchdog 입니다.");
        }
    }
}
