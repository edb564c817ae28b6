package com.trackradar.radar.service.signal;

import java.time.Duration;

/**
 * 신호 점검 한 번의 판단 로직 (순수 함수, 타이머와 분리).
 *
 * - 신호 있음 또는 알람 전: 마지막 fix(없으면 시작) 이후 경과가 firstTimeout 을 넘으면 첫 알람
 * - 신호 없음: 마지막 알람 이후 경과가 againInterval 을 넘으면 반복 알람
 * - 다음 점검까지의 지연은 min(firstTimeout, againInterval) 을 넘지 않는다
 *   (설정이 점검 사이에 바뀌어도 감지 지연이 그 이상 늘어나지 않게)
 */
public final class SignalCheck {
    private SignalCheck() {}

    public record Decision(
            WatchdogState next,
            Duration nextDelay,
            boolean raiseSignalLost,
            Duration elapsed,
            Duration alarmAfter
    ) {}

    public static Duration checkInterval(Duration firstTimeout, Duration againInterval) {
        return firstTimeout.compareTo(againInterval) <= 0 ? firstTimeout : againInterval;
    }

    public static Decision evaluate(WatchdogState state, long now, Duration firstTimeout, Duration againInterval) {
        Duration interval = checkInterval(firstTimeout, againInterval);

        long lastEventAt;
        Duration alarmAfter;
        if (state.hasSignal() || !state.hasAlarmed()) {
            lastEventAt = state.lastFixAt();
            alarmAfter = firstTimeout;
        } else {
            lastEventAt = state.lastNoSignalAlarmAt();
            alarmAfter = againInterval;
        }

        Duration elapsed = Duration.ofNanos(now - lastEventAt);
        Duration delay = alarmAfter.minus(elapsed);

        if (delay.isNegative() || delay.isZero()) {
            // 알람 시점 경과
            return new Decision(state.withSignalLost(now), interval, true, elapsed, alarmAfter);
        }
        if (delay.compareTo(interval) > 0) {
            delay = interval;
        }
        return new Decision(state, delay, false, elapsed, alarmAfter);
    }
}
