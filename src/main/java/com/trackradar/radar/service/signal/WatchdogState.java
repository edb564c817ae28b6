package com.trackradar.radar.service.signal;

/**
 * 신호 감시 상태 (불변).
 *
 * - noSignalCount        : 0 이면 신호 있음, n 이면 연속 n 번 "신호 없음" 판정
 * - lastFixAt            : 마지막 fix 수신 시각 (단조 ns)
 * - lastNoSignalAlarmAt  : 마지막 "신호 없음" 알람 시각 (단조 ns), 아직 없으면 NEVER
 */
public record WatchdogState(int noSignalCount, long lastFixAt, long lastNoSignalAlarmAt) {

    public static final long NEVER = Long.MIN_VALUE;

    /**
     * 시작 시에는 신호가 없는 것으로 본다. 시작 시각을 마지막 fix 시각으로 두어
     * fix 가 한 번도 오지 않으면 firstTimeout 뒤에 첫 알람이 울린다.
     */
    public static WatchdogState initial(long now) {
        return new WatchdogState(1, now, NEVER);
    }

    public boolean hasAlarmed() {
        return lastNoSignalAlarmAt != NEVER;
    }

    public boolean hasSignal() {
        return noSignalCount == 0;
    }

    public WatchdogState withFix(long now) {
        return new WatchdogState(0, now, lastNoSignalAlarmAt);
    }

    public WatchdogState withSignalLost(long now) {
        return new WatchdogState(noSignalCount + 1, lastFixAt, now);
    }
}
