package com.trackradar.radar.service;

import com.trackradar.radar.model.AlarmKind;
import com.trackradar.radar.model.Route;
import com.trackradar.radar.model.TimedPoint;
import com.trackradar.radar.service.alarm.AlarmSink;
import com.trackradar.radar.service.signal.OneShotTimer;
import com.trackradar.radar.service.signal.SignalWatchdog;
import com.trackradar.radar.service.track.MotionClassifier;
import com.trackradar.radar.service.track.OffTrackPolicy;
import com.trackradar.radar.service.track.ProximityEvaluator;
import com.trackradar.radar.util.MonotonicClock;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * 세션 하나의 판정 엔진.
 * - 세션 시작 시 생성, 종료 시 dispose. 전역 상태 없음
 * - fix 는 OffTrackPolicy 와 SignalWatchdog 에 한 번씩 전달된다
 */
@Slf4j
public class RadarEngine {

    private final Route route;
    private final Supplier<RadarPreferences> preferences;
    private final OffTrackPolicy offTrackPolicy;
    private final SignalWatchdog watchdog;
    private final RadarStatistics statistics = new RadarStatistics();
    private final AtomicBoolean disposed = new AtomicBoolean();

    /**
     * @param onSignalLost SIGNAL_LOST 알람 직후 호출되는 호스트 콜백 (타이머 스레드)
     */
    public RadarEngine(Route route,
                       Supplier<RadarPreferences> preferences,
                       AlarmSink alarms,
                       Runnable onSignalLost,
                       MonotonicClock clock,
                       OneShotTimer timer) {
        this.route = route;
        this.preferences = preferences;
        this.offTrackPolicy = new OffTrackPolicy(new ProximityEvaluator(), new MotionClassifier(), alarms);
        this.watchdog = new SignalWatchdog(
                clock,
                timer,
                () -> preferences.get().noGpsAlarmFirstTimeout(),
                () -> preferences.get().noGpsAlarmAgainInterval(),
                () -> alarms.fire(AlarmKind.POSITIVE_ACKNOWLEDGEMENT),
                () -> {
                    alarms.fire(AlarmKind.SIGNAL_LOST);
                    onSignalLost.run();
                });

        log.info("[RADAR] {} segs, with {} points", route.segments().size(), route.pointCount());
        watchdog.start();
    }

    /**
     * @return 부호 있는 거리(m). 0 이하 = 경로 위, 양수 = 이탈
     */
    public double ingestFix(TimedPoint fix, double accuracy) {
        ensureActive();
        log.debug("[RADAR] new fix {} accuracy={}", fix.point(), accuracy);

        if (!statistics.tryBeginUpdate()) {
            // 이미 계산 중인 fix 가 신호 복구 알람 여부를 결정한다
            watchdog.update(false);
            return statistics.getSignedDistance();
        }

        double dist = 0;
        try {
            dist = offTrackPolicy.onFix(fix, accuracy, route, preferences.get());
        } finally {
            // 오프트랙 알람이 없을 때만 GPS 복구 알람
            watchdog.update(dist <= 0);
            statistics.completeUpdate(dist, accuracy);
        }
        return dist;
    }

    public boolean hasSignal() {
        ensureActive();
        return watchdog.hasSignal();
    }

    public RadarStatistics statistics() {
        return statistics;
    }

    /** 여러 번 호출해도 안전하다. 반환 이후 신호 점검은 더 이상 실행되지 않는다. */
    public void dispose() {
        if (!disposed.compareAndSet(false, true)) {
            return;
        }
        watchdog.dispose();
        log.info("[RADAR] engine disposed {}", statistics);
    }

    public boolean isDisposed() {
        return disposed.get();
    }

    private void ensureActive() {
        if (disposed.get()) {
            throw new IllegalStateException("이미 종료된 RadarEngine 입니다.");
        }
    }
}
