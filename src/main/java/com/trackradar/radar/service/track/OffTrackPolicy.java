package com.trackradar.radar.service.track;

import com.trackradar.radar.model.AlarmKind;
import com.trackradar.radar.model.Route;
import com.trackradar.radar.model.TimedPoint;
import com.trackradar.radar.service.RadarPreferences;
import com.trackradar.radar.service.alarm.AlarmSink;
import lombok.extern.slf4j.Slf4j;

/**
 * fix 하나마다 오프트랙 알람 여부를 결정한다.
 *
 * - 경로 위: 이동 → 정지 전환이면 긍정 확인음(POSITIVE_ACKNOWLEDGEMENT)
 * - 경로 이탈 + 정지: 알람 억제 (정지 중 GPS 튐으로 간주)
 * - 경로 이탈 + 이동: 최소 간격이 지났으면 OFF_TRACK
 *
 * fix 처리 경로 전용이라 한 번에 한 fix 만 들어온다고 가정한다.
 */
@Slf4j
public class OffTrackPolicy {

    private static final long NEVER = Long.MIN_VALUE;

    private final ProximityEvaluator proximityEvaluator;
    private final MotionClassifier motionClassifier;
    private final AlarmSink alarms;
    private final FixHistory history = new FixHistory();

    private long lastAlarmAt = NEVER;
    private boolean wasMoving;

    public OffTrackPolicy(ProximityEvaluator proximityEvaluator, MotionClassifier motionClassifier, AlarmSink alarms) {
        this.proximityEvaluator = proximityEvaluator;
        this.motionClassifier = motionClassifier;
        this.alarms = alarms;
    }

    /**
     * @return 부호 있는 거리(m). 0 이하 = 경로 위, 양수 = 이탈
     */
    public double onFix(TimedPoint fix, double accuracy, Route route, RadarPreferences prefs) {
        long now = fix.ticks();
        ProximityResult proximity = proximityEvaluator.evaluate(
                fix.point(), accuracy, route, prefs.offTrackAlarmDistance());
        double dist = proximity.signedDistance();

        boolean moving = motionClassifier.classify(history, fix);
        boolean lastMoving = this.wasMoving;
        this.wasMoving = moving;

        if (proximity.onTrack()) {
            if (lastMoving && !moving) {
                log.debug("[OFFTRACK] 경로 위에서 정지. dist={}", dist);
                alarms.fire(AlarmKind.POSITIVE_ACKNOWLEDGEMENT);
            }
            return dist;
        }

        // 멈춰 있으면 알람하지 않는다
        if (!moving) {
            return dist;
        }

        if (lastAlarmAt != NEVER && now - lastAlarmAt < prefs.offTrackAlarmInterval().toNanos()) {
            return dist;
        }

        // 평행한 다른 경로에 가까워지는지 따지지 않는다. 이탈이면 사용자에게 알린다
        this.lastAlarmAt = now;
        log.info("[OFFTRACK] 경로 이탈 알람. dist={}m point={}", String.format("%.1f", dist), fix.point());
        alarms.fire(AlarmKind.OFF_TRACK);
        return dist;
    }

    public FixHistory history() {
        return history;
    }
}
