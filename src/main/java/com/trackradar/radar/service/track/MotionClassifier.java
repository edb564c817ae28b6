package com.trackradar.radar.service.track;

import com.trackradar.radar.model.TimedPoint;
import com.trackradar.radar.util.GeoMath;

import java.util.concurrent.TimeUnit;

/**
 * 직전 fix 와 비교해 이동 중인지(자전거/차량, 빠른 걸음) 정지 상태인지 판정한다.
 */
public class MotionClassifier {

    // 평균 보행 속도 (m/s). 이보다 빠르면 이동 중으로 본다
    public static final double AVG_WALKING_SPEED_MPS = 1.5;

    /**
     * 판정 후 newFix 를 history 에 넣는다.
     */
    public boolean classify(FixHistory history, TimedPoint newFix) {
        boolean moving;
        if (history.isEmpty()) {
            moving = false;
        } else {
            TimedPoint lastFix = history.last();
            double elapsedSec = (newFix.ticks() - lastFix.ticks()) / (double) TimeUnit.SECONDS.toNanos(1);
            double meters = GeoMath.distance(newFix.point(), lastFix.point());
            moving = meters > AVG_WALKING_SPEED_MPS * elapsedSec;
        }

        history.add(newFix);
        return moving;
    }
}
