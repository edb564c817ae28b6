package com.trackradar.radar.service.track;

import com.trackradar.radar.model.GeoPoint;
import com.trackradar.radar.model.TimedPoint;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class MotionClassifierTest {

    // 위도 1도 ≈ 111,195m
    private static final double DEG_PER_METER = 1.0 / 111_195.0;
    private static final long TEN_SECONDS = TimeUnit.SECONDS.toNanos(10);

    private final MotionClassifier classifier = new MotionClassifier();

    private static TimedPoint north(double meters, long ticks) {
        return new TimedPoint(new GeoPoint(52.0 + meters * DEG_PER_METER, 21.0), ticks);
    }

    @Test
    void firstFixIsNeverMoving() {
        FixHistory history = new FixHistory();

        assertThat(classifier.classify(history, north(0, 0))).isFalse();
        assertThat(history.size()).isEqualTo(1);
    }

    @Test
    void twoMetersPerSecondIsMoving() {
        FixHistory history = new FixHistory();
        classifier.classify(history, north(0, 0));

        assertThat(classifier.classify(history, north(20, TEN_SECONDS))).isTrue();
    }

    @Test
    void halfMeterPerSecondIsStationary() {
        FixHistory history = new FixHistory();
        classifier.classify(history, north(0, 0));

        assertThat(classifier.classify(history, north(5, TEN_SECONDS))).isFalse();
    }

    @Test
    void comparesAgainstMostRecentFix() {
        FixHistory history = new FixHistory();
        classifier.classify(history, north(0, 0));
        classifier.classify(history, north(100, TEN_SECONDS));

        // 처음 점 기준이면 이동이지만 직전 점 기준으로는 2m/10s
        assertThat(classifier.classify(history, north(102, 2 * TEN_SECONDS))).isFalse();
        assertThat(history.last().ticks()).isEqualTo(2 * TEN_SECONDS);
    }
}
