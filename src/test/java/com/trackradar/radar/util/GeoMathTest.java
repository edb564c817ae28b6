package com.trackradar.radar.util;

import com.trackradar.radar.model.GeoPoint;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class GeoMathTest {

    // 적도에서 경도 1도 ≈ 111,195m
    private static final double METERS_PER_DEGREE = 2 * Math.PI * GeoMath.EARTH_RADIUS_M / 360.0;

    private final GeoPoint a = new GeoPoint(0.0, 0.0);
    private final GeoPoint b = new GeoPoint(0.0, 1.0);

    @Test
    void distanceAlongEquator() {
        assertThat(GeoMath.distance(a, b)).isCloseTo(METERS_PER_DEGREE, within(0.5));
        assertThat(GeoMath.distance(a, a)).isZero();
    }

    @Test
    void distanceIsSymmetric() {
        GeoPoint warsaw = new GeoPoint(52.2297, 21.0122);
        GeoPoint krakow = new GeoPoint(50.0647, 19.9450);

        assertThat(GeoMath.distance(warsaw, krakow))
                .isCloseTo(GeoMath.distance(krakow, warsaw), within(1e-6))
                .isBetween(250_000.0, 255_000.0);
    }

    @Test
    void crossTrackDistanceWhenProjectionInsideSegment() {
        GeoPoint p = new GeoPoint(0.01, 0.5);

        assertThat(GeoMath.distanceToSegment(p, a, b)).isCloseTo(0.01 * METERS_PER_DEGREE, within(1.0));
    }

    @Test
    void pointOnSegmentHasZeroDistance() {
        assertThat(GeoMath.distanceToSegment(new GeoPoint(0.0, 0.25), a, b)).isCloseTo(0.0, within(0.01));
    }

    @Test
    void clampsToStartWhenProjectionFallsBeforeSegment() {
        GeoPoint p = new GeoPoint(0.001, -0.5);

        assertThat(GeoMath.distanceToSegment(p, a, b)).isEqualTo(GeoMath.distance(p, a));
    }

    @Test
    void clampsToEndWhenProjectionFallsAfterSegment() {
        GeoPoint p = new GeoPoint(0.001, 1.5);

        assertThat(GeoMath.distanceToSegment(p, a, b)).isEqualTo(GeoMath.distance(p, b));
    }

    @Test
    void clampingDoesNotDependOnSegmentDirection() {
        GeoPoint p = new GeoPoint(-0.002, 1.3);

        assertThat(GeoMath.distanceToSegment(p, b, a)).isEqualTo(GeoMath.distance(p, b));
    }

    @Test
    void degenerateSegmentIsDistanceToThePoint() {
        GeoPoint p = new GeoPoint(0.01, 0.01);

        assertThat(GeoMath.distanceToSegment(p, a, a)).isEqualTo(GeoMath.distance(p, a));
    }

    @Test
    void segmentDistanceIsNeverNegativeNorLargerThanEndpointDistance() {
        Random random = new Random(42);
        for (int i = 0; i < 500; i++) {
            GeoPoint s = new GeoPoint(52 + random.nextDouble() * 0.1, 21 + random.nextDouble() * 0.1);
            GeoPoint e = new GeoPoint(52 + random.nextDouble() * 0.1, 21 + random.nextDouble() * 0.1);
            GeoPoint p = new GeoPoint(52 + random.nextDouble() * 0.1, 21 + random.nextDouble() * 0.1);

            double d = GeoMath.distanceToSegment(p, s, e);

            assertThat(d).isGreaterThanOrEqualTo(0.0);
            assertThat(d).isLessThanOrEqualTo(Math.min(GeoMath.distance(p, s), GeoMath.distance(p, e)) + 1e-6);
        }
    }
}
