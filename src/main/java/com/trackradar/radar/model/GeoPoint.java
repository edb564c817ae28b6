package com.trackradar.radar.model;

import java.util.Locale;

/**
 * 위도/경도(도 단위) 좌표.
 * - 값 비교는 equals 가 아니라 항상 거리 함수(GeoMath)로 한다.
 */
public final class GeoPoint {

    private final double latitude;
    private final double longitude;

    public GeoPoint(double latitude, double longitude) {
        this.latitude = latitude;
        this.longitude = longitude;
    }

    public double latitude() {
        return latitude;
    }

    public double longitude() {
        return longitude;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%.6f, %.6f", latitude, longitude);
    }
}
