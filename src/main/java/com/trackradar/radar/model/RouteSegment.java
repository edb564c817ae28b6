package com.trackradar.radar.model;

import java.util.List;

/**
 * 경로의 한 구간(폴리라인). 로드 이후 변경되지 않는다.
 */
public final class RouteSegment {

    private final List<GeoPoint> points;

    public RouteSegment(List<GeoPoint> points) {
        this.points = List.copyOf(points);
    }

    public List<GeoPoint> points() {
        return points;
    }

    public int size() {
        return points.size();
    }

    public GeoPoint get(int index) {
        return points.get(index);
    }
}
