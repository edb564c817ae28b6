package com.trackradar.radar.model;

import java.util.List;

/**
 * 세션 동안 읽기 전용으로 공유되는 경로(구간 목록).
 */
public final class Route {

    private final List<RouteSegment> segments;

    public Route(List<RouteSegment> segments) {
        this.segments = List.copyOf(segments);
    }

    public static Route empty() {
        return new Route(List.of());
    }

    public List<RouteSegment> segments() {
        return segments;
    }

    public boolean isEmpty() {
        return segments.isEmpty();
    }

    public int pointCount() {
        return segments.stream().mapToInt(RouteSegment::size).sum();
    }
}
