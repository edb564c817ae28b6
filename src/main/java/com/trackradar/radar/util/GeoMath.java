package com.trackradar.radar.util;

import com.trackradar.radar.model.GeoPoint;

/**
 * 경로 판정에 쓰이는 구면 지오메트리 유틸 모음.
 * - 하버사인 거리(m) 계산
 * - 점과 대권 호(arc) 구간 사이의 최단 거리(m) 계산
 */
public final class GeoMath {
    private GeoMath() {}

    // 지구 반지름 (m)
    public static final double EARTH_RADIUS_M = 6371000.0;

    /**
     * 하버사인(Haversine) 공식으로 두 좌표 간 거리(m)를 계산한다.
     */
    public static double haversine(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);
        double a = Math.sin(dLat/2)*Math.sin(dLat/2)
                + Math.cos(Math.toRadians(lat1))*Math.cos(Math.toRadians(lat2))
                * Math.sin(dLon/2)*Math.sin(dLon/2);
        return 2*EARTH_RADIUS_M*Math.asin(Math.min(1.0, Math.sqrt(a)));
    }

    public static double distance(GeoPoint a, GeoPoint b) {
        return haversine(a.latitude(), a.longitude(), b.latitude(), b.longitude());
    }

    /**
     * 점 p 에서 대권 호 [a, b] 까지의 최단 거리(m).
     * - 수선의 발이 구간 안에 있으면 cross-track 거리
     * - a 앞쪽이면 a 까지, b 뒤쪽이면 b 까지의 거리
     */
    public static double distanceToSegment(GeoPoint p, GeoPoint a, GeoPoint b) {
        double d12 = distance(a, b) / EARTH_RADIUS_M;
        double d13 = distance(a, p) / EARTH_RADIUS_M;
        if (d12 == 0.0 || d13 == 0.0) {
            return distance(p, a);
        }

        double theta = bearing(a, p) - bearing(a, b);
        if (Math.cos(theta) < 0) {
            // 투영점이 a 이전
            return distance(p, a);
        }

        double dxt = Math.asin(clamp(Math.sin(d13) * Math.sin(theta)));
        double dat = Math.acos(clamp(Math.cos(d13) / Math.cos(dxt)));
        if (dat > d12) {
            // 투영점이 b 이후
            return distance(p, b);
        }
        return Math.abs(dxt) * EARTH_RADIUS_M;
    }

    /** a 에서 b 로 향하는 초기 방위각(라디안) */
    static double bearing(GeoPoint a, GeoPoint b) {
        double phi1 = Math.toRadians(a.latitude());
        double phi2 = Math.toRadians(b.latitude());
        double dLon = Math.toRadians(b.longitude() - a.longitude());
        double y = Math.sin(dLon) * Math.cos(phi2);
        double x = Math.cos(phi1) * Math.sin(phi2) - Math.sin(phi1) * Math.cos(phi2) * Math.cos(dLon);
        return Math.atan2(y, x);
    }

    private static double clamp(double v) {
        return Math.max(-1.0, Math.min(1.0, v));
    }
}
