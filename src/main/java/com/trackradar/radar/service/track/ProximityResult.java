package com.trackradar.radar.service.track;

/**
 * 경로 근접 판정 결과
 *
 * - onTrack        : 임계 거리 이내 구간이 있었는지
 * - signedDistance : 보정 거리(m). 음수(또는 -0)는 경로 위, 양수는 경로 이탈
 * - segmentIndex   : 가장 가까웠던 RouteSegment 인덱스 (없으면 -1)
 * - pointIndex     : 해당 구간에서 [pointIndex-1, pointIndex] 점 쌍 (없으면 -1)
 */
public record ProximityResult(
        boolean onTrack,
        double signedDistance,
        int segmentIndex,
        int pointIndex
) {

    public static ProximityResult noGeometry() {
        return new ProximityResult(false, Double.MAX_VALUE, -1, -1);
    }
}
