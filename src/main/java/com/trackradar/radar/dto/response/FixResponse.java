package com.trackradar.radar.dto.response;

/**
 * - signedDistanceM : 0 이하 = 경로 위, 양수 = 경로까지 거리(m)
 */
public record FixResponse(
        double signedDistanceM,
        boolean onTrack,
        boolean hasSignal
) {}
