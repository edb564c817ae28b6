package com.trackradar.radar.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 상태 조회 응답
 * - status          : SIGNAL / NO_SIGNAL
 * - signedDistanceM : 신호가 있을 때만
 * - message         : 신호가 없을 때 안내 문구
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RadarInfoResponse(
        String sessionId,
        String status,
        Double signedDistanceM,
        String message,
        long evaluatedFixes,
        long skippedFixes
) {
    public static final String STATUS_SIGNAL = "SIGNAL";
    public static final String STATUS_NO_SIGNAL = "NO_SIGNAL";
}
