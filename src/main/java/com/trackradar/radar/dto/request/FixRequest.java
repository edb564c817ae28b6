package com.trackradar.radar.dto.request;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * 단말 → 서버 위치 업링크
 */
public record FixRequest(
        @DecimalMin("-90.0") @DecimalMax("90.0") double lat,
        @DecimalMin("-180.0") @DecimalMax("180.0") double lon,
        @PositiveOrZero Double accuracyM     // 선택: 없으면 0
) {}
