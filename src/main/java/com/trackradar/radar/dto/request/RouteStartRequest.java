package com.trackradar.radar.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * 세션 시작 요청. 이미 파싱된 경로 좌표(구간별 점 목록)를 받는다.
 */
public record RouteStartRequest(
        @NotEmpty List<@NotEmpty List<@Valid GeoPointRequest>> segments
) {}
