package com.trackradar.radar.dto.response;

import java.time.Instant;

public record SessionResponse(
        String sessionId,
        int segments,
        int points,
        Instant startedAt
) {}
