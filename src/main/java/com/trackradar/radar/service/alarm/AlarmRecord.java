package com.trackradar.radar.service.alarm;

import com.trackradar.radar.model.AlarmKind;

import java.time.Instant;

/**
 * 발생한 알람 기록 (firedAt 은 관측용 벽시계 시각)
 */
public record AlarmRecord(
        AlarmKind kind,
        Instant firedAt,
        boolean audible,
        boolean vibrated
) {}
