package com.trackradar.radar.service;

import com.trackradar.radar.config.RadarProperties;

import java.time.Duration;
import java.util.Objects;

/**
 * 엔진이 매 fix / 매 점검마다 다시 읽는 설정 스냅샷.
 *
 * - offTrackAlarmDistance   : 경로 위로 인정하는 보정 거리(m)
 * - offTrackAlarmInterval   : 오프트랙 알람 최소 간격
 * - noGpsAlarmFirstTimeout  : 첫 "신호 없음" 알람까지의 유예 시간
 * - noGpsAlarmAgainInterval : 반복 "신호 없음" 알람 간격
 * - 나머지는 알람 종류별 소리/진동 사용 여부
 */
public record RadarPreferences(
        double offTrackAlarmDistance,
        Duration offTrackAlarmInterval,
        Duration noGpsAlarmFirstTimeout,
        Duration noGpsAlarmAgainInterval,
        boolean useVibration,
        boolean audioDistanceEnabled,
        boolean audioGpsLostEnabled,
        boolean audioGpsOnEnabled
) {

    public RadarPreferences {
        Objects.requireNonNull(offTrackAlarmInterval, "offTrackAlarmInterval");
        Objects.requireNonNull(noGpsAlarmFirstTimeout, "noGpsAlarmFirstTimeout");
        Objects.requireNonNull(noGpsAlarmAgainInterval, "noGpsAlarmAgainInterval");
        if (Double.isNaN(offTrackAlarmDistance) || offTrackAlarmDistance < 0) {
            throw new IllegalArgumentException("offTrackAlarmDistance 는 0 이상이어야 합니다: " + offTrackAlarmDistance);
        }
        if (offTrackAlarmInterval.isNegative()) {
            throw new IllegalArgumentException("offTrackAlarmInterval 은 음수일 수 없습니다: " + offTrackAlarmInterval);
        }
        if (noGpsAlarmFirstTimeout.isNegative() || noGpsAlarmFirstTimeout.isZero()) {
            throw new IllegalArgumentException("noGpsAlarmFirstTimeout 은 0보다 커야 합니다: " + noGpsAlarmFirstTimeout);
        }
        if (noGpsAlarmAgainInterval.isNegative() || noGpsAlarmAgainInterval.isZero()) {
            throw new IllegalArgumentException("noGpsAlarmAgainInterval 은 0보다 커야 합니다: " + noGpsAlarmAgainInterval);
        }
    }

    public static RadarPreferences from(RadarProperties props) {
        return new RadarPreferences(
                props.getOffTrackAlarmDistanceM(),
                props.getOffTrackAlarmInterval(),
                props.getNoGpsAlarmFirstTimeout(),
                props.getNoGpsAlarmAgainInterval(),
                props.isUseVibration(),
                props.isAudioDistanceEnabled(),
                props.isAudioGpsLostEnabled(),
                props.isAudioGpsOnEnabled()
        );
    }
}
