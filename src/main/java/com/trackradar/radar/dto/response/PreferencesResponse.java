package com.trackradar.radar.dto.response;

import com.trackradar.radar.service.RadarPreferences;

public record PreferencesResponse(
        double offTrackAlarmDistanceM,
        long offTrackAlarmIntervalSec,
        long noGpsAlarmFirstTimeoutSec,
        long noGpsAlarmAgainIntervalSec,
        boolean useVibration,
        boolean audioDistanceEnabled,
        boolean audioGpsLostEnabled,
        boolean audioGpsOnEnabled
) {
    public static PreferencesResponse from(RadarPreferences p) {
        return new PreferencesResponse(
                p.offTrackAlarmDistance(),
                p.offTrackAlarmInterval().toSeconds(),
                p.noGpsAlarmFirstTimeout().toSeconds(),
                p.noGpsAlarmAgainInterval().toSeconds(),
                p.useVibration(),
                p.audioDistanceEnabled(),
                p.audioGpsLostEnabled(),
                p.audioGpsOnEnabled()
        );
    }
}
