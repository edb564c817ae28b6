package com.trackradar.radar.dto.request;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

public record PreferencesRequest(
        @PositiveOrZero double offTrackAlarmDistanceM,
        @PositiveOrZero long offTrackAlarmIntervalSec,
        @Positive long noGpsAlarmFirstTimeoutSec,
        @Positive long noGpsAlarmAgainIntervalSec,
        boolean useVibration,
        boolean audioDistanceEnabled,
        boolean audioGpsLostEnabled,
        boolean audioGpsOnEnabled
) {}
