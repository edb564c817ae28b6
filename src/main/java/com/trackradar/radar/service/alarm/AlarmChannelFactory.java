package com.trackradar.radar.service.alarm;

import com.trackradar.radar.model.AlarmKind;

public interface AlarmChannelFactory {

    /** 알람 종류별 소리 채널 */
    AlarmChannel audio(AlarmKind kind);

    AlarmChannel vibration();
}
