package com.trackradar.radar.service.alarm;

import com.trackradar.radar.model.AlarmKind;

/**
 * 실제 알람 출력 장치(소리, 진동 등) 하나.
 */
@FunctionalInterface
public interface AlarmChannel {

    void play(AlarmKind kind);
}
