package com.trackradar.radar.service.alarm;

import com.trackradar.radar.model.AlarmKind;

/**
 * 알람 출력 창구. 블로킹하지 않아야 하며 fix 처리 스레드와 타이머 스레드 양쪽에서 호출된다.
 */
@FunctionalInterface
public interface AlarmSink {

    void fire(AlarmKind kind);
}
