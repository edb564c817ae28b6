package com.trackradar.radar.service.alarm;

import com.trackradar.radar.model.AlarmKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 기본 채널: 장치 재생 대신 로그만 남긴다.
 * 단말 연동 시 이 빈을 교체한다.
 */
@Slf4j
@Component
public class LoggingAlarmChannelFactory implements AlarmChannelFactory {

    @Override
    public AlarmChannel audio(AlarmKind kind) {
        return fired -> log.info("[ALARM] audio kind={}", fired);
    }

    @Override
    public AlarmChannel vibration() {
        return fired -> log.info("[ALARM] vibrate kind={}", fired);
    }
}
