package com.trackradar.radar.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * 오프트랙/GPS 알람 기본 설정 (yml). 세션 중 변경은 RadarPreferencesHolder 로 한다.
 */
@Getter @Setter
@Configuration
@ConfigurationProperties(prefix = "trackradar.radar")
public class RadarProperties {

    // --- 경로 이탈 ---
    private double   offTrackAlarmDistanceM  = 50.0;                    // 경로 위로 인정하는 보정 거리
    private Duration offTrackAlarmInterval   = Duration.ofSeconds(10);  // 오프트랙 알람 최소 간격

    // --- GPS 신호 ---
    private Duration noGpsAlarmFirstTimeout  = Duration.ofSeconds(5);   // 첫 "신호 없음" 까지 유예
    private Duration noGpsAlarmAgainInterval = Duration.ofSeconds(30);  // 반복 알람 간격

    // --- 출력 ---
    private boolean useVibration         = true;
    private boolean audioDistanceEnabled = true;
    private boolean audioGpsLostEnabled  = true;
    private boolean audioGpsOnEnabled    = true;

    // 상태 조회용으로 보관할 최근 알람 개수
    private int recentAlarmCapacity = 20;
}
