package com.trackradar.radar.config;

import com.trackradar.radar.service.signal.OneShotTimerFactory;
import com.trackradar.radar.service.signal.ScheduledOneShotTimer;
import com.trackradar.radar.util.MonotonicClock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class RadarConfig {

    @Bean
    public MonotonicClock monotonicClock() {
        return MonotonicClock.system();
    }

    @Bean
    public OneShotTimerFactory watchdogTimerFactory(RadarProperties props) {
        log.info("[CONFIG] noGps firstTimeout={} againInterval={} offTrack distance={}m interval={}",
                props.getNoGpsAlarmFirstTimeout(), props.getNoGpsAlarmAgainInterval(),
                props.getOffTrackAlarmDistanceM(), props.getOffTrackAlarmInterval());
        return ScheduledOneShotTimer::new;
    }
}
