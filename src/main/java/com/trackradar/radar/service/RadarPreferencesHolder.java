package com.trackradar.radar.service;

import com.trackradar.radar.config.RadarProperties;
import com.trackradar.radar.util.AtomicCell;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * 런타임에 교체 가능한 설정 스냅샷 보관소. 초기값은 yml(RadarProperties).
 */
@Component
public class RadarPreferencesHolder implements Supplier<RadarPreferences> {

    private final AtomicCell<RadarPreferences> current;

    public RadarPreferencesHolder(RadarProperties props) {
        this.current = new AtomicCell<>(RadarPreferences.from(props));
    }

    @Override
    public RadarPreferences get() {
        return current.get();
    }

    /** 새 설정으로 교체하고 이전 설정을 돌려준다. */
    public RadarPreferences replace(RadarPreferences prefs) {
        return current.exchange(Objects.requireNonNull(prefs, "prefs"));
    }
}
