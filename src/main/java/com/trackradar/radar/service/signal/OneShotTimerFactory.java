package com.trackradar.radar.service.signal;

@FunctionalInterface
public interface OneShotTimerFactory {

    OneShotTimer create(String name);
}
