package com.trackradar.radar.model;

/**
 * 수신 시각이 붙은 fix.
 * ticks 는 단조 시계(MonotonicClock) 나노초 값이며 경과 시간 계산에만 의미가 있다.
 */
public record TimedPoint(GeoPoint point, long ticks) {
}
