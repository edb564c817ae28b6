package com.trackradar.radar.util;

/**
 * 타임아웃/알람 간격 계산용 단조 시계 (나노초).
 * 벽시계(Instant.now)는 관측용으로만 쓴다.
 */
@FunctionalInterface
public interface MonotonicClock {

    long nowNanos();

    static MonotonicClock system() {
        return System::nanoTime;
    }
}
