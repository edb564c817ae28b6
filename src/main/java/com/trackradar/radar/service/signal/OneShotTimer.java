package com.trackradar.radar.service.signal;

import java.time.Duration;

/**
 * 주기 없이 한 번만 울리는 타이머. 다시 예약하면 대기 중인 이전 예약은 취소된다.
 */
public interface OneShotTimer {

    void schedule(Runnable task, Duration delay);

    /**
     * 이후 어떤 작업도 실행되지 않으며, 실행 중이던 작업이 끝날 때까지 기다린다.
     * 여러 번 호출해도 안전하다.
     */
    void close();
}
