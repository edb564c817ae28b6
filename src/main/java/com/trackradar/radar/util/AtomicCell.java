package com.trackradar.radar.util;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * 스레드 간에 공유되는 값을 담는 lock-free 셀.
 * - 읽기/쓰기는 원자적 교환(exchange) 또는 CAS 로만 이뤄진다.
 * - 락을 잡지 않으므로 타이머 콜백과 fix 처리 경로가 서로를 막지 않는다.
 */
public final class AtomicCell<T> {

    private final AtomicReference<T> ref;

    public AtomicCell(T initial) {
        this.ref = new AtomicReference<>(initial);
    }

    public T get() {
        return ref.get();
    }

    public void set(T value) {
        ref.set(value);
    }

    /** 새 값을 넣고 이전 값을 돌려준다. */
    public T exchange(T value) {
        return ref.getAndSet(value);
    }

    public boolean compareAndSet(T expected, T next) {
        return ref.compareAndSet(expected, next);
    }

    /** 함수를 적용해 갱신하고 갱신 전 값을 돌려준다. 경합 시 함수가 여러 번 호출될 수 있다. */
    public T getAndUpdate(UnaryOperator<T> fn) {
        return ref.getAndUpdate(fn);
    }
}
