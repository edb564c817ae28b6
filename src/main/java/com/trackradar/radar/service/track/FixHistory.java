package com.trackradar.radar.service.track;

import com.trackradar.radar.model.TimedPoint;

import java.util.ArrayDeque;
import java.util.List;

/**
 * 최근 fix 를 고정 개수만큼 유지하는 순환 버퍼.
 * 용량을 넘으면 가장 오래된 점부터 버린다.
 */
public class FixHistory {

    // 3개 창: 너무 넓으면 급정지 시 속도가 늦게 반영되고, 너무 좁으면 GPS 오차가 크게 작용
    public static final int DEFAULT_CAPACITY = 3;

    private final int capacity;
    private final ArrayDeque<TimedPoint> points;

    public FixHistory() {
        this(DEFAULT_CAPACITY);
    }

    public FixHistory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity 는 1 이상이어야 합니다. capacity=" + capacity);
        }
        this.capacity = capacity;
        this.points = new ArrayDeque<>(capacity);
    }

    public void add(TimedPoint point) {
        points.addLast(point);
        while (points.size() > capacity) points.removeFirst();
    }

    /** 가장 최근에 넣은 점. 비어 있으면 null */
    public TimedPoint last() {
        return points.peekLast();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public int size() {
        return points.size();
    }

    public int capacity() {
        return capacity;
    }

    /** 오래된 순서의 스냅샷 */
    public List<TimedPoint> toList() {
        return List.copyOf(points);
    }
}
