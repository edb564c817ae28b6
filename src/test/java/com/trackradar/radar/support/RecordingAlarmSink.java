package com.trackradar.radar.support;

import com.trackradar.radar.model.AlarmKind;
import com.trackradar.radar.service.alarm.AlarmSink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class RecordingAlarmSink implements AlarmSink {

    private final List<AlarmKind> fired = new CopyOnWriteArrayList<>();

    @Override
    public void fire(AlarmKind kind) {
        fired.add(kind);
    }

    public List<AlarmKind> fired() {
        return List.copyOf(fired);
    }

    public long count(AlarmKind kind) {
        return fired.stream().filter(k -> k == kind).count();
    }

    public void clear() {
        fired.clear();
    }
}
