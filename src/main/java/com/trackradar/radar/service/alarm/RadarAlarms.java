package com.trackradar.radar.service.alarm;

import com.trackradar.radar.config.RadarProperties;
import com.trackradar.radar.model.AlarmKind;
import com.trackradar.radar.service.RadarPreferences;
import com.trackradar.radar.util.AtomicCell;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 알람 종류별 출력 채널 관리.
 * - 설정이 바뀌면 reset() 으로 채널을 통째로 교체 (꺼진 종류는 null)
 * - fire() 는 fix 처리 스레드와 신호 감시 타이머 스레드 양쪽에서 호출된다
 */
@Slf4j
@Component
public class RadarAlarms implements AlarmSink {

    private final AlarmChannelFactory channelFactory;
    private final int recentCapacity;

    private final AtomicCell<AlarmChannel> offTrackChannel = new AtomicCell<>(null);
    private final AtomicCell<AlarmChannel> gpsLostChannel = new AtomicCell<>(null);
    private final AtomicCell<AlarmChannel> gpsOnChannel = new AtomicCell<>(null);
    private final AtomicCell<AlarmChannel> vibrator = new AtomicCell<>(null);

    private final Map<AlarmKind, AtomicLong> counts = new EnumMap<>(AlarmKind.class);
    private final ConcurrentLinkedDeque<AlarmRecord> recent = new ConcurrentLinkedDeque<>();
    private final AtomicInteger recentSize = new AtomicInteger();

    public RadarAlarms(AlarmChannelFactory channelFactory, RadarProperties props) {
        this.channelFactory = channelFactory;
        this.recentCapacity = Math.max(1, props.getRecentAlarmCapacity());
        for (AlarmKind kind : AlarmKind.values()) {
            counts.put(kind, new AtomicLong());
        }
    }

    public void reset(RadarPreferences prefs) {
        vibrator.set(prefs.useVibration() ? channelFactory.vibration() : null);
        offTrackChannel.set(prefs.audioDistanceEnabled() ? channelFactory.audio(AlarmKind.OFF_TRACK) : null);
        gpsLostChannel.set(prefs.audioGpsLostEnabled() ? channelFactory.audio(AlarmKind.SIGNAL_LOST) : null);
        gpsOnChannel.set(prefs.audioGpsOnEnabled() ? channelFactory.audio(AlarmKind.POSITIVE_ACKNOWLEDGEMENT) : null);
        log.debug("[ALARM] 채널 재설정 vibration={} offTrack={} gpsLost={} gpsOn={}",
                prefs.useVibration(), prefs.audioDistanceEnabled(), prefs.audioGpsLostEnabled(), prefs.audioGpsOnEnabled());
    }

    @Override
    public void fire(AlarmKind kind) {
        AlarmChannel audio = switch (kind) {
            case OFF_TRACK -> offTrackChannel.get();
            case SIGNAL_LOST -> gpsLostChannel.get();
            case POSITIVE_ACKNOWLEDGEMENT -> gpsOnChannel.get();
        };
        AlarmChannel vib = vibrator.get();

        boolean audible = play(audio, kind);
        boolean vibrated = play(vib, kind);

        counts.get(kind).incrementAndGet();
        remember(new AlarmRecord(kind, Instant.now(), audible, vibrated));
    }

    private boolean play(AlarmChannel channel, AlarmKind kind) {
        if (channel == null) {
            return false;
        }
        try {
            channel.play(kind);
            return true;
        } catch (RuntimeException e) {
            // 출력 장치 오류가 fix 처리나 신호 감시를 멈추게 해서는 안 된다
            log.warn("[ALARM] 채널 재생 실패 kind={}", kind, e);
            return false;
        }
    }

    private void remember(AlarmRecord record) {
        recent.addLast(record);
        if (recentSize.incrementAndGet() > recentCapacity && recent.pollFirst() != null) {
            recentSize.decrementAndGet();
        }
    }

    public long count(AlarmKind kind) {
        return counts.get(kind).get();
    }

    /** 최근 알람, 최신 순 */
    public List<AlarmRecord> recent() {
        List<AlarmRecord> out = new ArrayList<>(recentCapacity);
        for (Iterator<AlarmRecord> it = recent.descendingIterator(); it.hasNext(); ) {
            out.add(it.next());
        }
        return Collections.unmodifiableList(out);
    }
}
