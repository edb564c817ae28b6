package com.trackradar.radar.service;

import com.trackradar.radar.dto.request.FixRequest;
import com.trackradar.radar.dto.request.GeoPointRequest;
import com.trackradar.radar.dto.request.PreferencesRequest;
import com.trackradar.radar.dto.request.RouteStartRequest;
import com.trackradar.radar.dto.response.FixResponse;
import com.trackradar.radar.dto.response.RadarInfoResponse;
import com.trackradar.radar.dto.response.SessionResponse;
import com.trackradar.radar.model.GeoPoint;
import com.trackradar.radar.model.Route;
import com.trackradar.radar.model.RouteSegment;
import com.trackradar.radar.model.TimedPoint;
import com.trackradar.radar.service.alarm.AlarmRecord;
import com.trackradar.radar.service.alarm.RadarAlarms;
import com.trackradar.radar.service.signal.OneShotTimerFactory;
import com.trackradar.radar.util.AtomicCell;
import com.trackradar.radar.util.MonotonicClock;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * 레이더 세션 오케스트레이션 레이어.
 * - 한 번에 하나의 세션(RadarEngine)만 유지
 * - 세션 시작/종료, fix 업링크, 상태 조회, 설정 교체
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RadarSessionService {

    public static final String NO_SIGNAL_TEXT = "GPS 신호가 없습니다.";

    private final RadarPreferencesHolder preferences;
    private final RadarAlarms alarms;
    private final MonotonicClock clock;
    private final OneShotTimerFactory timerFactory;

    private final AtomicCell<ActiveSession> active = new AtomicCell<>(null);

    private record ActiveSession(String id, RadarEngine engine, Instant startedAt) {}

    /**
     * 새 세션 시작. 진행 중인 세션이 있으면 종료하고 교체한다.
     */
    public SessionResponse start(RouteStartRequest req) {
        Route route = toRoute(req);
        String sessionId = UUID.randomUUID().toString();

        alarms.reset(preferences.get());
        RadarEngine engine = new RadarEngine(
                route,
                preferences,
                alarms,
                () -> log.info("[SESSION] gps off. session={}", sessionId),
                clock,
                timerFactory.create("signal-watchdog-" + sessionId.substring(0, 8))
        );
        ActiveSession session = new ActiveSession(sessionId, engine, Instant.now());

        ActiveSession previous = active.exchange(session);
        if (previous != null) {
            log.info("[SESSION] 기존 세션 교체. previous={}", previous.id());
            previous.engine().dispose();
        }

        log.info("[SESSION] started session={} segments={} points={}",
                sessionId, route.segments().size(), route.pointCount());
        return new SessionResponse(sessionId, route.segments().size(), route.pointCount(), session.startedAt());
    }

    public void stop() {
        ActiveSession previous = active.exchange(null);
        if (previous == null) {
            throw new IllegalStateException("진행 중인 세션이 없습니다.");
        }
        previous.engine().dispose();
        log.info("[SESSION] stopped session={}", previous.id());
    }

    public FixResponse ingest(FixRequest req) {
        ActiveSession session = requireActive();
        double accuracy = (req.accuracyM() != null) ? req.accuracyM() : 0.0;
        TimedPoint fix = new TimedPoint(new GeoPoint(req.lat(), req.lon()), clock.nowNanos());

        double dist = session.engine().ingestFix(fix, accuracy);
        return new FixResponse(dist, dist <= 0, session.engine().hasSignal());
    }

    /**
     * 신호가 있으면 현재 거리, 없으면 "신호 없음" 안내
     */
    public RadarInfoResponse info() {
        ActiveSession session = requireActive();
        RadarEngine engine = session.engine();
        RadarStatistics stats = engine.statistics();

        if (engine.hasSignal()) {
            return new RadarInfoResponse(session.id(), RadarInfoResponse.STATUS_SIGNAL,
                    stats.getSignedDistance(), null, stats.getEvaluatedFixes(), stats.getSkippedFixes());
        }
        return new RadarInfoResponse(session.id(), RadarInfoResponse.STATUS_NO_SIGNAL,
                null, NO_SIGNAL_TEXT, stats.getEvaluatedFixes(), stats.getSkippedFixes());
    }

    public RadarPreferences currentPreferences() {
        return preferences.get();
    }

    public RadarPreferences updatePreferences(PreferencesRequest req) {
        RadarPreferences next = new RadarPreferences(
                req.offTrackAlarmDistanceM(),
                Duration.ofSeconds(req.offTrackAlarmIntervalSec()),
                Duration.ofSeconds(req.noGpsAlarmFirstTimeoutSec()),
                Duration.ofSeconds(req.noGpsAlarmAgainIntervalSec()),
                req.useVibration(),
                req.audioDistanceEnabled(),
                req.audioGpsLostEnabled(),
                req.audioGpsOnEnabled()
        );
        preferences.replace(next);
        alarms.reset(next);
        log.info("[SESSION] preferences updated {}", next);
        return next;
    }

    public List<AlarmRecord> recentAlarms() {
        return alarms.recent();
    }

    @PreDestroy
    public void shutdown() {
        ActiveSession previous = active.exchange(null);
        if (previous != null) {
            previous.engine().dispose();
            log.info("[SESSION] shutdown session={}", previous.id());
        }
    }

    private ActiveSession requireActive() {
        ActiveSession session = active.get();
        if (session == null) {
            throw new IllegalStateException("진행 중인 세션이 없습니다. /api/radar/session 을 먼저 호출하세요.");
        }
        return session;
    }

    private static Route toRoute(RouteStartRequest req) {
        if (req == null || req.segments() == null) {
            throw new IllegalArgumentException("segments 가 비어 있습니다.");
        }
        List<RouteSegment> segments = req.segments().stream()
                .map(points -> new RouteSegment(points.stream()
                        .map((GeoPointRequest p) -> new GeoPoint(p.lat(), p.lon()))
                        .toList()))
                .toList();
        return new Route(segments);
    }
}
