package com.trackradar.radar.service.track;

import com.trackradar.radar.model.GeoPoint;
import com.trackradar.radar.model.Route;
import com.trackradar.radar.model.RouteSegment;
import com.trackradar.radar.util.GeoMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StopWatch;

/**
 * fix 가 경로 위에 있는지 판정한다.
 *
 * 동작:
 * 1) 모든 구간의 모든 점 쌍에 대해 (호까지의 거리 - 정확도) 를 계산 (0 미만은 0)
 * 2) 임계 거리 이하인 점 쌍을 만나면 즉시 onTrack 으로 반환 (부호 음수)
 * 3) 끝까지 못 찾으면 최소 거리로 offTrack 반환 (부호 양수)
 *
 * 각 구간은 끝 점 쌍부터 시작 점 쌍 방향으로 훑는다. 비용은 경로 점 개수에 비례.
 */
@Slf4j
public class ProximityEvaluator {

    public ProximityResult evaluate(GeoPoint fix, double accuracy, Route route, double onTrackThreshold) {
        StopWatch watch = new StopWatch();
        watch.start();

        double dist = Double.MAX_VALUE;
        int closestSegment = -1;
        int closestPoint = -1;

        for (int t = 0; t < route.segments().size(); ++t) {
            RouteSegment seg = route.segments().get(t);
            for (int s = seg.size() - 1; s > 0; --s) {
                double d = Math.max(0, GeoMath.distanceToSegment(fix, seg.get(s - 1), seg.get(s)) - accuracy);

                if (dist > d) {
                    dist = d;
                    closestSegment = t;
                    closestPoint = s;
                }
                if (d <= onTrackThreshold) {
                    watch.stop();
                    if (log.isDebugEnabled()) {
                        log.debug("[PROXIMITY] on seg={} pair={} d={}m ({} -- {}) in {}us",
                                t, s, String.format("%.1f", d), seg.get(s - 1), seg.get(s),
                                watch.getTotalTimeNanos() / 1000);
                    }
                    return new ProximityResult(true, -dist, closestSegment, closestPoint);
                }
            }
        }

        watch.stop();
        if (closestSegment < 0) {
            log.debug("[PROXIMITY] 경로에 점 쌍이 없어 항상 이탈로 판정합니다. point={}", fix);
            return ProximityResult.noGeometry();
        }

        if (log.isDebugEnabled()) {
            RouteSegment seg = route.segments().get(closestSegment);
            log.debug("[PROXIMITY] off seg={} pair={} d={}m point={} ({} -- {}) in {}us",
                    closestSegment, closestPoint, String.format("%.1f", dist), fix,
                    seg.get(closestPoint - 1), seg.get(closestPoint), watch.getTotalTimeNanos() / 1000);
        }
        return new ProximityResult(false, dist, closestSegment, closestPoint);
    }
}
