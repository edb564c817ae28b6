package com.trackradar.radar.service;

import java.util.Locale;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * fix 처리 통계 + 중복 계산 방지.
 * 이전 fix 를 계산하는 중에 들어온 fix 는 평가하지 않고 건너뛴다.
 */
public class RadarStatistics {

    private final AtomicBoolean updating = new AtomicBoolean();
    private final AtomicLong signedDistanceBits = new AtomicLong(Double.doubleToLongBits(0.0));
    private final AtomicLong accuracyBits = new AtomicLong(Double.doubleToLongBits(0.0));
    private final AtomicLong evaluated = new AtomicLong();
    private final AtomicLong skipped = new AtomicLong();

    /** @return false 면 다른 fix 를 계산 중 */
    public boolean tryBeginUpdate() {
        if (updating.compareAndSet(false, true)) {
            return true;
        }
        skipped.incrementAndGet();
        return false;
    }

    public void completeUpdate(double signedDistance, double accuracy) {
        signedDistanceBits.set(Double.doubleToLongBits(signedDistance));
        accuracyBits.set(Double.doubleToLongBits(accuracy));
        evaluated.incrementAndGet();
        updating.set(false);
    }

    public double getSignedDistance() {
        return Double.longBitsToDouble(signedDistanceBits.get());
    }

    public double getAccuracy() {
        return Double.longBitsToDouble(accuracyBits.get());
    }

    public long getEvaluatedFixes() {
        return evaluated.get();
    }

    public long getSkippedFixes() {
        return skipped.get();
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "evaluated=%d skipped=%d dist=%.1f accuracy=%.1f",
                getEvaluatedFixes(), getSkippedFixes(), getSignedDistance(), getAccuracy());
    }
}
