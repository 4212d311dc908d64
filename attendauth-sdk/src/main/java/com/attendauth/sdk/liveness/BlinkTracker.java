package com.attendauth.sdk.liveness;

import com.attendauth.sdk.api.AttendAuthConfig;
import com.attendauth.sdk.api.ErrorCode;
import com.attendauth.sdk.landmark.LandmarkException;
import com.attendauth.sdk.landmark.LandmarkSet;
import com.attendauth.sdk.logging.EngineErrorLogger;
import com.google.common.collect.EvictingQueue;
import com.google.common.collect.ImmutableList;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * EAR 기반 눈깜빡임 상태 머신. 세션 1개당 인스턴스 1개 (공유 금지).
 *
 * 프레임마다:
 *   - EAR 을 히스토리에 추가 (최대 10, FIFO)
 *   - EAR &lt; earThreshold → counter++ (아직 blink 아님)
 *   - 그 외 → counter &gt;= earConsecFrames 이면 blink 확정 (totalBlinks++), counter = 0
 *
 * 호출 방식:
 *   BlinkTracker tracker = new BlinkTracker(config);
 *   // 매 프레임, 카메라 프레임 순서대로:
 *   BlinkResult r = tracker.track(landmarks);
 *
 * 모든 전이는 인스턴스 락으로 직렬화된다.
 */
public final class BlinkTracker {

    private final double earThreshold;
    private final int    consecFrames;
    private final int    blinksForFullConfidence;

    private final EvictingQueue<Double> earHistory;
    private int counter     = 0;
    private int totalBlinks = 0;

    public BlinkTracker(AttendAuthConfig config) {
        this.earThreshold            = config.earThreshold;
        this.consecFrames            = config.earConsecFrames;
        this.blinksForFullConfidence = config.blinksForFullConfidence;
        this.earHistory              = EvictingQueue.create(config.earHistorySize);
    }

    /**
     * 랜드마크 1프레임 처리. 예외를 던지지 않는다.
     * 랜드마크가 없거나 손상되면 상태를 건드리지 않고 0 신뢰도 결과.
     */
    public synchronized BlinkResult track(LandmarkSet landmarks) {
        if (landmarks == null) {
            return BlinkResult.unavailable();
        }
        double ear;
        try {
            ear = EyeAspectRatio.average(landmarks);
        } catch (LandmarkException e) {
            EngineErrorLogger.degraded(ErrorCode.MISSING_LANDMARKS, "BlinkTracker.track")
                    .cause(e)
                    .field("landmarkCount", landmarks.size())
                    .log();
            return BlinkResult.degraded(ErrorCode.MISSING_LANDMARKS);
        }
        return update(ear);
    }

    /**
     * 이미 계산된 EAR 값으로 1프레임 전이.
     */
    public synchronized BlinkResult update(double ear) {
        checkArgument(Double.isFinite(ear), "ear must be finite: %s", ear);
        earHistory.add(ear);

        boolean blinkDetected = false;
        if (ear < earThreshold) {
            counter++;
        } else {
            if (counter >= consecFrames) {
                totalBlinks++;
                blinkDetected = true;
            }
            counter = 0;
        }
        return BlinkResult.ok(blinkDetected, ear, totalBlinks, confidence(totalBlinks));
    }

    /** min(1, totalBlinks / blinksForFullConfidence) */
    double confidence(int blinks) {
        return Math.min(1.0, blinks / (double) blinksForFullConfidence);
    }

    public synchronized void reset() {
        earHistory.clear();
        counter = 0;
        totalBlinks = 0;
    }

    public synchronized int getTotalBlinks() { return totalBlinks; }

    public synchronized int getCounter() { return counter; }

    /** 오래된 것 → 최신 순 */
    public synchronized List<Double> getEarHistory() {
        return ImmutableList.copyOf(earHistory);
    }
}
