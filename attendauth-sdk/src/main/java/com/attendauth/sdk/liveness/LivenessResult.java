package com.attendauth.sdk.liveness;

import com.attendauth.sdk.api.SignalStatus;
import com.attendauth.sdk.pose.PoseEstimate;

/**
 * blink + pose 융합 결과.
 * status 는 두 하위 결과 중 더 나쁜 상태 (OK &lt; DEGRADED &lt; UNAVAILABLE).
 */
public final class LivenessResult {

    public final boolean      live;
    public final double       livenessScore;   // 0.0 ~ 1.0
    public final BlinkResult  blink;
    public final PoseEstimate pose;
    public final SignalStatus status;

    LivenessResult(boolean live, double livenessScore, BlinkResult blink, PoseEstimate pose) {
        this.live          = live;
        this.livenessScore = livenessScore;
        this.blink         = blink;
        this.pose          = pose;
        this.status        = blink.status.worst(pose.status);
    }

    /** liveness 검사를 요청하지 않은 프레임용 자리표시: live=true, score=1.0 */
    public static LivenessResult notRequested() {
        return new LivenessResult(true, 1.0,
                BlinkResult.unavailable(), PoseEstimate.unavailable());
    }

    @Override public String toString() {
        return "LivenessResult{live=" + live
                + ", score=" + String.format("%.3f", livenessScore)
                + ", status=" + status
                + ", " + blink + ", " + pose + "}";
    }
}
