package com.attendauth.sdk.liveness;

import com.attendauth.sdk.api.AttendAuthConfig;
import com.attendauth.sdk.pose.PoseEstimate;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * blink / pose 신호 융합.
 *
 *   score   = 0.6 * blinkConfidence + 0.4 * poseConfidence
 *   is_live = totalBlinks &gt; 0 || movementDetected || score &gt; threshold   (strict)
 *
 * 약한 신호 중 하나만 있어도 live.
 * 정지 사진이 pose 노이즈로 통과할 수 있다. 보정된 분류기로 교체할 후보.
 *
 * 순수 함수. 예외를 던지지 않는다.
 */
public final class LivenessFusion {

    private final double blinkWeight;
    private final double poseWeight;

    public LivenessFusion(AttendAuthConfig config) {
        this.blinkWeight = config.blinkWeight;
        this.poseWeight  = config.poseWeight;
    }

    public LivenessResult fuse(BlinkResult blink, PoseEstimate pose, double threshold) {
        checkNotNull(blink, "blink");
        checkNotNull(pose, "pose");
        double score = blinkWeight * blink.confidence + poseWeight * pose.confidence;
        boolean live = blink.totalBlinks > 0
                || pose.movementDetected
                || score > threshold;
        return new LivenessResult(live, score, blink, pose);
    }
}
