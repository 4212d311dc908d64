package com.attendauth.sdk.liveness;

import com.attendauth.sdk.api.ErrorCode;
import com.attendauth.sdk.api.SignalStatus;

/**
 * 프레임 1장에 대한 blink 추적 결과.
 * status != OK 이면 confidence 0, blinkDetected false, totalBlinks 0 (보수적 출력).
 */
public final class BlinkResult {

    public final SignalStatus status;
    public final ErrorCode    reason;        // status == OK 이면 null
    public final boolean      blinkDetected; // 이번 프레임에서 blink 확정
    public final double       ear;
    public final int          totalBlinks;
    public final double       confidence;    // min(1, totalBlinks / 3)

    BlinkResult(SignalStatus status, ErrorCode reason, boolean blinkDetected,
                double ear, int totalBlinks, double confidence) {
        this.status        = status;
        this.reason        = reason;
        this.blinkDetected = blinkDetected;
        this.ear           = ear;
        this.totalBlinks   = totalBlinks;
        this.confidence    = confidence;
    }

    public static BlinkResult ok(boolean blinkDetected, double ear, int totalBlinks, double confidence) {
        return new BlinkResult(SignalStatus.OK, null, blinkDetected, ear, totalBlinks, confidence);
    }

    /** 랜드마크 미제공 */
    public static BlinkResult unavailable() {
        return new BlinkResult(SignalStatus.UNAVAILABLE, ErrorCode.MISSING_LANDMARKS, false, 0.0, 0, 0.0);
    }

    /** 계산 실패 */
    public static BlinkResult degraded(ErrorCode reason) {
        return new BlinkResult(SignalStatus.DEGRADED, reason, false, 0.0, 0, 0.0);
    }

    public boolean isOk() { return status == SignalStatus.OK; }

    @Override public String toString() {
        return "BlinkResult{status=" + status
                + ", blink=" + blinkDetected
                + ", ear=" + String.format("%.3f", ear)
                + ", total=" + totalBlinks
                + ", confidence=" + String.format("%.3f", confidence) + "}";
    }
}
