package com.attendauth.sdk.quality;

import com.attendauth.sdk.api.SignalStatus;

/** 마스크 착용 판정 결과. */
public final class MaskResult {
    public final boolean      hasMask;
    public final double       confidence;
    public final double       skinRatio;   // 얼굴 하단 skin 픽셀 비율
    public final SignalStatus status;

    MaskResult(boolean hasMask, double confidence, double skinRatio, SignalStatus status) {
        this.hasMask    = hasMask;
        this.confidence = confidence;
        this.skinRatio  = skinRatio;
        this.status     = status;
    }

    public static MaskResult degraded() {
        return new MaskResult(false, 0.0, 0.0, SignalStatus.DEGRADED);
    }

    @Override public String toString() {
        return String.format("MaskResult{hasMask=%s, confidence=%.3f, skinRatio=%.3f, status=%s}",
                hasMask, confidence, skinRatio, status);
    }
}
