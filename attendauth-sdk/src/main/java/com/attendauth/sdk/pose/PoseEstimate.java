package com.attendauth.sdk.pose;

import com.attendauth.sdk.api.ErrorCode;
import com.attendauth.sdk.api.SignalStatus;

/**
 * 프레임 1장의 head pose (deg). 히스토리 없음.
 * status != OK 이면 yaw=pitch=roll=0, movement=false, confidence=0.
 */
public final class PoseEstimate {

    public final SignalStatus status;
    public final ErrorCode    reason;   // status == OK 이면 null
    public final double  yaw;
    public final double  pitch;
    public final double  roll;
    public final boolean movementDetected;
    public final double  confidence;

    PoseEstimate(SignalStatus status, ErrorCode reason, double yaw, double pitch, double roll,
                 boolean movementDetected, double confidence) {
        this.status           = status;
        this.reason           = reason;
        this.yaw              = yaw;
        this.pitch            = pitch;
        this.roll             = roll;
        this.movementDetected = movementDetected;
        this.confidence       = confidence;
    }

    public static PoseEstimate ok(double yaw, double pitch, double roll,
                                  boolean movementDetected, double confidence) {
        return new PoseEstimate(SignalStatus.OK, null, yaw, pitch, roll, movementDetected, confidence);
    }

    public static PoseEstimate unavailable() {
        return new PoseEstimate(SignalStatus.UNAVAILABLE, ErrorCode.MISSING_LANDMARKS, 0, 0, 0, false, 0);
    }

    public static PoseEstimate degraded(ErrorCode reason) {
        return new PoseEstimate(SignalStatus.DEGRADED, reason, 0, 0, 0, false, 0);
    }

    public boolean isOk() { return status == SignalStatus.OK; }

    @Override public String toString() {
        return String.format("PoseEstimate{status=%s, yaw=%.1f, pitch=%.1f, roll=%.1f, movement=%s, confidence=%.3f}",
                status, yaw, pitch, roll, movementDetected, confidence);
    }
}
