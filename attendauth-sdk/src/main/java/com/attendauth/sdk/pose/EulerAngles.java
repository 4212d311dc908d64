package com.attendauth.sdk.pose;

/**
 * 회전 행렬 → (yaw, pitch, roll).
 *
 *   sy = sqrt(R00² + R10²)
 *   sy &gt;= 1e-6 : (atan2(R21, R22), atan2(-R20, sy), atan2(R10, R00))
 *   sy &lt;  1e-6 : (atan2(-R12, R11), atan2(-R20, sy), 0)     ← gimbal lock
 */
public final class EulerAngles {

    static final double SINGULAR_EPS = 1e-6;

    public final double  yaw;
    public final double  pitch;
    public final double  roll;
    public final boolean singular;

    private EulerAngles(double yaw, double pitch, double roll, boolean singular) {
        this.yaw      = yaw;
        this.pitch    = pitch;
        this.roll     = roll;
        this.singular = singular;
    }

    /** @param r 3x3 회전 행렬 (row-major). 결과는 radian. */
    public static EulerAngles fromRotationMatrix(double[][] r) {
        double sy = Math.sqrt(r[0][0] * r[0][0] + r[1][0] * r[1][0]);
        if (sy >= SINGULAR_EPS) {
            return new EulerAngles(
                    Math.atan2(r[2][1], r[2][2]),
                    Math.atan2(-r[2][0], sy),
                    Math.atan2(r[1][0], r[0][0]),
                    false);
        }
        return new EulerAngles(
                Math.atan2(-r[1][2], r[1][1]),
                Math.atan2(-r[2][0], sy),
                0.0,
                true);
    }

    public EulerAngles toDegrees() {
        return new EulerAngles(Math.toDegrees(yaw), Math.toDegrees(pitch), Math.toDegrees(roll), singular);
    }

    @Override public String toString() {
        return String.format("EulerAngles{yaw=%.4f, pitch=%.4f, roll=%.4f%s}",
                yaw, pitch, roll, singular ? ", singular" : "");
    }
}
