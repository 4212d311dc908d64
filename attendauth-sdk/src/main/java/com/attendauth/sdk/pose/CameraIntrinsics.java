package com.attendauth.sdk.pose;

import com.attendauth.sdk.landmark.FrameSize;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

/**
 * 핀홀 카메라 intrinsics. 캘리브레이션이 없으므로 프레임 크기로 근사:
 * focal = 프레임 너비, 주점 = 프레임 중심, 왜곡 없음.
 */
public final class CameraIntrinsics {

    /** 카메라 뒤쪽 점 투영 시 0 나눗셈 방지 */
    private static final double MIN_DEPTH = 1e-6;

    public final double fx;
    public final double fy;
    public final double cx;
    public final double cy;

    public CameraIntrinsics(double fx, double fy, double cx, double cy) {
        this.fx = fx;
        this.fy = fy;
        this.cx = cx;
        this.cy = cy;
    }

    public static CameraIntrinsics approximate(FrameSize frame) {
        return new CameraIntrinsics(frame.width, frame.width, frame.centerX(), frame.centerY());
    }

    /** 카메라 좌표 점 → 픽셀 (u, v) */
    public double[] project(Vector3D p) {
        double z = Math.max(p.getZ(), MIN_DEPTH);
        return new double[]{fx * p.getX() / z + cx, fy * p.getY() / z + cy};
    }
}
