package com.attendauth.sdk.landmark;

import com.attendauth.sdk.pose.CameraIntrinsics;
import com.attendauth.sdk.pose.FaceModel3d;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 테스트용 68점 랜드마크 생성기.
 * 일반 얼굴 모델을 주어진 회전(R = Rz(roll)·Ry(pitch)·Rx(yaw))으로 돌려 투영하고,
 * 눈 6점은 지정한 EAR 이 나오도록 배치한다.
 */
public final class LandmarkFixtures {

    public static final FrameSize FRAME = new FrameSize(640, 480);
    public static final double OPEN_EAR = 0.30;
    public static final double CLOSED_EAR = 0.20;

    private static final double DEPTH_MM = 2000.0;

    private LandmarkFixtures() {}

    public static LandmarkSet frontal(double ear) {
        return face(0, 0, 0, ear);
    }

    /** 각도는 deg */
    public static LandmarkSet face(double yawDeg, double pitchDeg, double rollDeg, double ear) {
        return LandmarkSet.of(facePoints(yawDeg, pitchDeg, rollDeg, ear));
    }

    public static List<Point2> facePoints(double yawDeg, double pitchDeg, double rollDeg, double ear) {
        double[][] r = rotation(Math.toRadians(yawDeg), Math.toRadians(pitchDeg), Math.toRadians(rollDeg));
        CameraIntrinsics camera = CameraIntrinsics.approximate(FRAME);
        Vector3D[] model = FaceModel3d.cameraFramePoints();
        int[] indices = FaceModel3d.landmarkIndices();

        Point2[] pts = new Point2[LandmarkSet.POINT_COUNT];
        for (int i = 0; i < model.length; i++) {
            Vector3D p = apply(r, model[i]).add(new Vector3D(0, 0, DEPTH_MM));
            double[] uv = camera.project(p);
            pts[indices[i]] = new Point2(uv[0], uv[1]);
        }

        Point2 outerLeft = pts[LandmarkSet.LEFT_EYE_OUTER];
        Point2 outerRight = pts[LandmarkSet.RIGHT_EYE_OUTER];
        double span = outerLeft.distanceTo(outerRight);
        double dx = (outerRight.x - outerLeft.x) / span;
        double dy = (outerRight.y - outerLeft.y) / span;
        double eyeWidth = span * 0.3;

        // 왼쪽 눈: p1 = 36 (바깥), p4 = 39 (안쪽)
        placeEye(pts, 36, outerLeft, dx, dy, eyeWidth, ear);
        // 오른쪽 눈: p1 = 42 (안쪽), p4 = 45 (바깥)
        Point2 innerRight = new Point2(outerRight.x - dx * eyeWidth, outerRight.y - dy * eyeWidth);
        placeEye(pts, 42, innerRight, dx, dy, eyeWidth, ear);

        Point2 nose = pts[LandmarkSet.NOSE_TIP];
        for (int i = 0; i < pts.length; i++) {
            if (pts[i] == null) pts[i] = new Point2(nose.x + (i % 7) - 3, nose.y + (i % 5) - 2);
        }
        return new ArrayList<>(Arrays.asList(pts));
    }

    /** 6점 눈: EAR = 2h / w → h = ear * w / 2 */
    private static void placeEye(Point2[] pts, int start, Point2 p1, double dx, double dy,
                                 double width, double ear) {
        double h = ear * width / 2.0;
        double nx = -dy;
        double ny = dx;
        Point2 third = along(p1, dx, dy, width / 3.0);
        Point2 twoThirds = along(p1, dx, dy, 2.0 * width / 3.0);
        pts[start]     = p1;
        pts[start + 1] = new Point2(third.x - nx * h, third.y - ny * h);
        pts[start + 2] = new Point2(twoThirds.x - nx * h, twoThirds.y - ny * h);
        pts[start + 3] = along(p1, dx, dy, width);
        pts[start + 4] = new Point2(twoThirds.x + nx * h, twoThirds.y + ny * h);
        pts[start + 5] = new Point2(third.x + nx * h, third.y + ny * h);
    }

    private static Point2 along(Point2 p, double dx, double dy, double d) {
        return new Point2(p.x + dx * d, p.y + dy * d);
    }

    /** R = Rz(roll) · Ry(pitch) · Rx(yaw) */
    public static double[][] rotation(double yaw, double pitch, double roll) {
        double[][] rx = {{1, 0, 0}, {0, Math.cos(yaw), -Math.sin(yaw)}, {0, Math.sin(yaw), Math.cos(yaw)}};
        double[][] ry = {{Math.cos(pitch), 0, Math.sin(pitch)}, {0, 1, 0}, {-Math.sin(pitch), 0, Math.cos(pitch)}};
        double[][] rz = {{Math.cos(roll), -Math.sin(roll), 0}, {Math.sin(roll), Math.cos(roll), 0}, {0, 0, 1}};
        return multiply(rz, multiply(ry, rx));
    }

    public static double[][] multiply(double[][] a, double[][] b) {
        double[][] m = new double[3][3];
        for (int i = 0; i < 3; i++)
            for (int j = 0; j < 3; j++)
                for (int k = 0; k < 3; k++)
                    m[i][j] += a[i][k] * b[k][j];
        return m;
    }

    private static Vector3D apply(double[][] r, Vector3D v) {
        return new Vector3D(
                r[0][0] * v.getX() + r[0][1] * v.getY() + r[0][2] * v.getZ(),
                r[1][0] * v.getX() + r[1][1] * v.getY() + r[1][2] * v.getZ(),
                r[2][0] * v.getX() + r[2][1] * v.getY() + r[2][2] * v.getZ());
    }
}
