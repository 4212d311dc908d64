package com.attendauth.sdk.pose;

import com.attendauth.sdk.landmark.Point2;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.geometry.euclidean.threed.Rotation;
import org.apache.commons.math3.geometry.euclidean.threed.RotationConvention;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;

/**
 * 반복식 PnP (Perspective-n-Point).
 *
 * 파라미터 p = [rx, ry, rz, tx, ty, tz] (Rodrigues 회전 벡터 + 이동, mm).
 * 재투영 오차 Σ ||project(R·X + t) - x||² 를 Levenberg-Marquardt 로 최소화.
 * 초기값: 회전 0, 깊이는 눈꼬리 간 픽셀 거리로, x/y 는 코끝 위치로 추정.
 *
 * 상태 없음. 스레드 안전.
 */
public final class PnpSolver {

    private static final int    MAX_ITERATIONS  = 200;
    private static final int    MAX_EVALUATIONS = 2000;
    private static final double ROTATION_EPS    = 1e-12;
    /** 수렴 후 RMS 재투영 오차 허용치 (눈꼬리 간 픽셀 거리 대비 비율) */
    private static final double MAX_RMS_RATIO   = 0.25;

    /** PnP 해 */
    public static final class Solution {
        public final double[][] rotationMatrix;  // row-major 3x3
        public final Vector3D   translation;
        public final double     rms;             // px
        public final int        iterations;

        Solution(double[][] rotationMatrix, Vector3D translation, double rms, int iterations) {
            this.rotationMatrix = rotationMatrix;
            this.translation    = translation;
            this.rms            = rms;
            this.iterations     = iterations;
        }
    }

    /**
     * @param objectPoints 카메라 좌표계 3-D 모델 점
     * @param imagePoints  같은 순서의 2-D 관측점 (px)
     * @param camera       intrinsics
     * @param anchor       모델 원점(코끝)의 2-D 관측점 (초기 x/y 추정)
     * @param modelSpanMm  모델 기준 구간 길이 (mm)
     * @param imageSpanPx  같은 구간의 픽셀 거리 (초기 깊이 추정)
     * @throws PoseSolveException 미수렴, 비유한 해, 카메라 뒤쪽 해, 과대 오차
     */
    public Solution solve(Vector3D[] objectPoints, Point2[] imagePoints, CameraIntrinsics camera,
                          Point2 anchor, double modelSpanMm, double imageSpanPx) throws PoseSolveException {
        if (objectPoints.length != imagePoints.length || objectPoints.length < 4) {
            throw new PoseSolveException("대응점 수 부족: " + objectPoints.length + "/" + imagePoints.length);
        }
        if (!(imageSpanPx > 1e-3)) {
            throw new PoseSolveException("랜드마크 퇴화: 눈꼬리 간 거리 " + imageSpanPx);
        }

        double[] observed = new double[imagePoints.length * 2];
        for (int i = 0; i < imagePoints.length; i++) {
            observed[2 * i]     = imagePoints[i].x;
            observed[2 * i + 1] = imagePoints[i].y;
        }

        double tz = camera.fx * modelSpanMm / imageSpanPx;
        double tx = (anchor.x - camera.cx) * tz / camera.fx;
        double ty = (anchor.y - camera.cy) * tz / camera.fy;
        double[] start = {0, 0, 0, tx, ty, tz};

        LeastSquaresProblem problem = new LeastSquaresBuilder()
                .start(start)
                .model(reprojection(objectPoints, camera))
                .target(observed)
                .lazyEvaluation(false)
                .maxIterations(MAX_ITERATIONS)
                .maxEvaluations(MAX_EVALUATIONS)
                .build();

        LeastSquaresOptimizer.Optimum optimum;
        try {
            optimum = new LevenbergMarquardtOptimizer().optimize(problem);
        } catch (MathIllegalStateException e) {
            throw new PoseSolveException("PnP 미수렴: " + e.getMessage(), e);
        }

        double[] p = optimum.getPoint().toArray();
        for (double v : p) {
            if (!Double.isFinite(v)) throw new PoseSolveException("PnP 해가 유한하지 않음");
        }
        if (p[5] <= 0) {
            throw new PoseSolveException("PnP 해가 카메라 뒤쪽 (tz=" + p[5] + ")");
        }
        double rms = optimum.getRMS();
        if (!Double.isFinite(rms) || rms > MAX_RMS_RATIO * imageSpanPx) {
            throw new PoseSolveException(String.format("재투영 오차 과대: rms=%.2fpx", rms));
        }
        return new Solution(rotationMatrix(rotation(p)), new Vector3D(p[3], p[4], p[5]),
                rms, optimum.getIterations());
    }

    /** 투영값 + 중앙차분 Jacobian */
    private static MultivariateJacobianFunction reprojection(Vector3D[] objectPoints, CameraIntrinsics camera) {
        return point -> {
            double[] p = point.toArray();
            double[] value = project(p, objectPoints, camera);
            double[][] jacobian = new double[value.length][p.length];
            for (int j = 0; j < p.length; j++) {
                double h = 1e-6 * Math.max(1.0, Math.abs(p[j]));
                double[] plus = p.clone();
                double[] minus = p.clone();
                plus[j] += h;
                minus[j] -= h;
                double[] fPlus = project(plus, objectPoints, camera);
                double[] fMinus = project(minus, objectPoints, camera);
                for (int i = 0; i < value.length; i++) {
                    jacobian[i][j] = (fPlus[i] - fMinus[i]) / (2 * h);
                }
            }
            RealVector v = new ArrayRealVector(value, false);
            RealMatrix m = new Array2DRowRealMatrix(jacobian, false);
            return new Pair<>(v, m);
        };
    }

    static double[] project(double[] p, Vector3D[] objectPoints, CameraIntrinsics camera) {
        Rotation r = rotation(p);
        Vector3D t = new Vector3D(p[3], p[4], p[5]);
        double[] out = new double[objectPoints.length * 2];
        for (int i = 0; i < objectPoints.length; i++) {
            double[] uv = camera.project(r.applyTo(objectPoints[i]).add(t));
            out[2 * i]     = uv[0];
            out[2 * i + 1] = uv[1];
        }
        return out;
    }

    /** Rodrigues 회전 벡터 → Rotation */
    static Rotation rotation(double[] p) {
        Vector3D rvec = new Vector3D(p[0], p[1], p[2]);
        double theta = rvec.getNorm();
        if (theta < ROTATION_EPS) return Rotation.IDENTITY;
        return new Rotation(rvec.scalarMultiply(1.0 / theta), theta, RotationConvention.VECTOR_OPERATOR);
    }

    /** 기저 벡터를 회전시킨 결과를 열로 쌓아 행렬 구성 (R·e_j = j번째 열) */
    static double[][] rotationMatrix(Rotation r) {
        Vector3D[] cols = {r.applyTo(Vector3D.PLUS_I), r.applyTo(Vector3D.PLUS_J), r.applyTo(Vector3D.PLUS_K)};
        double[][] m = new double[3][3];
        for (int j = 0; j < 3; j++) {
            m[0][j] = cols[j].getX();
            m[1][j] = cols[j].getY();
            m[2][j] = cols[j].getZ();
        }
        return m;
    }
}
