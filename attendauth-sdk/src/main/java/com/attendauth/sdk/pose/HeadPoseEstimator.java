package com.attendauth.sdk.pose;

import com.attendauth.sdk.api.AttendAuthConfig;
import com.attendauth.sdk.api.ErrorCode;
import com.attendauth.sdk.landmark.FrameSize;
import com.attendauth.sdk.landmark.LandmarkException;
import com.attendauth.sdk.landmark.LandmarkSet;
import com.attendauth.sdk.landmark.Point2;
import com.attendauth.sdk.logging.EngineErrorLogger;
import com.attendauth.sdk.logging.SafeLogger;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * 랜드마크 6점 ↔ 일반 3-D 얼굴 모델 대응으로 head pose 추정.
 * 현재 프레임만의 함수 (상태 없음). 예외를 던지지 않는다.
 *
 *   movement   = |yaw| &gt; θ || |pitch| &gt; θ || |roll| &gt; θ
 *   confidence = min(1, (|yaw| + |pitch| + |roll|) / 3 / 45)
 */
public final class HeadPoseEstimator {

    private static final String TAG = "HeadPose";

    private final double movementThresholdDeg;
    private final double saturationDeg;
    private final PnpSolver solver;
    private final Vector3D[] modelPoints = FaceModel3d.cameraFramePoints();

    public HeadPoseEstimator(AttendAuthConfig config) {
        this(config, new PnpSolver());
    }

    HeadPoseEstimator(AttendAuthConfig config, PnpSolver solver) {
        this.movementThresholdDeg = config.headPoseThresholdDeg;
        this.saturationDeg        = config.poseSaturationDeg;
        this.solver               = checkNotNull(solver, "solver");
    }

    /**
     * @param landmarks 68점 (null 이면 UNAVAILABLE)
     * @param frame     프레임 크기 (intrinsics 근사)
     */
    public PoseEstimate estimate(LandmarkSet landmarks, FrameSize frame) {
        checkNotNull(frame, "frame");
        if (landmarks == null) {
            return PoseEstimate.unavailable();
        }

        EulerAngles angles;
        try {
            landmarks.checkComplete();
            int[] indices = FaceModel3d.LANDMARK_INDICES;
            Point2[] imagePoints = new Point2[indices.length];
            for (int i = 0; i < indices.length; i++) {
                imagePoints[i] = landmarks.require(indices[i]);
            }
            double eyeSpan = landmarks.require(LandmarkSet.LEFT_EYE_OUTER)
                    .distanceTo(landmarks.require(LandmarkSet.RIGHT_EYE_OUTER));

            PnpSolver.Solution solution = solver.solve(modelPoints, imagePoints,
                    CameraIntrinsics.approximate(frame), imagePoints[0],
                    FaceModel3d.OUTER_EYE_SPAN_MM, eyeSpan);
            angles = EulerAngles.fromRotationMatrix(solution.rotationMatrix).toDegrees();
            if (SafeLogger.isDebugEnabled()) {
                SafeLogger.v(TAG, String.format("pnp rms=%.3fpx iterations=%d", solution.rms, solution.iterations));
            }
        } catch (LandmarkException e) {
            EngineErrorLogger.degraded(ErrorCode.MISSING_LANDMARKS, "HeadPoseEstimator.estimate")
                    .cause(e)
                    .field("landmarkCount", landmarks.size())
                    .log();
            return PoseEstimate.degraded(ErrorCode.MISSING_LANDMARKS);
        } catch (PoseSolveException e) {
            EngineErrorLogger.degraded(ErrorCode.POSE_SOLVE_FAIL, "HeadPoseEstimator.estimate")
                    .cause(e)
                    .field("frame", frame.toString())
                    .log();
            return PoseEstimate.degraded(ErrorCode.POSE_SOLVE_FAIL);
        }

        return fromAngles(angles.yaw, angles.pitch, angles.roll);
    }

    /** 각도(deg) → movement / confidence */
    PoseEstimate fromAngles(double yaw, double pitch, double roll) {
        boolean movement = Math.abs(yaw) > movementThresholdDeg
                || Math.abs(pitch) > movementThresholdDeg
                || Math.abs(roll) > movementThresholdDeg;
        double variation = (Math.abs(yaw) + Math.abs(pitch) + Math.abs(roll)) / 3.0;
        double confidence = Math.min(1.0, variation / saturationDeg);
        return PoseEstimate.ok(yaw, pitch, roll, movement, confidence);
    }
}
