package com.attendauth.sdk.pose;

import com.attendauth.sdk.landmark.LandmarkSet;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

/**
 * 일반 얼굴 3-D 모델 (mm, 인체 측정 근사값) 과 대응 2-D 랜드마크 인덱스.
 *
 * 원 좌표계는 y 위, z 카메라 방향이다. 솔버에는 카메라 좌표계(x 오른쪽, y 아래, z 전방)로
 * 변환해 넘긴다 (x 축 180° 회전 = y, z 부호 반전). 정면 얼굴이면 R ≈ I.
 */
public final class FaceModel3d {

    private FaceModel3d() {}

    /** 코끝, 턱, 왼눈 바깥, 오른눈 바깥, 왼 입꼬리, 오른 입꼬리 */
    static final double[][] MODEL_POINTS_MM = {
            {   0.0,    0.0,    0.0},
            {   0.0, -330.0,  -65.0},
            {-225.0,  170.0, -135.0},
            { 225.0,  170.0, -135.0},
            {-150.0, -150.0, -125.0},
            { 150.0, -150.0, -125.0},
    };

    /** MODEL_POINTS_MM 과 같은 순서의 68점 인덱스 */
    static final int[] LANDMARK_INDICES = {
            LandmarkSet.NOSE_TIP,
            LandmarkSet.CHIN,
            LandmarkSet.LEFT_EYE_OUTER,
            LandmarkSet.RIGHT_EYE_OUTER,
            LandmarkSet.MOUTH_LEFT,
            LandmarkSet.MOUTH_RIGHT,
    };

    /** 두 바깥 눈꼬리 간 거리 (mm). 초기 깊이 추정용. */
    static final double OUTER_EYE_SPAN_MM = 450.0;

    /** 카메라 좌표계 모델 점 */
    public static Vector3D[] cameraFramePoints() {
        Vector3D[] out = new Vector3D[MODEL_POINTS_MM.length];
        for (int i = 0; i < out.length; i++) {
            double[] p = MODEL_POINTS_MM[i];
            out[i] = new Vector3D(p[0], -p[1], -p[2]);
        }
        return out;
    }

    public static int[] landmarkIndices() {
        return LANDMARK_INDICES.clone();
    }
}
