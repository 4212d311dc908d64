package com.attendauth.sdk.liveness;

import com.attendauth.sdk.landmark.LandmarkException;
import com.attendauth.sdk.landmark.LandmarkSet;
import com.attendauth.sdk.landmark.Point2;

/**
 * EAR(Eye Aspect Ratio) 계산.
 *
 *   EAR = (||p2-p6|| + ||p3-p5||) / (2 * ||p1-p4||)
 *   p1~p6: 눈 외곽 6개 랜드마크 (p1/p4 = 눈꼬리, p2,p3 = 위, p5,p6 = 아래)
 */
public final class EyeAspectRatio {

    private EyeAspectRatio() {}

    /**
     * 한쪽 눈 EAR.
     *
     * @throws LandmarkException 6점이 아니거나 눈 폭이 0 (수평 거리 퇴화)
     */
    public static double of(Point2[] eye) throws LandmarkException {
        if (eye == null || eye.length != LandmarkSet.EYE_POINTS) {
            throw new LandmarkException("눈 랜드마크는 6점이어야 함");
        }
        double a = eye[1].distanceTo(eye[5]);
        double b = eye[2].distanceTo(eye[4]);
        double c = eye[0].distanceTo(eye[3]);
        if (!(c > 0)) {
            throw new LandmarkException("눈 폭이 0, EAR 계산 불가");
        }
        double ear = (a + b) / (2.0 * c);
        if (!Double.isFinite(ear)) {
            throw new LandmarkException("EAR 비정상 값: " + ear);
        }
        return ear;
    }

    /** 양 눈 평균 EAR. 68점이 아니면 LandmarkException */
    public static double average(LandmarkSet landmarks) throws LandmarkException {
        landmarks.checkComplete();
        double left  = of(landmarks.leftEye());
        double right = of(landmarks.rightEye());
        return (left + right) / 2.0;
    }
}
