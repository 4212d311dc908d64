package com.attendauth.sdk.api;

import com.attendauth.sdk.landmark.FaceRegion;
import com.attendauth.sdk.landmark.FrameSize;

import java.util.List;

/** 상위 얼굴 검출 capability. 엔진은 구현하지 않고 결과만 소비한다. */
public interface FaceDetectorPort {
    List<FaceRegion> detect(int[] argbPixels, FrameSize frame);
}
