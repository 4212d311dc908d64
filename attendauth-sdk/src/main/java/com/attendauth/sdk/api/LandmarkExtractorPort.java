package com.attendauth.sdk.api;

import com.attendauth.sdk.landmark.FaceRegion;
import com.attendauth.sdk.landmark.FrameSize;
import com.attendauth.sdk.landmark.LandmarkSet;

/** 상위 68점 랜드마크 추출 capability. 추출 불가 시 null 반환. */
public interface LandmarkExtractorPort {
    LandmarkSet extract(int[] argbPixels, FrameSize frame, FaceRegion region);
}
