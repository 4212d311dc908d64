package com.attendauth.sdk.landmark;

import java.util.Arrays;
import java.util.List;

/**
 * 검출된 얼굴 영역 (top, right, bottom, left). 입력 전용, 엔진이 저장하지 않음.
 */
public final class FaceRegion {
    public final int top;
    public final int right;
    public final int bottom;
    public final int left;

    public FaceRegion(int top, int right, int bottom, int left) {
        this.top = top;
        this.right = right;
        this.bottom = bottom;
        this.left = left;
    }

    public int width()  { return right - left; }

    public int height() { return bottom - top; }

    public boolean isEmpty() { return width() <= 0 || height() <= 0; }

    /** 프레임 경계로 클리핑 */
    public FaceRegion clipTo(FrameSize frame) {
        return new FaceRegion(
                Math.max(0, top),
                Math.min(frame.width, right),
                Math.min(frame.height, bottom),
                Math.max(0, left));
    }

    /** anomaly detail payload 용 [top, right, bottom, left] */
    public List<Integer> toList() {
        return Arrays.asList(top, right, bottom, left);
    }

    @Override public String toString() {
        return "FaceRegion{" + top + "," + right + "," + bottom + "," + left + "}";
    }
}
