package com.attendauth.sdk.quality;

import com.attendauth.sdk.api.AttendAuthConfig;
import com.attendauth.sdk.api.ErrorCode;
import com.attendauth.sdk.api.SignalStatus;
import com.attendauth.sdk.landmark.FaceRegion;
import com.attendauth.sdk.landmark.FrameSize;
import com.attendauth.sdk.logging.EngineErrorLogger;

/**
 * 피부색 비율 기반 마스크 착용 추정.
 *
 * 얼굴 영역 하단 절반을 HSV 로 변환 (H 0~180, S/V 0~255) 후
 * H∈[0,20], S∈[20,255], V∈[70,255] 인 픽셀 비율을 구한다.
 *   skinRatio &lt; 0.3 → 마스크 착용
 *   confidence = 착용 ? 1 - skinRatio : skinRatio
 *
 * 조명/피부톤에 민감한 휴리스틱. 분류기 입력이 아니라 정책 위반 플래그 용도.
 */
public final class MaskDetector {

    private static final int HUE_MAX = 20;
    private static final int SAT_MIN = 20;
    private static final int VAL_MIN = 70;

    private final double skinRatioThreshold;

    public MaskDetector(AttendAuthConfig config) {
        this.skinRatioThreshold = config.maskSkinRatioThreshold;
    }

    /**
     * @param argbPixels 프레임 전체 ARGB, row-major, stride = frame.width
     * @param frame      프레임 크기
     * @param region     얼굴 영역 (프레임 밖 부분은 잘라냄)
     */
    public MaskResult detect(int[] argbPixels, FrameSize frame, FaceRegion region) {
        if (argbPixels == null || frame == null || region == null
                || argbPixels.length < frame.width * frame.height) {
            EngineErrorLogger.degraded(ErrorCode.MASK_CHECK_FAIL, "MaskDetector.detect")
                    .message("픽셀 버퍼 또는 영역 없음")
                    .log();
            return MaskResult.degraded();
        }
        FaceRegion clipped = region.clipTo(frame);
        if (clipped.isEmpty()) {
            EngineErrorLogger.degraded(ErrorCode.MASK_CHECK_FAIL, "MaskDetector.detect")
                    .message("얼굴 영역이 프레임 밖")
                    .field("region", region.toString())
                    .log();
            return MaskResult.degraded();
        }

        int startY = clipped.top + clipped.height() / 2;
        int skin = 0;
        int count = 0;
        for (int y = startY; y < clipped.bottom; y++) {
            int row = y * frame.width;
            for (int x = clipped.left; x < clipped.right; x++) {
                if (isSkin(argbPixels[row + x])) skin++;
                count++;
            }
        }
        if (count == 0) return MaskResult.degraded();

        double skinRatio = skin / (double) count;
        boolean hasMask = skinRatio < skinRatioThreshold;
        double confidence = hasMask ? 1.0 - skinRatio : skinRatio;
        return new MaskResult(hasMask, confidence, skinRatio, SignalStatus.OK);
    }

    /** 8-bit HSV 범위 검사 (OpenCV 규약: H = deg / 2) */
    static boolean isSkin(int argb) {
        int r = (argb >> 16) & 0xFF;
        int g = (argb >> 8)  & 0xFF;
        int b =  argb        & 0xFF;

        int max = Math.max(r, Math.max(g, b));
        int min = Math.min(r, Math.min(g, b));
        if (max < VAL_MIN) return false;

        int delta = max - min;
        double sat = max == 0 ? 0 : 255.0 * delta / max;
        if (sat < SAT_MIN) return false;

        double hueDeg;
        if (delta == 0) {
            hueDeg = 0;
        } else if (max == r) {
            hueDeg = 60.0 * (g - b) / delta;
        } else if (max == g) {
            hueDeg = 120.0 + 60.0 * (b - r) / delta;
        } else {
            hueDeg = 240.0 + 60.0 * (r - g) / delta;
        }
        if (hueDeg < 0) hueDeg += 360.0;
        long hue = Math.round(hueDeg / 2.0);
        return hue <= HUE_MAX;
    }
}
