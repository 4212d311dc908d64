package com.attendauth.sdk.api;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * 엔진 설정값.
 * AttendAuthEngine 생성 시 전달. 모든 값은 운영 초기값으로 설정되어 있음.
 *
 * ── 고정 계약 (변경 불가) ────────────────────────────────────────────────
 *   MATCH_DISTANCE_THRESHOLD : 0.6  (strict &lt;)
 *   confidence               : 1 - minDistance
 *
 * ── 조정 가능 ────────────────────────────────────────────────────────────
 *   earThreshold 0.25 / earConsecFrames 3 / headPoseThresholdDeg 15 / livenessThreshold 0.5
 */
public final class AttendAuthConfig {

    /** 매칭 거리 기준. 호출 단위로 바꿀 수 없는 고정 계약. */
    public static final double MATCH_DISTANCE_THRESHOLD = 0.6;

    // ── 임베딩 / 매칭 ────────────────────────────────────────────────────
    /** 임베딩 벡터 차원 (128) */
    public final int    embeddingDim;
    /** recognized 이지만 confidence 가 이 값 미만이면 LOW_CONFIDENCE (0.7) */
    public final double lowConfidenceThreshold;

    // ── Blink (EAR) ──────────────────────────────────────────────────────
    /** EAR closed 임계값 (0.25) */
    public final double earThreshold;
    /** blink 확정에 필요한 연속 low-EAR 프레임 수 (3) */
    public final int    earConsecFrames;
    /** EAR 히스토리 길이 (10) */
    public final int    earHistorySize;
    /** blink confidence 가 1.0 에 도달하는 blink 수 (3) */
    public final int    blinksForFullConfidence;

    // ── Head pose ────────────────────────────────────────────────────────
    /** movement 판정 각도 (deg) */
    public final double headPoseThresholdDeg;
    /** pose confidence 가 1.0 에 도달하는 평균 편차 (45deg) */
    public final double poseSaturationDeg;

    // ── Fusion ───────────────────────────────────────────────────────────
    /** 기본 liveness 임계값 (호출 시 지정하지 않으면 사용) */
    public final double livenessThreshold;
    public final double blinkWeight;
    public final double poseWeight;

    // ── Mask ─────────────────────────────────────────────────────────────
    /** 얼굴 하단 skin 비율이 이 값 미만이면 마스크 착용 (0.3) */
    public final double     maskSkinRatioThreshold;
    public final MaskPolicy maskPolicy;

    /** DEBUG 로그 출력 여부 */
    public final boolean debugLogging;

    private AttendAuthConfig(Builder b) {
        this.embeddingDim            = b.embeddingDim;
        this.lowConfidenceThreshold  = b.lowConfidenceThreshold;
        this.earThreshold            = b.earThreshold;
        this.earConsecFrames         = b.earConsecFrames;
        this.earHistorySize          = b.earHistorySize;
        this.blinksForFullConfidence = b.blinksForFullConfidence;
        this.headPoseThresholdDeg    = b.headPoseThresholdDeg;
        this.poseSaturationDeg       = b.poseSaturationDeg;
        this.livenessThreshold       = b.livenessThreshold;
        this.blinkWeight             = b.blinkWeight;
        this.poseWeight              = b.poseWeight;
        this.maskSkinRatioThreshold  = b.maskSkinRatioThreshold;
        this.maskPolicy              = b.maskPolicy;
        this.debugLogging            = b.debugLogging;
    }

    public static AttendAuthConfig defaults() { return builder().build(); }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        int        embeddingDim            = 128;
        double     lowConfidenceThreshold  = 0.7;
        double     earThreshold            = 0.25;
        int        earConsecFrames         = 3;
        int        earHistorySize          = 10;
        int        blinksForFullConfidence = 3;
        double     headPoseThresholdDeg    = 15.0;
        double     poseSaturationDeg       = 45.0;
        double     livenessThreshold       = 0.5;
        double     blinkWeight             = 0.6;
        double     poseWeight              = 0.4;
        double     maskSkinRatioThreshold  = 0.3;
        MaskPolicy maskPolicy              = MaskPolicy.IGNORE;
        boolean    debugLogging            = false;

        public Builder embeddingDim(int v)              { embeddingDim = v;            return this; }
        public Builder lowConfidenceThreshold(double v) { lowConfidenceThreshold = v;  return this; }
        public Builder earThreshold(double v)           { earThreshold = v;            return this; }
        public Builder earConsecFrames(int v)           { earConsecFrames = v;         return this; }
        public Builder earHistorySize(int v)            { earHistorySize = v;          return this; }
        public Builder blinksForFullConfidence(int v)   { blinksForFullConfidence = v; return this; }
        public Builder headPoseThresholdDeg(double v)   { headPoseThresholdDeg = v;    return this; }
        public Builder poseSaturationDeg(double v)      { poseSaturationDeg = v;       return this; }
        public Builder livenessThreshold(double v)      { livenessThreshold = v;       return this; }
        public Builder fusionWeights(double blink, double pose) {
            blinkWeight = blink; poseWeight = pose; return this;
        }
        public Builder maskSkinRatioThreshold(double v) { maskSkinRatioThreshold = v;  return this; }
        public Builder maskPolicy(MaskPolicy v)         { maskPolicy = v;              return this; }
        public Builder debugLogging(boolean v)          { debugLogging = v;            return this; }

        public AttendAuthConfig build() {
            checkArgument(embeddingDim > 0, "embeddingDim must be > 0: %s", embeddingDim);
            checkArgument(earConsecFrames > 0, "earConsecFrames must be > 0: %s", earConsecFrames);
            checkArgument(earHistorySize > 0, "earHistorySize must be > 0: %s", earHistorySize);
            checkArgument(blinksForFullConfidence > 0,
                    "blinksForFullConfidence must be > 0: %s", blinksForFullConfidence);
            checkArgument(poseSaturationDeg > 0, "poseSaturationDeg must be > 0: %s", poseSaturationDeg);
            checkArgument(headPoseThresholdDeg >= 0, "headPoseThresholdDeg must be >= 0: %s", headPoseThresholdDeg);
            checkArgument(blinkWeight >= 0 && poseWeight >= 0, "fusion weights must be >= 0");
            checkNotNull(maskPolicy, "maskPolicy");
            return new AttendAuthConfig(this);
        }
    }
}
