package com.attendauth.sdk.anomaly;

import com.attendauth.sdk.api.AttendAuthConfig;
import com.attendauth.sdk.api.MaskPolicy;
import com.attendauth.sdk.landmark.FaceRegion;
import com.attendauth.sdk.liveness.LivenessResult;
import com.attendauth.sdk.matcher.MatchResult;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * 매칭 + liveness 결과 → 이상 유형 / 심각도.
 *
 * 평가 순서 (앞선 규칙이 우선):
 *   1. 미인식                              → UNKNOWN_PERSON / MEDIUM
 *   2. 인식 + confidence &lt; 0.7           → LOW_CONFIDENCE / MEDIUM
 *   3. 인식 + liveness 요청 + is_live=false → SPOOF_ATTEMPT  / HIGH
 *   4. 마스크 정책 위반                    → MASK_VIOLATION / LOW
 *   그 외 → 이상 없음
 *
 * 미인식 얼굴에는 spoof 규칙을 적용하지 않는다.
 */
public final class AnomalyClassifier {

    private final double     lowConfidenceThreshold;
    private final MaskPolicy maskPolicy;

    public AnomalyClassifier(AttendAuthConfig config) {
        this.lowConfidenceThreshold = config.lowConfidenceThreshold;
        this.maskPolicy             = config.maskPolicy;
    }

    /**
     * @param match    매칭 결과 (필수)
     * @param liveness liveness 결과. null = liveness 검사 미요청
     * @param hasMask  마스크 착용 여부. null = 미검사
     * @param region   detail payload 용 얼굴 영역 (nullable)
     */
    public Optional<Anomaly> classify(MatchResult match, LivenessResult liveness,
                                      Boolean hasMask, FaceRegion region) {
        checkNotNull(match, "match");

        AnomalyCategory category = null;
        if (!match.recognized) {
            category = AnomalyCategory.UNKNOWN_PERSON;
        } else if (match.confidence < lowConfidenceThreshold) {
            category = AnomalyCategory.LOW_CONFIDENCE;
        } else if (liveness != null && !liveness.live) {
            category = AnomalyCategory.SPOOF_ATTEMPT;
        } else if (violatesMaskPolicy(hasMask)) {
            category = AnomalyCategory.MASK_VIOLATION;
        }
        if (category == null) {
            return Optional.empty();
        }
        return Optional.of(new Anomaly(category, severityOf(category), match.identityId,
                details(match, liveness, hasMask, region)));
    }

    /**
     * 프레임 단위 사전 검사: 얼굴 수.
     *   0  → NO_FACE / LOW
     *   2+ → MULTIPLE_FACES / MEDIUM
     */
    public Optional<Anomaly> classifyFaceCount(int faceCount) {
        if (faceCount == 1) return Optional.empty();
        AnomalyCategory category = faceCount <= 0 ? AnomalyCategory.NO_FACE : AnomalyCategory.MULTIPLE_FACES;
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("face_count", Math.max(0, faceCount));
        return Optional.of(new Anomaly(category, severityOf(category), null, details));
    }

    /** 고정 심각도 표 */
    static Severity severityOf(AnomalyCategory category) {
        switch (category) {
            case SPOOF_ATTEMPT:
                return Severity.HIGH;
            case UNKNOWN_PERSON:
            case LOW_CONFIDENCE:
            case MULTIPLE_FACES:
                return Severity.MEDIUM;
            case NO_FACE:
            case MASK_VIOLATION:
            default:
                return Severity.LOW;
        }
    }

    private boolean violatesMaskPolicy(Boolean hasMask) {
        if (hasMask == null) return false;
        switch (maskPolicy) {
            case REQUIRE_MASK:
                return !hasMask;
            case FORBID_MASK:
                return hasMask;
            case IGNORE:
            default:
                return false;
        }
    }

    private static Map<String, Object> details(MatchResult match, LivenessResult liveness,
                                               Boolean hasMask, FaceRegion region) {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put("confidence", match.confidence);
        if (Double.isFinite(match.minDistance)) d.put("distance", match.minDistance);
        if (liveness != null) d.put("liveness_score", liveness.livenessScore);
        if (hasMask != null) d.put("has_mask", hasMask);
        if (region != null) d.put("face_location", region.toList());
        return d;
    }
}
