package com.attendauth.sdk.anomaly;

import com.attendauth.sdk.api.AttendAuthConfig;
import com.attendauth.sdk.api.ErrorCode;
import com.attendauth.sdk.api.MaskPolicy;
import com.attendauth.sdk.landmark.FaceRegion;
import com.attendauth.sdk.liveness.BlinkResult;
import com.attendauth.sdk.liveness.LivenessFusion;
import com.attendauth.sdk.liveness.LivenessResult;
import com.attendauth.sdk.matcher.MatchResult;
import com.attendauth.sdk.pose.PoseEstimate;
import org.junit.Test;

import java.util.Arrays;
import java.util.Optional;

import static org.junit.Assert.*;

/**
 * AnomalyClassifier 테스트: 평가 순서와 고정 심각도.
 */
public class AnomalyClassifierTest {

    private static final LivenessFusion FUSION = new LivenessFusion(AttendAuthConfig.defaults());
    private static final LivenessResult LIVE = FUSION.fuse(
            BlinkResult.ok(true, 0.3, 1, 1.0 / 3.0), PoseEstimate.ok(0, 0, 0, false, 0), 0.5);
    private static final LivenessResult NOT_LIVE = FUSION.fuse(
            BlinkResult.degraded(ErrorCode.MISSING_LANDMARKS),
            PoseEstimate.degraded(ErrorCode.POSE_SOLVE_FAIL), 0.5);

    private final AnomalyClassifier classifier = new AnomalyClassifier(AttendAuthConfig.defaults());

    // ── 인식 + 높은 confidence + live → 이상 없음 ────────────────────
    @Test
    public void recognizedLiveConfident_noAnomaly() {
        assertFalse(classifier.classify(MatchResult.matched("A", "A", 0.1), LIVE, null, null).isPresent());
    }

    // ── 미인식은 live 여부와 무관하게 unknown_person ─────────────────
    @Test
    public void unrecognized_unknownPersonEvenIfLive() {
        Anomaly a = classifier.classify(MatchResult.noMatch(0.8), LIVE, null, null).get();

        assertEquals(AnomalyCategory.UNKNOWN_PERSON, a.category);
        assertEquals(Severity.MEDIUM, a.severity);
        assertNull(a.identityId);
        assertEquals("Anomaly detected: unknown_person", a.message);
    }

    @Test
    public void unrecognizedNotLive_stillUnknownPerson() {
        Anomaly a = classifier.classify(MatchResult.emptyStore(), NOT_LIVE, null, null).get();
        assertEquals(AnomalyCategory.UNKNOWN_PERSON, a.category);
        assertFalse("무한대 거리는 detail 에 넣지 않음", a.details.containsKey("distance"));
    }

    // ── confidence 0.65 < 0.7 → low_confidence (spoof 보다 우선) ───
    @Test
    public void lowConfidence_beatsSpoof() {
        Anomaly a = classifier.classify(MatchResult.matched("A", "A", 0.35), NOT_LIVE, null, null).get();

        assertEquals(AnomalyCategory.LOW_CONFIDENCE, a.category);
        assertEquals(Severity.MEDIUM, a.severity);
        assertEquals("A", a.identityId);
    }

    // ── confidence 0.71 → 낮은 것이 아님 ─────────────────────────────
    @Test
    public void confidenceAboveThreshold_notLow() {
        Optional<Anomaly> a = classifier.classify(MatchResult.matched("A", "A", 0.29), LIVE, null, null);
        assertFalse(a.isPresent());
    }

    // ── 인식 + not live → spoof_attempt / high ───────────────────────
    @Test
    public void recognizedNotLive_spoof() {
        Anomaly a = classifier.classify(MatchResult.matched("A", "A", 0.1), NOT_LIVE, null,
                new FaceRegion(10, 110, 130, 20)).get();

        assertEquals(AnomalyCategory.SPOOF_ATTEMPT, a.category);
        assertEquals(Severity.HIGH, a.severity);
        assertEquals(0.9, (Double) a.details.get("confidence"), 1e-9);
        assertEquals(0.0, (Double) a.details.get("liveness_score"), 0.0);
        assertEquals(Arrays.asList(10, 110, 130, 20), a.details.get("face_location"));
    }

    // ── liveness 미요청 → spoof 판정 안 함 ───────────────────────────
    @Test
    public void livenessNotRequested_noSpoof() {
        assertFalse(classifier.classify(MatchResult.matched("A", "A", 0.1), null, null, null).isPresent());
    }

    // ── 마스크 정책 ───────────────────────────────────────────────────
    @Test
    public void maskPolicy_ignore_neverViolates() {
        assertFalse(classifier.classify(MatchResult.matched("A", "A", 0.1), LIVE, true, null).isPresent());
    }

    @Test
    public void maskPolicy_require_noMaskViolates() {
        AnomalyClassifier c = new AnomalyClassifier(
                AttendAuthConfig.builder().maskPolicy(MaskPolicy.REQUIRE_MASK).build());

        Anomaly a = c.classify(MatchResult.matched("A", "A", 0.1), LIVE, false, null).get();
        assertEquals(AnomalyCategory.MASK_VIOLATION, a.category);
        assertEquals(Severity.LOW, a.severity);
        assertEquals(Boolean.FALSE, a.details.get("has_mask"));

        assertFalse(c.classify(MatchResult.matched("A", "A", 0.1), LIVE, true, null).isPresent());
        assertFalse("미검사면 위반 아님", c.classify(MatchResult.matched("A", "A", 0.1), LIVE, null, null).isPresent());
    }

    @Test
    public void maskPolicy_forbid_maskViolates() {
        AnomalyClassifier c = new AnomalyClassifier(
                AttendAuthConfig.builder().maskPolicy(MaskPolicy.FORBID_MASK).build());
        assertEquals(AnomalyCategory.MASK_VIOLATION,
                c.classify(MatchResult.matched("A", "A", 0.1), LIVE, true, null).get().category);
    }

    // ── spoof 가 마스크 위반보다 우선 ─────────────────────────────────
    @Test
    public void spoof_beatsMaskViolation() {
        AnomalyClassifier c = new AnomalyClassifier(
                AttendAuthConfig.builder().maskPolicy(MaskPolicy.FORBID_MASK).build());
        assertEquals(AnomalyCategory.SPOOF_ATTEMPT,
                c.classify(MatchResult.matched("A", "A", 0.1), NOT_LIVE, true, null).get().category);
    }

    // ── 얼굴 수 ───────────────────────────────────────────────────────
    @Test
    public void faceCount() {
        assertFalse(classifier.classifyFaceCount(1).isPresent());

        Anomaly none = classifier.classifyFaceCount(0).get();
        assertEquals(AnomalyCategory.NO_FACE, none.category);
        assertEquals(Severity.LOW, none.severity);

        Anomaly many = classifier.classifyFaceCount(3).get();
        assertEquals(AnomalyCategory.MULTIPLE_FACES, many.category);
        assertEquals(Severity.MEDIUM, many.severity);
        assertEquals(3, many.details.get("face_count"));
    }

    @Test
    public void codes_areStable() {
        assertEquals("spoof_attempt", AnomalyCategory.SPOOF_ATTEMPT.code());
        assertEquals("high", Severity.HIGH.code());
    }
}
