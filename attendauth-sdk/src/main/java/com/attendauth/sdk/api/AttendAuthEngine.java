package com.attendauth.sdk.api;

import com.attendauth.sdk.anomaly.Anomaly;
import com.attendauth.sdk.anomaly.AnomalyCategory;
import com.attendauth.sdk.anomaly.AnomalyClassifier;
import com.attendauth.sdk.landmark.FaceRegion;
import com.attendauth.sdk.landmark.FrameSize;
import com.attendauth.sdk.landmark.LandmarkSet;
import com.attendauth.sdk.liveness.BlinkResult;
import com.attendauth.sdk.liveness.LivenessFusion;
import com.attendauth.sdk.liveness.LivenessResult;
import com.attendauth.sdk.liveness.LivenessSessions;
import com.attendauth.sdk.logging.EngineErrorLogger;
import com.attendauth.sdk.logging.SafeLogger;
import com.attendauth.sdk.matcher.FaceMatcher;
import com.attendauth.sdk.matcher.MatchResult;
import com.attendauth.sdk.pose.HeadPoseEstimator;
import com.attendauth.sdk.pose.PoseEstimate;
import com.attendauth.sdk.quality.MaskDetector;
import com.attendauth.sdk.quality.MaskResult;
import com.attendauth.sdk.storage.Embedding;
import com.attendauth.sdk.storage.EmbeddingStore;
import com.attendauth.sdk.storage.IdentityRecord;
import com.google.common.base.Ticker;

import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * AttendAuth 엔진 Public Facade.
 *
 * <pre>
 * 생성:
 *   AttendAuthEngine engine = AttendAuthEngine.create(AttendAuthConfig.defaults());
 *
 * 등록:
 *   engine.enroll("emp-001", "홍길동", embedding);
 *
 * 프레임마다 (세션 = 카메라 스트림 또는 진행 중인 출석 시도 1건):
 *   FrameVerdict v = engine.evaluateFrame(FrameInput.builder()...build());
 *
 * 검사 종료 시:
 *   engine.endSession(sessionId);
 * </pre>
 *
 * 전역 싱글턴이 아니다. 프로세스에 여러 엔진을 둘 수 있고, liveness 상태는 세션 id 로 분리된다.
 * 모든 연산은 CPU 바운드 동기 호출이며 블로킹 I/O 가 없다.
 */
public final class AttendAuthEngine {

    private static final String TAG = "AttendAuthEngine";

    private final AttendAuthConfig  config;
    private final EmbeddingStore    store;
    private final FaceMatcher       matcher;
    private final LivenessSessions  sessions;
    private final HeadPoseEstimator poseEstimator;
    private final LivenessFusion    fusion;
    private final AnomalyClassifier classifier;
    private final MaskDetector      maskDetector;

    private AttendAuthEngine(AttendAuthConfig config, Ticker ticker) {
        this.config        = config;
        this.store         = new EmbeddingStore(config.embeddingDim);
        this.matcher       = new FaceMatcher(store);
        this.sessions      = new LivenessSessions(config, ticker);
        this.poseEstimator = new HeadPoseEstimator(config);
        this.fusion        = new LivenessFusion(config);
        this.classifier    = new AnomalyClassifier(config);
        this.maskDetector  = new MaskDetector(config);
    }

    public static AttendAuthEngine create(AttendAuthConfig config) {
        return create(config, Ticker.systemTicker());
    }

    /** 세션 idle 판정 시계를 주입할 때 (테스트) */
    public static AttendAuthEngine create(AttendAuthConfig config, Ticker ticker) {
        checkNotNull(config, "config");
        checkNotNull(ticker, "ticker");
        SafeLogger.setDebugEnabled(config.debugLogging);
        SafeLogger.i(TAG, "엔진 초기화 완료 (embeddingDim=" + config.embeddingDim
                + ", maskPolicy=" + config.maskPolicy + ")");
        return new AttendAuthEngine(config, ticker);
    }

    public AttendAuthConfig getConfig() { return config; }

    // ─────────────────────────────────────────────────────────────────────
    // Embedding Store
    // ─────────────────────────────────────────────────────────────────────

    /**
     * 1명 등록 (같은 id 가 있으면 교체). 스냅샷 교체 방식이라 진행 중인 match 에 영향 없음.
     *
     * @throws InvalidEmbeddingException 차원 불일치
     */
    public void enroll(String identityId, String displayName, Embedding embedding) {
        store.enroll(IdentityRecord.active(identityId, displayName, embedding));
    }

    /** 전체 재구성: 활성 레코드만 반영, 한 번에 교체. */
    public void bulkReload(Collection<IdentityRecord> records) {
        store.bulkReload(records);
    }

    /** 등록 해제. 없으면 false. */
    public boolean unenroll(String identityId) {
        return store.remove(identityId);
    }

    public int enrolledCount() { return store.size(); }

    // ─────────────────────────────────────────────────────────────────────
    // 매칭 / liveness
    // ─────────────────────────────────────────────────────────────────────

    /** @throws InvalidEmbeddingException 차원 불일치 */
    public MatchResult match(Embedding embedding) {
        return matcher.match(embedding);
    }

    public BlinkResult trackBlink(String sessionId, LandmarkSet landmarks) {
        return sessions.track(sessionId, landmarks);
    }

    /** 세션의 blink 상태 초기화 (세션은 유지) */
    public void resetSession(String sessionId) {
        sessions.reset(sessionId);
    }

    /** 검사 종료, 세션 폐기. 없으면 false. */
    public boolean endSession(String sessionId) {
        return sessions.end(sessionId);
    }

    /** maxIdle 동안 프레임이 없던 세션 제거. */
    public int evictIdleSessions(long maxIdle, TimeUnit unit) {
        return sessions.evictIdle(maxIdle, unit);
    }

    public int activeSessionCount() { return sessions.size(); }

    public PoseEstimate estimatePose(LandmarkSet landmarks, FrameSize frameSize) {
        return poseEstimator.estimate(landmarks, frameSize);
    }

    public LivenessResult checkLiveness(String sessionId, LandmarkSet landmarks, FrameSize frameSize) {
        return checkLiveness(sessionId, landmarks, frameSize, config.livenessThreshold);
    }

    /**
     * blink(세션 상태 갱신) + pose(현재 프레임) → 융합.
     * 내부 실패는 예외로 올리지 않고 "근거 부족" 결과 (live=false, score=0) 로 낮춘다.
     */
    public LivenessResult checkLiveness(String sessionId, LandmarkSet landmarks,
                                        FrameSize frameSize, double threshold) {
        checkArgument(sessionId != null && !sessionId.isEmpty(), "sessionId is required");
        checkNotNull(frameSize, "frameSize");
        BlinkResult blink;
        PoseEstimate pose;
        try {
            blink = sessions.track(sessionId, landmarks);
            pose  = poseEstimator.estimate(landmarks, frameSize);
        } catch (RuntimeException e) {
            EngineErrorLogger.failure(e, "AttendAuthEngine.checkLiveness")
                    .status(SignalStatus.DEGRADED)
                    .session(sessionId)
                    .log();
            blink = BlinkResult.degraded(ErrorCode.INTERNAL);
            pose  = PoseEstimate.degraded(ErrorCode.INTERNAL);
        }
        return fusion.fuse(blink, pose, threshold);
    }

    public MaskResult detectMask(int[] argbPixels, FrameSize frameSize, FaceRegion region) {
        return maskDetector.detect(argbPixels, frameSize, region);
    }

    /**
     * @param liveness null = liveness 검사 미요청
     * @param maskFlag null = 마스크 미검사
     */
    public Optional<Anomaly> classify(MatchResult match, LivenessResult liveness, Boolean maskFlag) {
        return classifier.classify(match, liveness, maskFlag, null);
    }

    // ─────────────────────────────────────────────────────────────────────
    // 프레임 파이프라인
    // ─────────────────────────────────────────────────────────────────────

    /**
     * 얼굴 수 검사 → 매칭 → (liveness) → (mask) → 이상 판정 → 최종 판정.
     *
     * @throws InvalidEmbeddingException 임베딩 차원 불일치 (호출자 계약 위반)
     */
    public FrameVerdict evaluateFrame(FrameInput input) {
        checkNotNull(input, "input");

        Optional<Anomaly> faceCountAnomaly = classifier.classifyFaceCount(input.faceCount);
        if (faceCountAnomaly.isPresent()) {
            return finish(null, null, null, faceCountAnomaly.get());
        }

        checkNotNull(input.embedding, "embedding is required when exactly one face is present");
        MatchResult match = matcher.match(input.embedding);

        LivenessResult liveness = null;
        if (input.livenessRequested) {
            double threshold = input.livenessThreshold != null
                    ? input.livenessThreshold : config.livenessThreshold;
            liveness = checkLiveness(input.sessionId, input.landmarks, input.frameSize, threshold);
        }

        MaskResult mask = null;
        Boolean hasMask = null;
        if (input.maskCheckRequested) {
            mask = maskDetector.detect(input.argbPixels, input.frameSize, input.faceRegion);
            if (mask.status == SignalStatus.OK) hasMask = mask.hasMask;
        }

        Anomaly anomaly = classifier.classify(match, liveness, hasMask, input.faceRegion).orElse(null);
        return finish(match, liveness, mask, anomaly);
    }

    private FrameVerdict finish(MatchResult match, LivenessResult liveness, MaskResult mask, Anomaly anomaly) {
        FrameVerdict.Decision decision = decide(anomaly);
        SafeLogger.i(TAG, String.format(
                "{\"event\":\"frame_verdict\",\"decision\":\"%s\",\"anomaly\":\"%s\",\"id\":\"%s\",\"confidence\":%.3f,\"live\":%s}",
                decision,
                anomaly != null ? anomaly.category.code() : "",
                match != null ? SafeLogger.maskId(match.identityId) : "",
                match != null ? match.confidence : 0.0,
                liveness != null ? String.valueOf(liveness.live) : "null"));
        return new FrameVerdict(decision, match, liveness, mask, anomaly);
    }

    /**
     * 이상 없음 → ACCEPT.
     * identity 가 있고 차단 사유가 아닌 이상 (LOW_CONFIDENCE, MASK_VIOLATION) → ANOMALY.
     * identity 없음 / 얼굴 수 이상 / spoof → REJECT.
     */
    static FrameVerdict.Decision decide(Anomaly anomaly) {
        if (anomaly == null) return FrameVerdict.Decision.ACCEPT;
        AnomalyCategory c = anomaly.category;
        if (c == AnomalyCategory.LOW_CONFIDENCE || c == AnomalyCategory.MASK_VIOLATION) {
            return FrameVerdict.Decision.ANOMALY;
        }
        return FrameVerdict.Decision.REJECT;
    }
}
