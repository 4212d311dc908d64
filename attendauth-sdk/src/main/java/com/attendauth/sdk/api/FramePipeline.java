package com.attendauth.sdk.api;

import com.attendauth.sdk.landmark.FaceRegion;
import com.attendauth.sdk.landmark.FrameSize;
import com.attendauth.sdk.landmark.LandmarkSet;
import com.attendauth.sdk.storage.Embedding;

import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * 상위 capability(검출 / 랜드마크 / 임베딩)를 프레임당 한 번씩 호출해 FrameInput 을 만들고
 * 엔진에 넘긴다. 여러 얼굴이 검출되면 첫 번째 얼굴 기준으로 판정하지 않고 MULTIPLE_FACES 로 끝난다.
 */
public final class FramePipeline {

    private final AttendAuthEngine       engine;
    private final FaceDetectorPort       detector;
    private final LandmarkExtractorPort  landmarkExtractor;
    private final EmbeddingGeneratorPort embeddingGenerator;

    public FramePipeline(AttendAuthEngine engine,
                         FaceDetectorPort detector,
                         LandmarkExtractorPort landmarkExtractor,
                         EmbeddingGeneratorPort embeddingGenerator) {
        this.engine             = checkNotNull(engine, "engine");
        this.detector           = checkNotNull(detector, "detector");
        this.landmarkExtractor  = checkNotNull(landmarkExtractor, "landmarkExtractor");
        this.embeddingGenerator = checkNotNull(embeddingGenerator, "embeddingGenerator");
    }

    /**
     * @param sessionId  liveness 세션 id
     * @param argbPixels 프레임 ARGB (row-major)
     * @param frame      프레임 크기
     * @param checkLiveness liveness 검사 여부
     * @param checkMask     마스크 검사 여부
     */
    public FrameVerdict process(String sessionId, int[] argbPixels, FrameSize frame,
                                boolean checkLiveness, boolean checkMask) {
        List<FaceRegion> faces = detector.detect(argbPixels, frame);
        int faceCount = faces == null ? 0 : faces.size();

        FrameInput.Builder input = FrameInput.builder()
                .sessionId(sessionId)
                .frameSize(frame)
                .argbPixels(argbPixels)
                .faceCount(faceCount)
                .livenessRequested(checkLiveness)
                .maskCheckRequested(checkMask);

        if (faceCount == 1) {
            FaceRegion region = faces.get(0);
            Embedding embedding = embeddingGenerator.embed(argbPixels, frame, region);
            LandmarkSet landmarks = checkLiveness
                    ? landmarkExtractor.extract(argbPixels, frame, region)
                    : null;
            input.faceRegion(region).embedding(embedding).landmarks(landmarks);
        }
        return engine.evaluateFrame(input.build());
    }
}
