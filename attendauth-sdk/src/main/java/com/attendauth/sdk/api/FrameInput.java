package com.attendauth.sdk.api;

import com.attendauth.sdk.landmark.FaceRegion;
import com.attendauth.sdk.landmark.FrameSize;
import com.attendauth.sdk.landmark.LandmarkSet;
import com.attendauth.sdk.storage.Embedding;

/**
 * evaluateFrame 입력 (상위 capability 가 이미 계산한 값들).
 *
 * <pre>
 * FrameInput in = FrameInput.builder()
 *         .sessionId("cam-01:attempt-17")
 *         .frameSize(new FrameSize(640, 480))
 *         .faceRegion(region)
 *         .embedding(embedding)
 *         .landmarks(landmarks)
 *         .build();
 * </pre>
 */
public final class FrameInput {

    public final String      sessionId;          // liveness 요청 시 필수
    public final int         faceCount;
    public final FaceRegion  faceRegion;         // nullable
    public final Embedding   embedding;          // faceCount == 1 이면 필수
    public final LandmarkSet landmarks;          // nullable → liveness degraded
    public final FrameSize   frameSize;          // liveness / mask 요청 시 필수
    public final int[]       argbPixels;         // nullable, mask 검사용
    public final boolean     livenessRequested;
    public final boolean     maskCheckRequested;
    public final Double      livenessThreshold;  // null = config 기본값

    private FrameInput(Builder b) {
        this.sessionId          = b.sessionId;
        this.faceCount          = b.faceCount;
        this.faceRegion         = b.faceRegion;
        this.embedding          = b.embedding;
        this.landmarks          = b.landmarks;
        this.frameSize          = b.frameSize;
        this.argbPixels         = b.argbPixels;
        this.livenessRequested  = b.livenessRequested;
        this.maskCheckRequested = b.maskCheckRequested;
        this.livenessThreshold  = b.livenessThreshold;
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        String      sessionId;
        int         faceCount          = 1;
        FaceRegion  faceRegion;
        Embedding   embedding;
        LandmarkSet landmarks;
        FrameSize   frameSize;
        int[]       argbPixels;
        boolean     livenessRequested  = true;
        boolean     maskCheckRequested = false;
        Double      livenessThreshold;

        public Builder sessionId(String v)             { sessionId = v;          return this; }
        public Builder faceCount(int v)                { faceCount = v;          return this; }
        public Builder faceRegion(FaceRegion v)        { faceRegion = v;         return this; }
        public Builder embedding(Embedding v)          { embedding = v;          return this; }
        public Builder landmarks(LandmarkSet v)        { landmarks = v;          return this; }
        public Builder frameSize(FrameSize v)          { frameSize = v;          return this; }
        public Builder argbPixels(int[] v)             { argbPixels = v;         return this; }
        public Builder livenessRequested(boolean v)    { livenessRequested = v;  return this; }
        public Builder maskCheckRequested(boolean v)   { maskCheckRequested = v; return this; }
        public Builder livenessThreshold(double v)     { livenessThreshold = v;  return this; }

        public FrameInput build() { return new FrameInput(this); }
    }
}
