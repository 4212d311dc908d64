package com.attendauth.sdk.api;

import com.attendauth.sdk.landmark.FaceRegion;
import com.attendauth.sdk.landmark.FrameSize;
import com.attendauth.sdk.storage.Embedding;

/** 상위 임베딩 생성 capability (얼굴 영역 → 128차원 벡터). */
public interface EmbeddingGeneratorPort {
    Embedding embed(int[] argbPixels, FrameSize frame, FaceRegion region);
}
