package com.attendauth.sdk.matcher;

import com.attendauth.sdk.api.AttendAuthConfig;
import com.attendauth.sdk.api.InvalidEmbeddingException;
import com.attendauth.sdk.logging.SafeLogger;
import com.attendauth.sdk.storage.Embedding;
import com.attendauth.sdk.storage.EmbeddingStore;
import com.attendauth.sdk.storage.IdentityRecord;

import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * 유클리드 거리 기반 최근접 이웃(Top-1) 매처.
 *
 *   distance   = ||probe - enrolled||₂
 *   통과 조건   : minDistance &lt; 0.6 (strict)
 *   confidence : 1 - minDistance  (확률이 아니라 거리의 단조 대리값)
 *
 * 상태 없음. 여러 세션에서 동시에 호출 가능.
 */
public final class FaceMatcher {

    private static final String TAG = "FaceMatcher";

    private final EmbeddingStore store;

    public FaceMatcher(EmbeddingStore store) {
        this.store = checkNotNull(store, "store");
    }

    /**
     * 프로브 임베딩과 저장소 전체 비교 → Top-1.
     *
     * @param probe 라이브 임베딩
     * @return MatchResult (저장소가 비어 있으면 EMPTY_STORE, confidence 0)
     * @throws InvalidEmbeddingException 차원이 저장소 차원과 다를 때
     */
    public MatchResult match(Embedding probe) {
        checkNotNull(probe, "probe");
        if (probe.dimension() != store.embeddingDim()) {
            throw new InvalidEmbeddingException(store.embeddingDim(), probe.dimension(), "FaceMatcher.match");
        }

        // 한 번 읽은 스냅샷으로만 비교 (도중 교체되어도 일관성 유지)
        Map<String, IdentityRecord> candidates = store.snapshot();
        if (candidates.isEmpty()) {
            SafeLogger.d(TAG, "{\"event\":\"match\",\"decision\":\"EMPTY_STORE\"}");
            return MatchResult.emptyStore();
        }

        IdentityRecord best = null;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (IdentityRecord candidate : candidates.values()) {
            double d = probe.distanceTo(candidate.embedding);
            // strict < : 동률이면 먼저 등록된 쪽 유지
            if (d < bestDistance) {
                bestDistance = d;
                best = candidate;
            }
        }

        boolean accepted = best != null && bestDistance < AttendAuthConfig.MATCH_DISTANCE_THRESHOLD;
        if (SafeLogger.isDebugEnabled()) {
            SafeLogger.d(TAG, String.format(
                    "{\"event\":\"match\",\"candidates\":%d,\"bestId\":\"%s\",\"minDistance\":%.4f,\"decision\":\"%s\"}",
                    candidates.size(), best != null ? SafeLogger.maskId(best.identityId) : "",
                    bestDistance, accepted ? "MATCH" : "NO_MATCH"));
        }

        if (!accepted) {
            return MatchResult.noMatch(bestDistance);
        }
        return MatchResult.matched(best.identityId, best.displayName, bestDistance);
    }
}
