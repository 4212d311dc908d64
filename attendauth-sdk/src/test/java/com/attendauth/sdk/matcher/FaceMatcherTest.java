package com.attendauth.sdk.matcher;

import com.attendauth.sdk.api.InvalidEmbeddingException;
import com.attendauth.sdk.logging.LogCapture;
import com.attendauth.sdk.logging.SafeLogger;
import com.attendauth.sdk.storage.Embedding;
import com.attendauth.sdk.storage.EmbeddingStore;
import com.attendauth.sdk.storage.IdentityRecord;
import org.junit.Rule;
import org.junit.Test;

import static com.attendauth.sdk.storage.EmbeddingFixtures.DIM;
import static com.attendauth.sdk.storage.EmbeddingFixtures.filled;
import static com.attendauth.sdk.storage.EmbeddingFixtures.shifted;
import static org.junit.Assert.*;

/**
 * FaceMatcher 단위 테스트.
 * recognized ⇔ minDistance &lt; 0.6 (strict), confidence = 1 - minDistance
 */
public class FaceMatcherTest {

    @Rule public final LogCapture log = new LogCapture("FaceMatcher");

    // ── 동일 벡터: distance 0 → confidence 1.0 ───────────────────────
    @Test
    public void identicalEmbedding_confidenceIs1() {
        EmbeddingStore store = storeWith("A", filled(0.05));
        MatchResult r = new FaceMatcher(store).match(filled(0.05));

        assertTrue(r.recognized);
        assertEquals("A", r.identityId);
        assertEquals(1.0, r.confidence, 0.0);
        assertEquals(0.0, r.minDistance, 0.0);
    }

    // ── 거리 정확히 0.6 → 미인식 (strict) ─────────────────────────────
    @Test
    public void distanceExactlyThreshold_notRecognized() {
        Embedding base = filled(0.0);
        EmbeddingStore store = storeWith("A", base);
        MatchResult r = new FaceMatcher(store).match(shifted(base, 0, 0.6));

        assertFalse(r.recognized);
        assertEquals(MatchResult.Status.NO_MATCH, r.status);
        assertNull(r.identityId);
        assertEquals(0.0, r.confidence, 0.0);
        assertEquals(0.6, r.minDistance, 1e-12);
    }

    // ── 거리 0.599999 → 인식, confidence 0.400001 ─────────────────────
    @Test
    public void distanceJustBelowThreshold_recognized() {
        Embedding base = filled(0.0);
        EmbeddingStore store = storeWith("A", base);
        MatchResult r = new FaceMatcher(store).match(shifted(base, 0, 0.599999));

        assertTrue(r.recognized);
        assertEquals("A", r.identityId);
        assertEquals(0.400001, r.confidence, 1e-9);
    }

    // ── 빈 저장소 → 미인식, 예외 없음 ─────────────────────────────────
    @Test
    public void emptyStore_notRecognized() {
        MatchResult r = new FaceMatcher(new EmbeddingStore(DIM)).match(filled(0.1));

        assertFalse(r.recognized);
        assertEquals(MatchResult.Status.EMPTY_STORE, r.status);
        assertEquals(0.0, r.confidence, 0.0);
        assertTrue(Double.isInfinite(r.minDistance));
    }

    // ── 차원 불일치 → InvalidEmbeddingException ───────────────────────
    @Test(expected = InvalidEmbeddingException.class)
    public void wrongDimension_throws() {
        EmbeddingStore store = storeWith("A", filled(0.1));
        new FaceMatcher(store).match(filled(64, 0.1));
    }

    // ── 빈 저장소여도 차원 검사가 먼저 ────────────────────────────────
    @Test(expected = InvalidEmbeddingException.class)
    public void wrongDimension_emptyStore_stillThrows() {
        new FaceMatcher(new EmbeddingStore(DIM)).match(filled(127, 0.1));
    }

    // ── 가장 가까운 identity 선택 ─────────────────────────────────────
    @Test
    public void nearestIdentity_wins() {
        Embedding probe = filled(0.0);
        EmbeddingStore store = new EmbeddingStore(DIM);
        store.enroll(IdentityRecord.active("far", "Far", shifted(probe, 0, 0.5)));
        store.enroll(IdentityRecord.active("near", "Near", shifted(probe, 1, 0.1)));
        store.enroll(IdentityRecord.active("mid", "Mid", shifted(probe, 2, 0.3)));

        MatchResult r = new FaceMatcher(store).match(probe);

        assertEquals("near", r.identityId);
        assertEquals("Near", r.displayName);
        assertEquals(0.9, r.confidence, 1e-9);
    }

    // ── 동일 거리 → 먼저 등록된 identity ──────────────────────────────
    @Test
    public void tie_firstEnrolledWins() {
        Embedding probe = filled(0.0);
        EmbeddingStore store = new EmbeddingStore(DIM);
        store.enroll(IdentityRecord.active("first", "First", shifted(probe, 0, 0.2)));
        store.enroll(IdentityRecord.active("second", "Second", shifted(probe, 1, 0.2)));

        assertEquals("first", new FaceMatcher(store).match(probe).identityId);
    }

    // ── 모두 임계값 이상 → 미인식, minDistance 는 보고 ─────────────────
    @Test
    public void allFar_noMatchReportsMinDistance() {
        Embedding probe = filled(0.0);
        EmbeddingStore store = new EmbeddingStore(DIM);
        store.enroll(IdentityRecord.active("a", "A", shifted(probe, 0, 0.9)));
        store.enroll(IdentityRecord.active("b", "B", shifted(probe, 1, 0.7)));

        MatchResult r = new FaceMatcher(store).match(probe);

        assertFalse(r.recognized);
        assertEquals(0.7, r.minDistance, 1e-12);
    }

    // ── match 이벤트는 debug 로깅일 때만 ──────────────────────────────
    @Test
    public void debugOff_noMatchEvent() {
        SafeLogger.setDebugEnabled(false);
        new FaceMatcher(storeWith("emp-001", filled(0.05))).match(filled(0.05));

        assertTrue(log.messages().isEmpty());
    }

    @Test
    public void debugOn_matchEventWithMaskedId() {
        SafeLogger.setDebugEnabled(true);
        new FaceMatcher(storeWith("emp-001", filled(0.05))).match(filled(0.05));

        assertEquals(1, log.messages().size());
        String line = log.messages().get(0);
        assertTrue(line, line.contains("\"decision\":\"MATCH\""));
        assertTrue(line, line.contains("\"bestId\":\"em***\""));
        assertFalse(line, line.contains("emp-001"));
    }

    // ── 헬퍼 ──────────────────────────────────────────────────────────
    private static EmbeddingStore storeWith(String id, Embedding e) {
        EmbeddingStore store = new EmbeddingStore(DIM);
        store.enroll(IdentityRecord.active(id, id, e));
        return store;
    }
}
