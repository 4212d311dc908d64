package com.attendauth.sdk.logging;

import ch.qos.logback.classic.Level;
import com.attendauth.sdk.api.ErrorCode;
import com.attendauth.sdk.api.InvalidEmbeddingException;
import com.attendauth.sdk.api.SignalStatus;
import com.attendauth.sdk.landmark.LandmarkException;
import org.junit.Rule;
import org.junit.Test;

import static org.junit.Assert.*;

public class EngineErrorLoggerTest {

    @Rule public final LogCapture log = new LogCapture(EngineErrorLogger.TAG);

    // ── degraded 신호: status / where / 추가 필드 순서 고정 ──────────
    @Test
    public void degraded_rendersStatusAndFields() {
        String json = EngineErrorLogger.degraded(ErrorCode.MISSING_LANDMARKS, "BlinkTracker.track")
                .cause(new LandmarkException("랜드마크 개수 불일치: 48"))
                .field("landmarkCount", 48)
                .field("skipped", null)
                .log();

        assertEquals("{\"event\":\"engine_error\",\"errorCode\":\"MISSING_LANDMARKS\",\"status\":\"DEGRADED\","
                + "\"where\":\"BlinkTracker.track\",\"message\":\"랜드마크 개수 불일치: 48\",\"landmarkCount\":48}", json);
        assertEquals(1, log.messages().size());
        assertEquals(Level.WARN, log.levels().get(0));
    }

    // ── 세션 id 는 마스킹만 기록 ──────────────────────────────────────
    @Test
    public void session_isMasked() {
        String json = EngineErrorLogger.failure(new ArithmeticException("/ by zero"), "AttendAuthEngine.checkLiveness")
                .status(SignalStatus.DEGRADED)
                .session("camera-7")
                .log();

        assertTrue(json, json.contains("\"errorCode\":\"INTERNAL\""));
        assertTrue(json, json.contains("\"session\":\"ca***\""));
        assertFalse(json, json.contains("camera-7"));
        assertEquals(Level.ERROR, log.levels().get(0));
    }

    // ── 예외에 실린 where 가 호출 위치보다 우선 ───────────────────────
    @Test
    public void failure_prefersExceptionWhere() {
        String json = EngineErrorLogger.failure(new InvalidEmbeddingException(128, 64, "FaceMatcher.match"), "caller")
                .log();

        assertTrue(json, json.contains("\"errorCode\":\"INVALID_EMBEDDING\""));
        assertTrue(json, json.contains("\"where\":\"FaceMatcher.match\""));
        assertFalse(json, json.contains("\"status\""));
    }

    // ── 문자열 escape, 비유한 수치는 문자열로 ─────────────────────────
    @Test
    public void escapesQuotesAndNewlines_quotesNonFiniteNumbers() {
        String json = EngineErrorLogger.degraded(ErrorCode.POSE_SOLVE_FAIL, null)
                .message("say \"hi\"\nbye")
                .field("rms", Double.NaN)
                .field("converged", false)
                .log();

        assertEquals("{\"event\":\"engine_error\",\"errorCode\":\"POSE_SOLVE_FAIL\",\"status\":\"DEGRADED\","
                + "\"message\":\"say \\\"hi\\\" bye\",\"rms\":\"NaN\",\"converged\":false}", json);
    }

    @Test(expected = NullPointerException.class)
    public void missingErrorCode_rejected() {
        EngineErrorLogger.degraded(null, "x");
    }
}
