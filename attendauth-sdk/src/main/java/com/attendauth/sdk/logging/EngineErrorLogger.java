package com.attendauth.sdk.logging;

import com.attendauth.sdk.api.AttendAuthException;
import com.attendauth.sdk.api.ErrorCode;
import com.attendauth.sdk.api.SignalStatus;
import com.google.common.base.Joiner;
import com.google.common.escape.Escaper;
import com.google.common.escape.Escapers;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * engine_error 단일 라인 JSON 이벤트.
 *
 *   {"event":"engine_error","errorCode":"MISSING_LANDMARKS","status":"DEGRADED",
 *    "where":"BlinkTracker.track","session":"ca***","message":"...", 추가 필드...}
 *
 * errorCode / status 는 같은 프레임의 결과 객체 (reason / status) 와 같은 값.
 * 세션 id 는 마스킹해서만 싣는다. 예외는 삼키지 않는다 (호출자가 degraded 결과로 낮추거나 재전파).
 *
 * 사용:
 *   EngineErrorLogger.degraded(ErrorCode.MISSING_LANDMARKS, "BlinkTracker.track")
 *           .cause(e).field("landmarkCount", 48).log();
 */
public final class EngineErrorLogger {

    static final String TAG = "EngineError";
    private static final String EVENT = "engine_error";

    private static final Escaper JSON_STRING = Escapers.builder()
            .addEscape('\\', "\\\\")
            .addEscape('"', "\\\"")
            .addEscape('\n', " ")
            .addEscape('\r', " ")
            .addEscape('\t', " ")
            .build();

    private EngineErrorLogger() {}

    /** 입력은 있었으나 신호 계산 실패: status=DEGRADED */
    public static Event degraded(ErrorCode reason, String where) {
        return new Event(reason, where).status(SignalStatus.DEGRADED);
    }

    /** 예외 기반: ErrorMapper 로 코드 결정, AttendAuthException 의 where 가 우선 */
    public static Event failure(Throwable t, String where) {
        checkNotNull(t, "t");
        String w = where;
        if (t instanceof AttendAuthException && ((AttendAuthException) t).getWhere() != null) {
            w = ((AttendAuthException) t).getWhere();
        }
        return new Event(ErrorMapper.map(t, where), w).cause(t);
    }

    /** engine_error 1건 */
    public static final class Event {

        private final ErrorCode errorCode;
        private final String where;
        private SignalStatus status;
        private String session;
        private String message = "";
        private final Map<String, Object> fields = new LinkedHashMap<>();

        private Event(ErrorCode errorCode, String where) {
            this.errorCode = checkNotNull(errorCode, "errorCode");
            this.where = where;
        }

        public Event status(SignalStatus status) {
            this.status = status;
            return this;
        }

        /** 원본 id 는 보관하지 않는다 */
        public Event session(String sessionId) {
            this.session = sessionId != null ? SafeLogger.maskId(sessionId) : null;
            return this;
        }

        public Event message(String message) {
            this.message = message != null ? message : "";
            return this;
        }

        public Event cause(Throwable t) {
            return message(t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName());
        }

        /** null 값은 생략 */
        public Event field(String key, Object value) {
            if (value != null) fields.put(key, value);
            return this;
        }

        /**
         * INTERNAL / UNKNOWN → ERROR, 그 외 (프레임 단위 복구 가능) → WARN.
         *
         * @return 기록한 JSON 라인
         */
        public String log() {
            String json = toJson();
            if (errorCode == ErrorCode.INTERNAL || errorCode == ErrorCode.UNKNOWN) {
                SafeLogger.e(TAG, json);
            } else {
                SafeLogger.w(TAG, json);
            }
            return json;
        }

        String toJson() {
            List<String> pairs = new ArrayList<>();
            pairs.add(pair("event", EVENT));
            pairs.add(pair("errorCode", errorCode.name()));
            if (status != null) pairs.add(pair("status", status.name()));
            if (where != null) pairs.add(pair("where", where));
            if (session != null) pairs.add(pair("session", session));
            pairs.add(pair("message", message));
            for (Map.Entry<String, Object> e : fields.entrySet()) {
                pairs.add(pair(e.getKey(), e.getValue()));
            }
            return "{" + Joiner.on(',').join(pairs) + "}";
        }
    }

    private static String pair(String key, Object value) {
        String v = value instanceof Boolean || value instanceof Number && isFinite((Number) value)
                ? String.valueOf(value)
                : "\"" + JSON_STRING.escape(String.valueOf(value)) + "\"";
        return "\"" + JSON_STRING.escape(key) + "\":" + v;
    }

    /** NaN / Infinity 는 JSON 숫자가 아니므로 문자열로 */
    private static boolean isFinite(Number n) {
        return !(n instanceof Double || n instanceof Float) || Double.isFinite(n.doubleValue());
    }
}
