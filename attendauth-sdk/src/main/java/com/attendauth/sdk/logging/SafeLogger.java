package com.attendauth.sdk.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * PII-safe 로거 (SLF4J 위임).
 * - identity id, embedding 원값 로그 출력 금지
 * - debugEnabled=false 이면 VERBOSE/DEBUG 출력 억제
 */
public final class SafeLogger {

    private static final String SDK_TAG_PREFIX = "AttendAuth.";
    private static final ConcurrentMap<String, Logger> LOGGERS = new ConcurrentHashMap<>();
    private static volatile boolean debugEnabled = false;  // AttendAuthEngine 생성 시 설정

    private SafeLogger() {}

    public static void setDebugEnabled(boolean enabled) {
        debugEnabled = enabled;
    }

    public static boolean isDebugEnabled() {
        return debugEnabled;
    }

    public static void v(String tag, String msg) {
        if (debugEnabled) logger(tag).trace(sanitize(msg));
    }

    public static void d(String tag, String msg) {
        if (debugEnabled) logger(tag).debug(sanitize(msg));
    }

    public static void i(String tag, String msg) {
        logger(tag).info(sanitize(msg));
    }

    public static void w(String tag, String msg) {
        logger(tag).warn(sanitize(msg));
    }

    public static void e(String tag, String msg) {
        logger(tag).error(sanitize(msg));
    }

    public static void e(String tag, String msg, Throwable t) {
        logger(tag).error(sanitize(msg), t);
    }

    /**
     * identity id 마스킹: 앞 2글자만 남김. 로그 상관관계용.
     */
    public static String maskId(String id) {
        if (id == null) return "(none)";
        if (id.length() <= 2) return "**";
        return id.substring(0, 2) + "***";
    }

    private static Logger logger(String tag) {
        return LOGGERS.computeIfAbsent(tag, t -> LoggerFactory.getLogger(SDK_TAG_PREFIX + t));
    }

    /**
     * 민감 정보 패턴 제거.
     * 수치 배열(embedding 출력) 패턴 마스킹: [0.123, -0.456, ...] → [EMBEDDING_MASKED]
     */
    static String sanitize(String msg) {
        if (msg == null) return "(null)";
        return msg.replaceAll("\\[-?\\d+\\.\\d+(,\\s*-?\\d+\\.\\d+)+]", "[EMBEDDING_MASKED]");
    }
}
