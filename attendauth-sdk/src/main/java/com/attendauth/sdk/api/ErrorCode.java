package com.attendauth.sdk.api;

/**
 * 표준 오류 코드. engine_error 로그와 결과 객체의 degraded 사유에 사용.
 */
public enum ErrorCode {
    INVALID_EMBEDDING,
    MISSING_LANDMARKS,
    POSE_SOLVE_FAIL,
    MASK_CHECK_FAIL,
    INTERNAL,
    UNKNOWN
}
