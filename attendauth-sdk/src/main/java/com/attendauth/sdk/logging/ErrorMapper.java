package com.attendauth.sdk.logging;

import com.attendauth.sdk.api.AttendAuthException;
import com.attendauth.sdk.api.ErrorCode;
import com.attendauth.sdk.landmark.LandmarkException;
import com.attendauth.sdk.pose.PoseSolveException;

/**
 * Throwable + context → ErrorCode.
 */
public final class ErrorMapper {

    private ErrorMapper() {}

    /**
     * @param t       예외
     * @param context 선택적 위치 (where), null 가능
     * @return 매핑된 ErrorCode
     */
    public static ErrorCode map(Throwable t, String context) {
        if (t instanceof AttendAuthException) {
            return ((AttendAuthException) t).getErrorCode();
        }
        if (t instanceof LandmarkException) return ErrorCode.MISSING_LANDMARKS;
        if (t instanceof PoseSolveException) return ErrorCode.POSE_SOLVE_FAIL;
        if (t instanceof ArithmeticException) return ErrorCode.INTERNAL;
        if (t.getCause() != null) return map(t.getCause(), context);
        return ErrorCode.UNKNOWN;
    }

    public static ErrorCode map(Throwable t) {
        return map(t, null);
    }
}
