package com.attendauth.sdk.api;

/**
 * AttendAuth 표준 런타임 예외. errorCode + where(선택) + cause.
 */
public class AttendAuthException extends RuntimeException {

    private final ErrorCode errorCode;
    private final String where;   // nullable

    public AttendAuthException(ErrorCode errorCode, String message) {
        this(errorCode, message, (String) null);
    }

    public AttendAuthException(ErrorCode errorCode, String message, String where) {
        super(message);
        this.errorCode = errorCode;
        this.where = where;
    }

    public AttendAuthException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.where = null;
    }

    public ErrorCode getErrorCode() { return errorCode; }

    public String getWhere() { return where; }
}
