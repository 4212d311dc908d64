package com.attendauth.sdk.pose;

/** PnP 가 수렴하지 않았거나 해가 물리적으로 불가능함 (PoseSolveFailure). */
public class PoseSolveException extends Exception {
    public PoseSolveException(String msg) { super(msg); }
    public PoseSolveException(String msg, Throwable cause) { super(msg, cause); }
}
