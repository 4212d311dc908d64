package com.attendauth.sdk.landmark;

/** 필요한 랜드마크 인덱스가 없거나 손상됨 (MissingLandmarks). */
public class LandmarkException extends Exception {
    public LandmarkException(String msg) { super(msg); }
    public LandmarkException(String msg, Throwable cause) { super(msg, cause); }
}
