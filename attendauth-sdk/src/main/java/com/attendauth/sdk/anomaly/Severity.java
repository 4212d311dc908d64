package com.attendauth.sdk.anomaly;

public enum Severity {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String code;

    Severity(String code) { this.code = code; }

    public String code() { return code; }
}
