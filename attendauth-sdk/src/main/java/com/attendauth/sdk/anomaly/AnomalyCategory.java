package com.attendauth.sdk.anomaly;

/** 알림 collaborator 로 전달되는 이상 유형. code 는 외부 저장/전송용 문자열. */
public enum AnomalyCategory {
    SPOOF_ATTEMPT("spoof_attempt"),
    MULTIPLE_FACES("multiple_faces"),
    NO_FACE("no_face"),
    LOW_CONFIDENCE("low_confidence"),
    MASK_VIOLATION("mask_violation"),
    UNKNOWN_PERSON("unknown_person");

    private final String code;

    AnomalyCategory(String code) { this.code = code; }

    public String code() { return code; }
}
