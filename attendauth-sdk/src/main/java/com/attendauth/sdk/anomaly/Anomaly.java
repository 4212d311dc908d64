package com.attendauth.sdk.anomaly;

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * 이상 판정 1건. 알림 collaborator 가 그대로 저장/전송한다.
 * details: confidence, distance, liveness_score, has_mask, face_location (값이 있는 것만).
 */
public final class Anomaly {

    public final AnomalyCategory category;
    public final Severity        severity;
    public final String          identityId;   // nullable
    public final String          message;
    public final Map<String, Object> details;

    Anomaly(AnomalyCategory category, Severity severity, String identityId, Map<String, Object> details) {
        this.category   = category;
        this.severity   = severity;
        this.identityId = identityId;
        this.message    = "Anomaly detected: " + category.code();
        this.details    = ImmutableMap.copyOf(details);
    }

    @Override public String toString() {
        return "Anomaly{" + category.code() + "/" + severity.code() + ", details=" + details.keySet() + "}";
    }
}
