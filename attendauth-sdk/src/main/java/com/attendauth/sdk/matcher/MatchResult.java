package com.attendauth.sdk.matcher;

/**
 * 매칭 결과.
 * recognized == true  → identityId, confidence 유효
 * recognized == false → identityId == null, confidence == 0
 */
public final class MatchResult {

    public enum Status { MATCHED, NO_MATCH, EMPTY_STORE }

    public final Status status;
    public final boolean recognized;
    public final String  identityId;     // nullable
    public final String  displayName;    // nullable
    public final double  confidence;     // 0.0 ~ 1.0
    public final double  minDistance;    // EMPTY_STORE 이면 +Inf

    private MatchResult(Status status, String identityId, String displayName,
                        double confidence, double minDistance) {
        this.status      = status;
        this.recognized  = status == Status.MATCHED;
        this.identityId  = identityId;
        this.displayName = displayName;
        this.confidence  = confidence;
        this.minDistance = minDistance;
    }

    public static MatchResult matched(String identityId, String displayName, double distance) {
        return new MatchResult(Status.MATCHED, identityId, displayName, 1.0 - distance, distance);
    }

    public static MatchResult noMatch(double minDistance) {
        return new MatchResult(Status.NO_MATCH, null, null, 0.0, minDistance);
    }

    public static MatchResult emptyStore() {
        return new MatchResult(Status.EMPTY_STORE, null, null, 0.0, Double.POSITIVE_INFINITY);
    }

    @Override public String toString() {
        return "MatchResult{status=" + status
                + (identityId != null ? ", id=" + identityId : "")
                + ", confidence=" + String.format("%.3f", confidence) + "}";
    }
}
