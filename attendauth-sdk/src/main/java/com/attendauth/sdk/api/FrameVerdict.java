package com.attendauth.sdk.api;

import com.attendauth.sdk.anomaly.Anomaly;
import com.attendauth.sdk.liveness.LivenessResult;
import com.attendauth.sdk.matcher.MatchResult;
import com.attendauth.sdk.quality.MaskResult;

import java.util.Optional;

/**
 * 프레임 1장 최종 판정.
 * decision == ACCEPT  → identityId 유효, 이상 없음
 * decision == ANOMALY → identityId 유효, 출석은 기록 가능하나 anomaly 알림 필요
 * decision == REJECT  → identity 없음 또는 spoof, 출석 기록 불가
 */
public final class FrameVerdict {

    public enum Decision { ACCEPT, ANOMALY, REJECT }

    public final Decision       decision;
    public final MatchResult    match;      // 얼굴 수 검사에서 끝났으면 null
    public final LivenessResult liveness;   // 미요청 / 미도달 시 null
    public final MaskResult     mask;       // 미요청 시 null
    private final Anomaly       anomaly;    // nullable

    FrameVerdict(Decision decision, MatchResult match, LivenessResult liveness,
                 MaskResult mask, Anomaly anomaly) {
        this.decision = decision;
        this.match    = match;
        this.liveness = liveness;
        this.mask     = mask;
        this.anomaly  = anomaly;
    }

    public Optional<Anomaly> getAnomaly() { return Optional.ofNullable(anomaly); }

    public String getIdentityId() { return match != null ? match.identityId : null; }

    @Override public String toString() {
        return "FrameVerdict{decision=" + decision
                + (match != null ? ", " + match : "")
                + (anomaly != null ? ", " + anomaly : "")
                + "}";
    }
}
