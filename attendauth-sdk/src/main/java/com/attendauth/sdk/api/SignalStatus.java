package com.attendauth.sdk.api;

/**
 * 프레임 단위 신호 결과의 상태.
 * 0 신뢰도가 "실제로 신호가 약함"인지 "계산 실패"인지 호출자가 구분할 수 있게 한다.
 */
public enum SignalStatus {
    /** 정상 계산 */
    OK,
    /** 입력은 있었으나 계산 실패 (랜드마크 손상, PnP 미수렴 등) */
    DEGRADED,
    /** 입력 자체가 없음 (랜드마크 미제공) */
    UNAVAILABLE;

    /** 두 상태 중 더 나쁜 쪽 */
    public SignalStatus worst(SignalStatus other) {
        return other != null && other.ordinal() > ordinal() ? other : this;
    }
}
