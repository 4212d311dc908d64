package com.attendauth.sdk.api;

/** 마스크 착용 정책. MASK_VIOLATION 판정에만 사용. */
public enum MaskPolicy {
    IGNORE,        // 마스크 여부 무시 (기본)
    REQUIRE_MASK,  // 미착용 시 위반
    FORBID_MASK    // 착용 시 위반
}
