package com.attendauth.sdk.storage;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * 등록 인물 한 건 (identity id + 표시 이름 + 임베딩).
 * 영속화는 외부 collaborator 책임이며, 엔진은 bulkReload 로 스냅샷만 받는다.
 */
public final class IdentityRecord {
    public final String    identityId;
    public final String    displayName;
    public final Embedding embedding;
    public final boolean   active;
    public final long      enrolledAt;

    public IdentityRecord(String identityId, String displayName, Embedding embedding,
                          boolean active, long enrolledAt) {
        this.identityId  = checkNotNull(identityId, "identityId");
        this.displayName = displayName;
        this.embedding   = checkNotNull(embedding, "embedding");
        this.active      = active;
        this.enrolledAt  = enrolledAt;
    }

    public static IdentityRecord active(String identityId, String displayName, Embedding embedding) {
        return new IdentityRecord(identityId, displayName, embedding, true, System.currentTimeMillis());
    }

    @Override public String toString() {
        return "IdentityRecord{id=" + identityId + ", active=" + active + ", " + embedding + "}";
    }
}
