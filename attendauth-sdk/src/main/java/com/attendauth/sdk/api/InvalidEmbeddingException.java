package com.attendauth.sdk.api;

/**
 * 임베딩 차원이 계약(기본 128)과 다를 때. 호출자에게 그대로 전파되는 유일한 프레임 오류.
 */
public class InvalidEmbeddingException extends AttendAuthException {

    private final int expectedDim;
    private final int actualDim;

    public InvalidEmbeddingException(int expectedDim, int actualDim, String where) {
        super(ErrorCode.INVALID_EMBEDDING,
                "임베딩 차원 불일치: expected=" + expectedDim + ", actual=" + actualDim, where);
        this.expectedDim = expectedDim;
        this.actualDim = actualDim;
    }

    public int getExpectedDim() { return expectedDim; }

    public int getActualDim() { return actualDim; }
}
