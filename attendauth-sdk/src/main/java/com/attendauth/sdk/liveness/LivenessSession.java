package com.attendauth.sdk.liveness;

/**
 * 진행 중인 liveness 검사 1건. 세션 id + 전용 BlinkTracker.
 * 첫 프레임에 생성, 검사 종료(accept / reject / timeout) 시 폐기.
 */
public final class LivenessSession {

    private final String       sessionId;
    private final BlinkTracker blinkTracker;
    private final long         createdAtNanos;
    private volatile long      lastFrameAtNanos;
    private volatile int       framesSeen;

    LivenessSession(String sessionId, BlinkTracker blinkTracker, long nowNanos) {
        this.sessionId        = sessionId;
        this.blinkTracker     = blinkTracker;
        this.createdAtNanos   = nowNanos;
        this.lastFrameAtNanos = nowNanos;
    }

    public String getSessionId() { return sessionId; }

    public BlinkTracker getBlinkTracker() { return blinkTracker; }

    public long getCreatedAtNanos() { return createdAtNanos; }

    public long getLastFrameAtNanos() { return lastFrameAtNanos; }

    public int getFramesSeen() { return framesSeen; }

    void touch(long nowNanos) {
        synchronized (blinkTracker) {
            lastFrameAtNanos = nowNanos;
            framesSeen++;
        }
    }
}
