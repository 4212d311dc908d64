package com.attendauth.sdk.liveness;

import com.attendauth.sdk.api.AttendAuthConfig;
import com.attendauth.sdk.landmark.LandmarkSet;
import com.attendauth.sdk.logging.SafeLogger;
import com.google.common.base.Ticker;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * 세션 id 별 liveness 상태 레지스트리. 세션마다 독립 BlinkTracker.
 */
public final class LivenessSessions {

    private static final String TAG = "LivenessSessions";

    private final AttendAuthConfig config;
    private final Ticker ticker;
    private final ConcurrentMap<String, LivenessSession> sessions = new ConcurrentHashMap<>();

    public LivenessSessions(AttendAuthConfig config) {
        this(config, Ticker.systemTicker());
    }

    public LivenessSessions(AttendAuthConfig config, Ticker ticker) {
        this.config = checkNotNull(config, "config");
        this.ticker = checkNotNull(ticker, "ticker");
    }

    /** 세션 조회, 없으면 생성 (첫 프레임) */
    public LivenessSession getOrCreate(String sessionId) {
        checkArgument(sessionId != null && !sessionId.isEmpty(), "sessionId is required");
        return sessions.computeIfAbsent(sessionId, this::newSession);
    }

    private LivenessSession newSession(String id) {
        SafeLogger.d(TAG, "session created id=" + SafeLogger.maskId(id));
        return new LivenessSession(id, new BlinkTracker(config), ticker.read());
    }

    public Optional<LivenessSession> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    /**
     * 세션의 BlinkTracker 로 1프레임 처리.
     * touch 는 map 엔트리 갱신과 원자적. evictIdle 과 겹쳐도 프레임이 온 세션은 남는다.
     * 같은 세션에 대한 동시 호출은 tracker 락으로 직렬화된다.
     */
    public BlinkResult track(String sessionId, LandmarkSet landmarks) {
        checkArgument(sessionId != null && !sessionId.isEmpty(), "sessionId is required");
        LivenessSession session = sessions.compute(sessionId, (id, current) -> {
            LivenessSession s = current != null ? current : newSession(id);
            s.touch(ticker.read());
            return s;
        });
        return session.getBlinkTracker().track(landmarks);
    }

    /** 세션 상태 초기화 (세션은 유지) */
    public void reset(String sessionId) {
        LivenessSession session = sessions.get(sessionId);
        if (session != null) {
            session.getBlinkTracker().reset();
        }
    }

    /** 검사 종료: 세션 폐기 */
    public boolean end(String sessionId) {
        return sessions.remove(sessionId) != null;
    }

    /**
     * maxIdle 동안 프레임이 없던 세션 제거. 호출 주기는 호출자가 정한다.
     *
     * @return 제거된 세션 수
     */
    public int evictIdle(long maxIdle, TimeUnit unit) {
        long now = ticker.read();
        long limit = unit.toNanos(maxIdle);
        int removed = 0;
        for (String id : sessions.keySet()) {
            // 엔트리 락 안에서 다시 판정: 그 사이 프레임이 들어왔거나 재생성된 세션은 유지
            boolean[] evicted = {false};
            sessions.computeIfPresent(id, (key, session) -> {
                if (now - session.getLastFrameAtNanos() > limit) {
                    evicted[0] = true;
                    return null;
                }
                return session;
            });
            if (evicted[0]) removed++;
        }
        if (removed > 0) {
            SafeLogger.i(TAG, "evicted idle sessions=" + removed + " remaining=" + sessions.size());
        }
        return removed;
    }

    public int size() { return sessions.size(); }
}
