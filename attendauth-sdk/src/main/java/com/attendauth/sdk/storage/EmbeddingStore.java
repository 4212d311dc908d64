package com.attendauth.sdk.storage;

import com.attendauth.sdk.api.InvalidEmbeddingException;
import com.attendauth.sdk.logging.SafeLogger;
import com.google.common.collect.ImmutableMap;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * identity id → 임베딩 인메모리 저장소.
 *
 * 읽기: lock-free, 항상 완성된 스냅샷 하나를 본다.
 * 쓰기(enroll / bulkReload): 새 스냅샷을 따로 만든 뒤 AtomicReference 로 한 번에 교체.
 * 매칭 중인 스레드는 이전 스냅샷 또는 새 스냅샷 중 하나만 관찰한다.
 */
public final class EmbeddingStore {

    private static final String TAG = "EmbeddingStore";

    private final int embeddingDim;
    private final AtomicReference<ImmutableMap<String, IdentityRecord>> snapshot =
            new AtomicReference<>(ImmutableMap.of());
    private final Object writeLock = new Object();

    public EmbeddingStore(int embeddingDim) {
        this.embeddingDim = embeddingDim;
    }

    public int embeddingDim() { return embeddingDim; }

    /** 현재 스냅샷 (불변, 등록 순서 유지) */
    public Map<String, IdentityRecord> snapshot() {
        return snapshot.get();
    }

    public int size() { return snapshot.get().size(); }

    public boolean isEmpty() { return snapshot.get().isEmpty(); }

    /**
     * 1명 등록(또는 교체). 기존 스냅샷 + 신규 레코드로 새 스냅샷을 만들어 교체.
     * 비활성 레코드면 해당 id 를 스냅샷에서 제거한다.
     */
    public void enroll(IdentityRecord record) {
        checkNotNull(record, "record");
        validate(record.embedding, "EmbeddingStore.enroll");
        synchronized (writeLock) {
            Map<String, IdentityRecord> next = new LinkedHashMap<>(snapshot.get());
            next.remove(record.identityId);
            if (record.active) next.put(record.identityId, record);
            snapshot.set(ImmutableMap.copyOf(next));
        }
        SafeLogger.i(TAG, "enroll id=" + SafeLogger.maskId(record.identityId) + " size=" + size());
    }

    /**
     * 전체 재구성. 활성 레코드만 모아 새 스냅샷을 만들고 교체.
     * 차원이 잘못된 레코드가 하나라도 있으면 기존 스냅샷을 유지하고 예외.
     */
    public void bulkReload(Collection<IdentityRecord> records) {
        checkNotNull(records, "records");
        Map<String, IdentityRecord> next = new LinkedHashMap<>();
        int skipped = 0;
        for (IdentityRecord r : records) {
            if (r == null || !r.active) {
                skipped++;
                continue;
            }
            validate(r.embedding, "EmbeddingStore.bulkReload");
            next.put(r.identityId, r);
        }
        ImmutableMap<String, IdentityRecord> built = ImmutableMap.copyOf(next);
        synchronized (writeLock) {
            snapshot.set(built);
        }
        SafeLogger.i(TAG, "bulkReload loaded=" + built.size() + " skipped=" + skipped);
    }

    /** id 제거 (비활성화). 없으면 false. */
    public boolean remove(String identityId) {
        synchronized (writeLock) {
            ImmutableMap<String, IdentityRecord> cur = snapshot.get();
            if (!cur.containsKey(identityId)) return false;
            Map<String, IdentityRecord> next = new LinkedHashMap<>(cur);
            next.remove(identityId);
            snapshot.set(ImmutableMap.copyOf(next));
            return true;
        }
    }

    void validate(Embedding embedding, String where) {
        if (embedding.dimension() != embeddingDim) {
            throw new InvalidEmbeddingException(embeddingDim, embedding.dimension(), where);
        }
    }
}
