package net.shelfsync.core.lock;

import net.shelfsync.core.key.CoordinationKeys;
import net.shelfsync.core.service.RetryPolicy;
import net.shelfsync.core.spi.CoordinationStore;
import net.shelfsync.core.spi.TxRunner;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * CoordinationStore 위의 단일 키 리스 락.
 * 각 저장소 호출은 requiresNew로 즉시 커밋된다(바깥 트랜잭션과 무관하게 다른 워커에 보여야 함).
 */
public class StoreLeaseLock extends LeaseLock {
    private final CoordinationStore store;
    private final TxRunner tx;
    private final String key;
    private final Duration ttl;

    /**
     * @param lockType 키 네임스페이스 (예: "CollectionImport")
     * @param name     보호 대상 식별 (예: 컬렉션 id)
     * @param ttl      null이면 만료 없음(연장 불가)
     */
    public StoreLeaseLock(CoordinationStore store, TxRunner tx,
                          String lockType, List<String> name,
                          String token, Duration ttl, RetryPolicy acquireRetry) {
        super(token, acquireRetry);
        this.store = store;
        this.tx = tx;
        this.key = CoordinationKeys.of(lockType, name);
        this.ttl = ttl;
    }

    @Override
    public String key() {
        return key;
    }

    public Duration ttl() {
        return ttl;
    }

    @Override
    public LockResult acquire() throws Exception {
        Optional<String> previous = tx.requiresNew(() -> store.setIfAbsent(key, token, ttl));
        if (previous.isEmpty()) return LockResult.ACQUIRED;
        if (previous.get().equals(token)) {
            // 같은 논리 태스크의 재획득 → 연장
            if (ttl == null) return LockResult.EXTENDED;
            return extendTimeout() ? LockResult.EXTENDED : LockResult.FAILED;
        }
        return LockResult.FAILED;
    }

    @Override
    public boolean release() throws Exception {
        return tx.requiresNew(() -> store.compareAndDelete(key, token));
    }

    @Override
    public boolean extendTimeout() throws Exception {
        if (ttl == null) return false;
        return tx.requiresNew(() -> store.compareAndExpire(key, token, ttl));
    }

    @Override
    public boolean locked(boolean byUs) throws Exception {
        Optional<String> owner = tx.requiresNew(() -> store.get(key));
        if (byUs) return owner.map(token::equals).orElse(false);
        return owner.isPresent();
    }
}
