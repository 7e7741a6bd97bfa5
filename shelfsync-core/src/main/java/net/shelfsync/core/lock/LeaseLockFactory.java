package net.shelfsync.core.lock;

import net.shelfsync.core.service.RetryPolicy;
import net.shelfsync.core.spi.CoordinationStore;
import net.shelfsync.core.spi.TxRunner;

import java.time.Duration;
import java.util.List;

/** 워커 프로세스당 하나. 공용 의존성으로 락을 만든다. */
public final class LeaseLockFactory {
    public static final String RECORD_LOCK = "Record";
    public static final String TASK_LOCK = "Task";

    private final CoordinationStore store;
    private final TxRunner tx;
    private final Duration defaultTtl;
    private final RetryPolicy acquireRetry;

    public LeaseLockFactory(CoordinationStore store, TxRunner tx, Duration defaultTtl, Duration retryDelay) {
        this.store = store;
        this.tx = tx;
        this.defaultTtl = defaultTtl;
        this.acquireRetry = RetryPolicy.uniform(retryDelay);
    }

    public Duration defaultTtl() {
        return defaultTtl;
    }

    /** 리소스 락. token이 null이면 무작위 */
    public StoreLeaseLock resourceLock(String lockType, String resourceId, String token) {
        return new StoreLeaseLock(store, tx, lockType, List.of(resourceId), token, defaultTtl, acquireRetry);
    }

    public StoreLeaseLock lock(String lockType, List<String> name, String token, Duration ttl) {
        return new StoreLeaseLock(store, tx, lockType, name, token, ttl, acquireRetry);
    }

    /** 카탈로그 엔티티 단위 락. 어떤 페이지/컬렉션에서 왔든 같은 식별자면 같은 키 */
    public StoreLeaseLock recordLock(String identifier) {
        return new StoreLeaseLock(store, tx, RECORD_LOCK, List.of(identifier), null, defaultTtl, acquireRetry);
    }

    /** 태스크 계열 락. 루트 호출 id를 토큰으로 써서 재시도/연속 호출이 자기 리스를 연장할 수 있다 */
    public StoreLeaseLock taskLock(String taskName, String rootId) {
        return new StoreLeaseLock(store, tx, TASK_LOCK, List.of(taskName), rootId, defaultTtl, acquireRetry);
    }
}
