package net.shelfsync.core.upload;

import net.shelfsync.core.error.UploadSessionException;
import net.shelfsync.core.key.CoordinationKeys;
import net.shelfsync.core.lock.LeaseLock;
import net.shelfsync.core.lock.LockResult;
import net.shelfsync.core.model.GuardStatus;
import net.shelfsync.core.model.Guarded;
import net.shelfsync.core.model.SessionGuard;
import net.shelfsync.core.model.UploadPart;
import net.shelfsync.core.model.UploadRecord;
import net.shelfsync.core.model.UploadState;
import net.shelfsync.core.service.RetryPolicy;
import net.shelfsync.core.spi.TxRunner;
import net.shelfsync.core.spi.UploadSessionRepository;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * 내보내기 순회 하나의 업로드 세션. 세션 자체가 락이기도 하다.
 * 변경은 락을 쥔 상태에서, 마지막으로 본 update number가 저장소 값과 같을 때만 반영된다.
 */
public class UploadSession extends LeaseLock {
    private final UploadSessionRepository repo;
    private final TxRunner tx;
    private final String sessionId;
    private final String key;
    private final Duration lockTtl;
    private final Duration sessionTtl;

    private long updateNumber;

    public UploadSession(UploadSessionRepository repo, TxRunner tx, String sessionId,
                         String token, Duration lockTtl, Duration sessionTtl, RetryPolicy acquireRetry) {
        super(token, acquireRetry);
        this.repo = repo;
        this.tx = tx;
        this.sessionId = sessionId;
        this.key = CoordinationKeys.uploadSession(sessionId);
        this.lockTtl = lockTtl;
        this.sessionTtl = sessionTtl;
    }

    @Override
    public String key() {
        return key;
    }

    public String sessionId() {
        return sessionId;
    }

    /** 마지막으로 확인/반영한 update number */
    public long updateNumber() {
        return updateNumber;
    }

    @Override
    public LockResult acquire() throws Exception {
        return tx.requiresNew(() -> {
            LockResult r = repo.acquire(key, token, lockTtl, sessionTtl);
            if (r.held()) {
                updateNumber = repo.updateNumber(key).orElse(0L);
            }
            return r;
        });
    }

    @Override
    public boolean release() throws Exception {
        return tx.requiresNew(() -> repo.release(key, token));
    }

    @Override
    public boolean extendTimeout() throws Exception {
        return tx.requiresNew(() -> repo.extend(key, token, lockTtl));
    }

    @Override
    public boolean locked(boolean byUs) throws Exception {
        Optional<String> owner = tx.requiresNew(() -> repo.lockOwner(key));
        if (byUs) return owner.map(token::equals).orElse(false);
        return owner.isPresent();
    }

    /** 세션 전체 삭제. 락 소유자만 가능 */
    public boolean delete() throws Exception {
        return tx.requiresNew(() -> repo.delete(key, token));
    }

    public Optional<UploadState> state() throws Exception {
        return tx.requiresNew(() -> repo.state(key));
    }

    public Map<String, UploadRecord> get() throws Exception {
        return tx.requiresNew(() -> repo.get(key));
    }

    public Map<String, Integer> appendBuffers(Map<String, byte[]> data) throws Exception {
        if (data.isEmpty()) return Map.of();
        Guarded<Map<String, Integer>> r = tx.requiresNew(() -> repo.appendBuffers(key, guard(), data));
        check(r.status(), "append buffers");
        return r.value();
    }

    public void setUploadId(String outputKey, String uploadId) throws Exception {
        mutate("set upload ID", () -> repo.setUploadId(key, guard(), outputKey, uploadId));
    }

    public void addPartAndClearBuffer(String outputKey, UploadPart part) throws Exception {
        mutate("add part and clear buffer", () -> repo.addPartAndClearBuffer(key, guard(), outputKey, part));
    }

    public void clearUploads() throws Exception {
        mutate("clear uploads", () -> repo.clearUploads(key, guard()));
    }

    public void setState(UploadState state) throws Exception {
        mutate("set state", () -> repo.setState(key, guard(), state));
    }

    private SessionGuard guard() {
        return new SessionGuard(token, updateNumber, sessionTtl);
    }

    private void mutate(String what, Callable<GuardStatus> op) throws Exception {
        check(tx.requiresNew(op), what);
    }

    private void check(GuardStatus status, String what) {
        switch (status) {
            case APPLIED -> updateNumber++;
            case NOT_OWNER -> throw new UploadSessionException(
                    "Failed to " + what + ": Must hold lock on " + key, status);
            case STALE -> throw new UploadSessionException(
                    "Failed to " + what + ": Update number mismatch on " + key + " (expected " + updateNumber + ")", status);
        }
    }
}
