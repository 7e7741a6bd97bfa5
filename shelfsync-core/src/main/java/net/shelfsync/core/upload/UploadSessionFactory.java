package net.shelfsync.core.upload;

import net.shelfsync.core.service.RetryPolicy;
import net.shelfsync.core.spi.ObjectStorage;
import net.shelfsync.core.spi.TxRunner;
import net.shelfsync.core.spi.UploadSessionRepository;

import java.time.Duration;

public final class UploadSessionFactory {
    private final UploadSessionRepository repo;
    private final ObjectStorage storage;
    private final TxRunner tx;
    private final UploadSettings settings;
    private final RetryPolicy acquireRetry;

    public UploadSessionFactory(UploadSessionRepository repo, ObjectStorage storage, TxRunner tx,
                                UploadSettings settings, Duration retryDelay) {
        this.repo = repo;
        this.storage = storage;
        this.tx = tx;
        this.settings = settings;
        this.acquireRetry = RetryPolicy.uniform(retryDelay);
    }

    public UploadSettings settings() {
        return settings;
    }

    /** @param token null이면 무작위(호출마다 새 소유자) */
    public UploadSession session(String sessionId, String token) {
        return new UploadSession(repo, tx, sessionId, token, settings.lockTtl(), settings.sessionTtl(), acquireRetry);
    }

    public UploadManager manager(UploadSession session) {
        return new UploadManager(storage, session, settings);
    }
}
