package net.shelfsync.core.task;

import net.shelfsync.core.lock.LeaseLockFactory;
import net.shelfsync.core.lock.LockOptions;
import net.shelfsync.core.lock.LockResult;
import net.shelfsync.core.lock.Outcome;
import net.shelfsync.core.lock.StoreLeaseLock;
import net.shelfsync.core.model.CursorTaskArgs;
import net.shelfsync.core.model.UploadState;
import net.shelfsync.core.spi.Clock;
import net.shelfsync.core.upload.UploadSession;
import net.shelfsync.core.upload.UploadSessionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.UUID;

/** 내보내기 순회 시작: 실행 락 확보 → 세션 생성(QUEUED) → 첫 호출 인자 반환 */
public final class ExportLauncher {
    private static final Logger log = LoggerFactory.getLogger(ExportLauncher.class);

    private final UploadSessionFactory uploads;
    private final LeaseLockFactory locks;
    private final Clock clock;

    public ExportLauncher(UploadSessionFactory uploads, LeaseLockFactory locks, Clock clock) {
        this.uploads = uploads;
        this.locks = locks;
        this.clock = clock;
    }

    /** @return 이미 같은 리소스를 내보내는 중이면 empty */
    public Optional<CursorTaskArgs> launch(String resourceId) throws Exception {
        String runId = UUID.randomUUID().toString();
        StoreLeaseLock runLock = CursorExportTask.runLock(locks, resourceId, runId, uploads.settings().sessionTtl());
        if (runLock.acquire() != LockResult.ACQUIRED) {
            log.info("Export of {} skipped, already processing", resourceId);
            return Optional.empty();
        }

        UploadSession session = uploads.session(CursorExportTask.sessionId(resourceId, runId), null);
        Outcome<Long> queued;
        try {
            queued = session.lock(LockOptions.nonBlocking(), result -> {
                if (!result.held()) return Outcome.failed("session " + session.key() + " is locked");
                session.setState(UploadState.QUEUED);
                return Outcome.completed(session.updateNumber());
            });
        } catch (Exception e) {
            runLock.release();
            throw e;
        }
        if (queued.failed()) {
            runLock.release();
            log.warn("Export of {} not started: {}", resourceId, queued);
            return Optional.empty();
        }

        log.info("Export of {} queued as run {}", resourceId, runId);
        return Optional.of(CursorTaskArgs.start(resourceId)
                .withRunId(runId)
                .withStartedAt(clock.now())
                .withUpdateNumber(queued.valueOrNull()));
    }
}
