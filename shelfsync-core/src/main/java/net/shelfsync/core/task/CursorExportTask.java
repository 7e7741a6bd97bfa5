package net.shelfsync.core.task;

import net.shelfsync.core.error.RecordRejectedException;
import net.shelfsync.core.error.TransientFailureException;
import net.shelfsync.core.error.Transients;
import net.shelfsync.core.lock.LeaseLockFactory;
import net.shelfsync.core.lock.Outcome;
import net.shelfsync.core.lock.StoreLeaseLock;
import net.shelfsync.core.model.ApplyResult;
import net.shelfsync.core.model.CompletionEvent;
import net.shelfsync.core.model.CursorTaskArgs;
import net.shelfsync.core.model.FeedRecord;
import net.shelfsync.core.model.Page;
import net.shelfsync.core.model.PageSummary;
import net.shelfsync.core.model.UploadState;
import net.shelfsync.core.spi.Clock;
import net.shelfsync.core.spi.CompletionListener;
import net.shelfsync.core.spi.PageSource;
import net.shelfsync.core.spi.RecordSerializer;
import net.shelfsync.core.upload.UploadManager;
import net.shelfsync.core.upload.UploadSession;
import net.shelfsync.core.upload.UploadSessionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 피드 → 오브젝트 스토어 내보내기 태스크. 호출 한 번에 한 페이지, 마지막 페이지에서 complete.
 * 순회는 ExportLauncher가 만든 runId/updateNumber를 들고 시작한다.
 */
public final class CursorExportTask implements CursorTask {
    private static final Logger log = LoggerFactory.getLogger(CursorExportTask.class);

    public static final String DEFAULT_NAME = "cursor-export";
    public static final String EXPORT_RUN_LOCK = "ExportRun";

    private final PageSource source;
    private final RecordSerializer serializer;
    private final UploadSessionFactory uploads;
    private final LeaseLockFactory locks;
    private final CompletionListener listener;
    private final Clock clock;

    public CursorExportTask(PageSource source,
                            RecordSerializer serializer,
                            UploadSessionFactory uploads,
                            LeaseLockFactory locks,
                            CompletionListener listener,
                            Clock clock) {
        this.source = source;
        this.serializer = serializer;
        this.uploads = uploads;
        this.locks = locks;
        this.listener = listener != null ? listener : CompletionListener.none();
        this.clock = clock;
    }

    public static String sessionId(String resourceId, String runId) {
        return resourceId + ":" + runId;
    }

    /** 출력 오브젝트 키. 업데이트 번호는 페이지마다 바뀌므로 순회 동안 고정인 runId를 넣는다. 다른 순회의 결과를 덮어쓰지 않는다 */
    public static String objectKey(String resourceId, String runId, String outputKey) {
        return resourceId + "/" + runId + "/" + outputKey;
    }

    /** 리소스당 동시에 하나의 내보내기 순회만 허용 */
    public static StoreLeaseLock runLock(LeaseLockFactory locks, String resourceId, String runId,
                                         Duration ttl) {
        return locks.lock(EXPORT_RUN_LOCK, List.of(resourceId), runId, ttl);
    }

    /**
     * 페이지 하나를 세션에 반영한다.
     *
     * <p>세션 변경 이후에 일시 장애가 나면 세션 업데이트 번호가 이미 args와 어긋나므로 같은 인자로는
     * 이어갈 수 없다. 이 경우 세션을 abort하고 TransientFailureException을 던진다. 순회 락은 유지되고,
     * 재시도 호출은 세션이 새로 만들어진(INITIAL) 것을 보고 첫 페이지부터 다시 시작한다.
     */
    @Override
    public TaskResult run(CursorTaskArgs args, TaskContext ctx) throws Exception {
        Objects.requireNonNull(args.runId(), "export requires a runId (see ExportLauncher)");

        UploadSession session = uploads.session(sessionId(args.resourceId(), args.runId()), null);
        UploadManager uploader = uploads.manager(session);
        StoreLeaseLock runLock = runLock(locks, args.resourceId(), args.runId(), uploads.settings().sessionTtl());
        Exception[] abandoned = new Exception[1];

        Outcome<TaskResult> outcome;
        try {
            outcome = uploader.begin(result -> {
                if (!result.held()) {
                    // 이전 호출이 죽으며 남긴 락일 수 있음 → 큐가 백오프 후 재시도
                    throw new TransientFailureException("Upload session " + session.key() + " is locked by another invocation");
                }

                CursorTaskArgs current = args;
                UploadState state = session.state().orElse(UploadState.INITIAL);
                if (state == UploadState.INITIAL) {
                    // 런처가 QUEUED로 만든 세션이 없어졌다 (완료됐거나 이전 시도가 abort함)
                    if (ctx.attempt() > 1 && runLock.locked(true)) {
                        log.warn("Export {} run {} lost its upload session on an earlier attempt, restarting from the first page",
                                args.resourceId(), args.runId());
                        current = args.withCursor(null);
                    } else {
                        session.delete();
                        return Outcome.superseded("upload session " + session.key() + " no longer exists");
                    }
                } else if (args.updateNumber() != null && args.updateNumber() != session.updateNumber()) {
                    log.warn("Export {} superseded: update number {} != {} on {}",
                            args.resourceId(), args.updateNumber(), session.updateNumber(), session.key());
                    return Outcome.superseded("update number mismatch on " + session.key());
                }

                long before = session.updateNumber();
                try {
                    return Outcome.completed(processPage(current, ctx, uploader, runLock, state));
                } catch (TransientFailureException e) {
                    if (session.updateNumber() == before) throw e;
                    abandoned[0] = e;
                    return Outcome.failed(e.getMessage());
                }
            });
        } catch (Exception e) {
            if (!Transients.isTransient(e)) {
                // 세션은 begin()이 이미 abort/삭제함
                releaseQuietly(runLock, e);
            }
            throw e;
        }

        if (outcome.failed()) {
            throw new TransientFailureException("Export " + args.resourceId() + " run " + args.runId()
                    + " abandoned its upload session and will restart", abandoned[0]);
        }
        if (outcome instanceof Outcome.Superseded<TaskResult> s) {
            return TaskResult.superseded(s.reason());
        }
        return outcome.valueOrNull();
    }

    /** 재시도를 다 쓰고 FAILED가 되면 순회 락을 풀어 다시 시작할 수 있게 한다 */
    @Override
    public void onFailed(CursorTaskArgs args, TaskContext ctx, Exception error) throws Exception {
        if (args.runId() == null) return;
        StoreLeaseLock runLock = runLock(locks, args.resourceId(), args.runId(), uploads.settings().sessionTtl());
        if (runLock.release()) {
            log.warn("Export {} run {} failed, released its run lock", args.resourceId(), args.runId());
        }
    }

    private TaskResult processPage(CursorTaskArgs args, TaskContext ctx, UploadManager uploader,
                                   StoreLeaseLock runLock, UploadState state) throws Exception {
        UploadSession session = uploader.session();

        // 조회와 직렬화는 세션을 건드리지 않는다
        Page page = source.fetch(args.resourceId(), args.cursor());
        PageSummary summary = PageSummary.EMPTY;
        for (FeedRecord record : page.records()) {
            try {
                Map<String, byte[]> out = serializer.serialize(args.resourceId(), record);
                out.forEach((k, bytes) -> uploader.addRecord(objectKey(args.resourceId(), args.runId(), k), bytes));
                summary = summary.plus(ApplyResult.Status.APPLIED);
            } catch (RecordRejectedException e) {
                log.warn("Failed to serialize {}: {}", record.identifier(), e.getMessage());
                summary = summary.plus(ApplyResult.Status.FAILED);
            }
        }

        if (state != UploadState.UPLOADING) {
            session.setState(UploadState.UPLOADING);
        }

        if (page.last()) {
            Set<String> keys = uploader.complete();
            uploader.removeSession();
            runLock.release();
            log.info("Export {} run {} completed: {} object(s), processed={} failed={}",
                    args.resourceId(), args.runId(), keys.size(), summary.processed(), summary.failed());
            listener.onComplete(new CompletionEvent(ctx.taskName(), args.resourceId(), args.runId(),
                    args.startedAt(), clock.now(), true, null, keys));
            return TaskResult.done(summary);
        }

        if (!runLock.extendTimeout()) {
            log.warn("Export run lock {} was not extended (expired or taken over)", runLock.key());
        }
        uploader.sync();
        log.info("Export {} page cursor={} processed={} failed={} next={}",
                args.resourceId(), args.cursor(), summary.processed(), summary.failed(), page.nextCursor());
        return TaskResult.next(args.withCursor(page.nextCursor()).withUpdateNumber(session.updateNumber()), summary);
    }

    private static void releaseQuietly(StoreLeaseLock lock, Exception original) {
        try {
            lock.release();
        } catch (Exception e) {
            original.addSuppressed(e);
        }
    }
}
