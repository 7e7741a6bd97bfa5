package net.shelfsync.core.task;

import net.shelfsync.core.error.RecordRejectedException;
import net.shelfsync.core.error.TransientFailureException;
import net.shelfsync.core.key.CoordinationKeys;
import net.shelfsync.core.lock.LeaseLockFactory;
import net.shelfsync.core.lock.LockOptions;
import net.shelfsync.core.lock.Outcome;
import net.shelfsync.core.lock.StoreLeaseLock;
import net.shelfsync.core.model.ApplyResult;
import net.shelfsync.core.model.CompletionEvent;
import net.shelfsync.core.model.CursorTaskArgs;
import net.shelfsync.core.model.FeedRecord;
import net.shelfsync.core.model.Page;
import net.shelfsync.core.model.PageSummary;
import net.shelfsync.core.spi.ApplyCollaborator;
import net.shelfsync.core.spi.Clock;
import net.shelfsync.core.spi.CompletionListener;
import net.shelfsync.core.spi.IdentifierSetRepository;
import net.shelfsync.core.spi.PageSource;
import net.shelfsync.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 피드 → 카탈로그 반영 태스크. 호출 한 번에 한 페이지.
 *
 * <ul>
 *   <li>리소스 락(토큰 = runId)을 논블로킹으로 잡는다. 못 잡으면 Skipped.</li>
 *   <li>레코드마다 식별자 락 안에서 ApplyCollaborator 호출.</li>
 *   <li>다음 커서가 있고 (unchanged를 못 만났거나 끝까지 순회 요청)이면 Continue.</li>
 * </ul>
 */
public final class CursorImportTask implements CursorTask {
    private static final Logger log = LoggerFactory.getLogger(CursorImportTask.class);

    public static final String DEFAULT_NAME = "cursor-import";
    public static final String DEFAULT_LOCK_TYPE = "CollectionImport";

    private final String lockType;
    private final PageSource source;
    private final ApplyCollaborator applier;
    private final LeaseLockFactory locks;
    private final IdentifierSetRepository identifiers;
    private final TxRunner tx;
    private final CompletionListener listener;
    private final Clock clock;
    private final Duration recordLockTimeout;

    public CursorImportTask(String lockType,
                            PageSource source,
                            ApplyCollaborator applier,
                            LeaseLockFactory locks,
                            IdentifierSetRepository identifiers,
                            TxRunner tx,
                            CompletionListener listener,
                            Clock clock,
                            Duration recordLockTimeout) {
        this.lockType = lockType;
        this.source = source;
        this.applier = applier;
        this.locks = locks;
        this.identifiers = identifiers;
        this.tx = tx;
        this.listener = listener != null ? listener : CompletionListener.none();
        this.clock = clock;
        this.recordLockTimeout = recordLockTimeout;
    }

    @Override
    public TaskResult run(CursorTaskArgs in, TaskContext ctx) throws Exception {
        CursorTaskArgs args = in;
        if (args.runId() == null) args = args.withRunId(ctx.rootId());
        if (args.startedAt() == null) args = args.withStartedAt(clock.now());
        final CursorTaskArgs current = args;

        StoreLeaseLock lock = locks.resourceLock(lockType, current.resourceId(), current.runId());
        Outcome<TaskResult> outcome = lock.lock(LockOptions.nonBlocking(), result -> {
            if (!result.held()) {
                log.info("{} {} skipped, another task is already processing it", lockType, current.resourceId());
                return Outcome.completed(TaskResult.skipped("locked: " + lock.key()));
            }
            return Outcome.completed(processPage(current, ctx));
        });
        return outcome.valueOrNull();
    }

    private TaskResult processPage(CursorTaskArgs args, TaskContext ctx) throws Exception {
        Page page = source.fetch(args.resourceId(), args.cursor());

        PageSummary summary = PageSummary.EMPTY;
        for (FeedRecord record : page.records()) {
            summary = summary.plus(applyOne(record).status());
        }

        String setKey = null;
        if (args.collectIdentifiers()) {
            setKey = CoordinationKeys.identifierSet(args.resourceId(), args.runId());
            if (!page.records().isEmpty()) {
                List<String> ids = new ArrayList<>(page.records().size());
                for (FeedRecord r : page.records()) ids.add(r.identifier());
                final String key = setKey;
                tx.required(() -> identifiers.add(key, ids));
            }
        }

        boolean more = !page.last() && (!summary.foundUnchanged() || args.exhaustive());
        log.info("{} {} page cursor={} processed={} applied={} unchanged={} failed={} next={}",
                lockType, args.resourceId(), args.cursor(), summary.processed(), summary.applied(),
                summary.unchanged(), summary.failed(), more ? page.nextCursor() : "-");

        if (more) {
            return TaskResult.next(args.withCursor(page.nextCursor()), summary);
        }

        listener.onComplete(new CompletionEvent(ctx.taskName(), args.resourceId(), args.runId(),
                args.startedAt(), clock.now(), page.last(), setKey, Set.of()));
        return TaskResult.done(summary);
    }

    private ApplyResult applyOne(FeedRecord record) throws Exception {
        StoreLeaseLock recordLock = locks.recordLock(record.identifier());
        Outcome<ApplyResult> outcome = recordLock.lock(LockOptions.blocking(recordLockTimeout), result -> {
            if (!result.held()) {
                throw new TransientFailureException("Timed out waiting for " + recordLock.key());
            }
            ApplyResult r;
            try {
                r = applier.apply(record);
            } catch (RecordRejectedException e) {
                return Outcome.completed(ApplyResult.failed(e.getMessage()));
            }
            if (r == null) {
                throw new IllegalStateException("ApplyCollaborator returned no result for record " + record.identifier());
            }
            return Outcome.completed(r);
        });

        ApplyResult applied = outcome.valueOrNull();
        if (applied.status() == ApplyResult.Status.FAILED) {
            log.warn("Failed to apply {}: {}", record.identifier(), applied.reason());
        }
        return applied;
    }
}
