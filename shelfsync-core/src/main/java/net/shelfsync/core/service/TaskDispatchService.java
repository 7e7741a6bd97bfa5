package net.shelfsync.core.service;

import net.shelfsync.core.error.Transients;
import net.shelfsync.core.model.CursorTaskArgs;
import net.shelfsync.core.model.TaskInvocation;
import net.shelfsync.core.spi.Clock;
import net.shelfsync.core.spi.TaskQueueRepository;
import net.shelfsync.core.spi.TxRunner;
import net.shelfsync.core.task.CursorTask;
import net.shelfsync.core.task.TaskContext;
import net.shelfsync.core.task.TaskResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * 태스크 큐 어댑터. 호출을 선점해 핸들러를 실행하고 TaskResult를 큐 상태 전이로 바꾼다.
 * - Continue → 후속 호출 적재(같은 rootId) + 현재 호출 DONE (한 트랜잭션)
 * - 일시 장애({@link Transients#isTransient}: TransientFailureException, 재시도 가능한 StorageException,
 *   SQLTransientException/SQLRecoverableException) → attempt <= maxRetries면 백오프 후 READY, 아니면 FAILED
 * - 그 밖의 예외 → FAILED
 * FAILED로 끝나면 핸들러의 onFailed()를 부른다
 */
public final class TaskDispatchService {
    private static final Logger log = LoggerFactory.getLogger(TaskDispatchService.class);

    private final TaskQueueRepository queue;
    private final TxRunner tx;
    private final RetryPolicy retry;
    private final Map<String, CursorTask> handlers;
    private final long maxRetries;
    private final String workerToken;
    private final Clock clock;

    public TaskDispatchService(TaskQueueRepository queue, TxRunner tx, RetryPolicy retry,
                               Map<String, CursorTask> handlers, long maxRetries,
                               String workerToken, Clock clock) {
        this.queue = queue;
        this.tx = tx;
        this.retry = retry;
        this.handlers = Map.copyOf(handlers);
        this.maxRetries = maxRetries;
        this.workerToken = workerToken;
        this.clock = clock;
    }

    /** 새 논리 태스크 적재. rootId는 runId가 있으면 그것, 없으면 새로 만든다 */
    public TaskInvocation enqueue(String taskName, CursorTaskArgs args) throws Exception {
        if (!handlers.containsKey(taskName)) {
            throw new IllegalArgumentException("No handler registered for task " + taskName);
        }
        String rootId = args.runId() != null ? args.runId() : UUID.randomUUID().toString();
        return tx.required(() -> queue.enqueue(taskName, rootId, null, args, clock.now()));
    }

    /** READY를 최대 N개까지 선점해 순서대로 실행 */
    public int claimAndRunUpTo(int maxCount, Duration lease) throws Exception {
        int ran = 0;
        for (; ran < maxCount; ran++) {
            Optional<TaskInvocation> picked = tx.requiresNew(() -> queue.claimReady(lease, workerToken));
            if (picked.isEmpty()) break;
            run(picked.get());
        }
        return ran;
    }

    /** @return 핸들러가 결과를 냈으면 그 결과, 예외로 끝났으면 empty */
    public Optional<TaskResult> run(TaskInvocation invocation) throws Exception {
        long id = invocation.id();
        long attempt = invocation.attempt() == null ? 1 : invocation.attempt();

        CursorTask handler = handlers.get(invocation.taskName());
        if (handler == null) {
            log.error("No handler registered for task {} (invocation {})", invocation.taskName(), id);
            tx.required(() -> { queue.markFailed(id, "no handler: " + invocation.taskName()); return null; });
            return Optional.empty();
        }

        TaskContext ctx = new TaskContext(invocation.taskName(), id, invocation.rootId(), attempt);
        TaskResult result;
        try {
            result = handler.run(invocation.args(), ctx);
        } catch (Exception e) {
            if (Transients.isTransient(e) && attempt <= maxRetries) {
                Duration backoff = retry.nextBackoff(attempt - 1);
                log.warn("Task {} #{} attempt {} failed transiently, retrying in {}: {}",
                        invocation.taskName(), id, attempt, backoff, e.getMessage());
                tx.required(() -> { queue.retryWithBackoff(id, backoff, describe(e)); return null; });
                return Optional.empty();
            }
            if (Transients.isTransient(e)) {
                log.error("Task {} #{} failed after {} attempt(s)", invocation.taskName(), id, attempt, e);
            } else {
                log.error("Task {} #{} failed", invocation.taskName(), id, e);
            }
            tx.required(() -> { queue.markFailed(id, describe(e)); return null; });
            notifyFailed(handler, invocation, ctx, e);
            return Optional.empty();
        }

        if (result instanceof TaskResult.Continue next) {
            tx.required(() -> {
                queue.enqueue(invocation.taskName(), invocation.rootId(), id, next.next(), clock.now());
                queue.markDone(id);
                return null;
            });
            log.debug("Task {} #{} continues at cursor {}", invocation.taskName(), id, next.next().cursor());
        } else {
            tx.required(() -> { queue.markDone(id); return null; });
            log.debug("Task {} #{} finished: {}", invocation.taskName(), id, result);
        }
        return Optional.of(result);
    }

    /** 하트비트 (실행 중인 호출의 lease 연장) */
    public void heartbeat(long invocationId, Duration lease) throws Exception {
        tx.required(() -> { queue.heartbeat(invocationId, lease); return null; });
    }

    private static void notifyFailed(CursorTask handler, TaskInvocation invocation, TaskContext ctx, Exception error) {
        try {
            handler.onFailed(invocation.args(), ctx, error);
        } catch (Exception e) {
            log.error("Failure hook of task {} #{} failed", invocation.taskName(), invocation.id(), e);
        }
    }

    private static String describe(Exception e) {
        String msg = e.getClass().getSimpleName() + ": " + e.getMessage();
        return msg.length() > 2000 ? msg.substring(0, 2000) : msg;
    }
}
