package net.shelfsync.adapter.memory;

import net.shelfsync.core.error.StorageException;
import net.shelfsync.core.error.TransientFailureException;
import net.shelfsync.core.model.CursorTaskArgs;
import net.shelfsync.core.model.PageSummary;
import net.shelfsync.core.model.TaskInvocation;
import net.shelfsync.core.model.TaskInvocation.Status;
import net.shelfsync.core.service.RetryPolicy;
import net.shelfsync.core.service.TaskDispatchService;
import net.shelfsync.core.task.CursorTask;
import net.shelfsync.core.task.TaskContext;
import net.shelfsync.core.task.TaskResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import java.sql.SQLRecoverableException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@TestMethodOrder(MethodOrderer.MethodName.class)
class TaskDispatchServiceAcceptanceTest {

    MutableClock clock;
    InMemoryTaskQueueRepository queue;

    @BeforeEach
    void init() {
        clock = new MutableClock();
        queue = new InMemoryTaskQueueRepository(clock);
    }

    TaskDispatchService svc(String name, CursorTask task, RetryPolicy retry, long maxRetries) {
        return new TaskDispatchService(queue, new DirectTxRunner(), retry, Map.of(name, task), maxRetries, "worker-1", clock);
    }

    @Test
    void e1_continue_replacesInvocation_withSuccessorOnSameRoot() throws Exception {
        List<String> seen = new ArrayList<>();
        CursorTask pager = (args, ctx) -> {
            seen.add(args.cursor());
            return switch (String.valueOf(args.cursor())) {
                case "null" -> TaskResult.next(args.withCursor("A"), PageSummary.EMPTY);
                case "A" -> TaskResult.next(args.withCursor("B"), PageSummary.EMPTY);
                default -> TaskResult.done(PageSummary.EMPTY);
            };
        };
        var svc = svc("pager", pager, RetryPolicy.fixed(Duration.ZERO), 3);

        TaskInvocation root = svc.enqueue("pager", CursorTaskArgs.start("lib-1"));
        assertEquals(1, svc.claimAndRunUpTo(1, Duration.ofMinutes(1)));
        assertEquals(2, svc.claimAndRunUpTo(5, Duration.ofMinutes(1)));
        assertEquals(0, svc.claimAndRunUpTo(5, Duration.ofMinutes(1)));

        assertEquals(Arrays.asList(null, "A", "B"), seen);
        List<TaskInvocation> chain = queue.findByRoot(root.rootId());
        assertEquals(3, chain.size());
        assertTrue(chain.stream().allMatch(t -> t.status() == Status.DONE));
        assertNull(chain.get(0).parentId());
        assertEquals(chain.get(1).id(), chain.get(2).parentId());
        assertEquals("B", chain.get(2).args().cursor());
    }

    @Test
    void e2_transientFailure_isRetriedUpToMaxRetries_thenFails() throws Exception {
        List<Long> attempts = new ArrayList<>();
        CursorTask flaky = (args, ctx) -> {
            attempts.add(ctx.attempt());
            throw new TransientFailureException("timeout");
        };
        var svc = svc("flaky", flaky, RetryPolicy.fixed(Duration.ZERO), 2);
        TaskInvocation inv = svc.enqueue("flaky", CursorTaskArgs.start("lib-1"));

        for (int i = 0; i < 5; i++) svc.claimAndRunUpTo(1, Duration.ofMinutes(1));

        assertEquals(List.of(1L, 2L, 3L), attempts);
        TaskInvocation last = queue.findById(inv.id()).orElseThrow();
        assertEquals(Status.FAILED, last.status());
        assertTrue(last.lastError().contains("timeout"));
    }

    @Test
    void e3_otherFailure_failsImmediately() throws Exception {
        CursorTask broken = (args, ctx) -> { throw new IllegalArgumentException("bad cursor"); };
        var svc = svc("broken", broken, RetryPolicy.fixed(Duration.ZERO), 5);
        TaskInvocation inv = svc.enqueue("broken", CursorTaskArgs.start("lib-1"));

        assertEquals(1, svc.claimAndRunUpTo(3, Duration.ofMinutes(1)));

        TaskInvocation after = queue.findById(inv.id()).orElseThrow();
        assertEquals(Status.FAILED, after.status());
        assertEquals(Long.valueOf(1), after.attempt());
    }

    @Test
    void e4_retryBackoff_delaysNextClaim() throws Exception {
        CursorTask once = new CursorTask() {
            int calls;
            @Override public TaskResult run(CursorTaskArgs args, TaskContext ctx) {
                if (calls++ == 0) throw new TransientFailureException("blip");
                return TaskResult.done(PageSummary.EMPTY);
            }
        };
        var svc = svc("once", once, RetryPolicy.fixed(Duration.ofSeconds(10)), 3);
        TaskInvocation inv = svc.enqueue("once", CursorTaskArgs.start("lib-1"));

        svc.claimAndRunUpTo(1, Duration.ofMinutes(1));
        assertEquals(0, svc.claimAndRunUpTo(1, Duration.ofMinutes(1)));

        clock.advance(Duration.ofSeconds(10));
        assertEquals(1, svc.claimAndRunUpTo(1, Duration.ofMinutes(1)));
        assertEquals(Status.DONE, queue.findById(inv.id()).orElseThrow().status());
    }

    @Test
    void e5_unknownTask_isRejectedAtEnqueue() {
        var svc = svc("known", (a, c) -> TaskResult.skipped("noop"), RetryPolicy.fixed(Duration.ZERO), 1);
        assertThrows(IllegalArgumentException.class, () -> svc.enqueue("unknown", CursorTaskArgs.start("x")));
    }

    @Test
    void e6_heartbeat_extendsLease() throws Exception {
        var svc = svc("idle", (a, c) -> TaskResult.skipped("noop"), RetryPolicy.fixed(Duration.ZERO), 1);
        TaskInvocation inv = svc.enqueue("idle", CursorTaskArgs.start("x").withRunId("run-7"));
        assertEquals("run-7", inv.rootId());

        TaskInvocation running = queue.claimReady(Duration.ofSeconds(30), "worker-1").orElseThrow();
        svc.heartbeat(running.id(), Duration.ofMinutes(5));

        TaskInvocation after = queue.findById(running.id()).orElseThrow();
        assertEquals(clock.now().plus(Duration.ofMinutes(5)), after.leaseUntil());
    }

    @Test
    void e7_storageServerError_andLostConnection_areRetried() throws Exception {
        List<Long> attempts = new ArrayList<>();
        CursorTask task = (args, ctx) -> {
            attempts.add(ctx.attempt());
            if (ctx.attempt() == 1) throw new StorageException("503 SlowDown", 503, null);
            if (ctx.attempt() == 2) throw new IllegalStateException("session read failed",
                    new SQLRecoverableException("IO Error: Connection reset"));
            return TaskResult.done(PageSummary.EMPTY);
        };
        var svc = svc("upload", task, RetryPolicy.fixed(Duration.ZERO), 3);
        TaskInvocation inv = svc.enqueue("upload", CursorTaskArgs.start("lib-1"));

        for (int i = 0; i < 5; i++) svc.claimAndRunUpTo(1, Duration.ofMinutes(1));

        assertEquals(List.of(1L, 2L, 3L), attempts);
        TaskInvocation after = queue.findById(inv.id()).orElseThrow();
        assertEquals(Status.DONE, after.status());
        assertEquals(Long.valueOf(3), after.attempt());
    }

    @Test
    void e8_storageClientError_failsImmediately_andNotifiesHandler() throws Exception {
        List<Exception> failures = new ArrayList<>();
        CursorTask task = new CursorTask() {
            @Override public TaskResult run(CursorTaskArgs args, TaskContext ctx) {
                throw new StorageException("NoSuchUpload", 404, null);
            }
            @Override public void onFailed(CursorTaskArgs args, TaskContext ctx, Exception error) {
                failures.add(error);
            }
        };
        var svc = svc("upload", task, RetryPolicy.fixed(Duration.ZERO), 3);
        TaskInvocation inv = svc.enqueue("upload", CursorTaskArgs.start("lib-1"));

        assertEquals(1, svc.claimAndRunUpTo(3, Duration.ofMinutes(1)));

        TaskInvocation after = queue.findById(inv.id()).orElseThrow();
        assertEquals(Status.FAILED, after.status());
        assertEquals(Long.valueOf(1), after.attempt());
        assertEquals(1, failures.size());
        assertInstanceOf(StorageException.class, failures.get(0));
    }

    @Test
    void e9_failureHook_isNotCalled_whileRetriesRemain() throws Exception {
        List<Long> hooked = new ArrayList<>();
        CursorTask task = new CursorTask() {
            @Override public TaskResult run(CursorTaskArgs args, TaskContext ctx) {
                throw new TransientFailureException("timeout");
            }
            @Override public void onFailed(CursorTaskArgs args, TaskContext ctx, Exception error) {
                hooked.add(ctx.attempt());
            }
        };
        var svc = svc("flaky", task, RetryPolicy.fixed(Duration.ZERO), 1);
        svc.enqueue("flaky", CursorTaskArgs.start("lib-1"));

        svc.claimAndRunUpTo(1, Duration.ofMinutes(1));
        assertTrue(hooked.isEmpty());
        svc.claimAndRunUpTo(1, Duration.ofMinutes(1));
        assertEquals(List.of(2L), hooked);
    }
}
