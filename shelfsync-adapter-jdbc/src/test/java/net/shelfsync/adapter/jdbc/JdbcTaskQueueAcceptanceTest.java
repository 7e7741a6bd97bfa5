package net.shelfsync.adapter.jdbc;

import net.shelfsync.adapter.jdbc.repo.JdbcCoordinationStore;
import net.shelfsync.adapter.jdbc.repo.JdbcIdentifierSetRepository;
import net.shelfsync.adapter.jdbc.repo.JdbcTaskQueueRepository;
import net.shelfsync.adapter.jdbc.repo.JdbcUploadSessionRepository;
import net.shelfsync.adapter.memory.InMemoryObjectStorage;
import net.shelfsync.core.key.CoordinationKeys;
import net.shelfsync.core.lock.LeaseLockFactory;
import net.shelfsync.core.maintenance.MaintenanceService;
import net.shelfsync.core.model.ApplyResult;
import net.shelfsync.core.model.CompletionEvent;
import net.shelfsync.core.model.CursorTaskArgs;
import net.shelfsync.core.model.FeedRecord;
import net.shelfsync.core.model.Page;
import net.shelfsync.core.model.TaskInvocation;
import net.shelfsync.core.service.RetryPolicy;
import net.shelfsync.core.service.TaskDispatchService;
import net.shelfsync.core.spi.Clock;
import net.shelfsync.core.spi.CompletionListener;
import net.shelfsync.core.task.CursorImportTask;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 태스크 큐 인수 테스트
 * - ARGS JSON 왕복, FOR UPDATE SKIP LOCKED 선점, 재시도/리스 복구
 * - CursorImportTask를 Oracle 저장소 위에서 끝까지 실행
 */
@TestMethodOrder(MethodOrderer.MethodName.class)
class JdbcTaskQueueAcceptanceTest extends TestSupport {

    JdbcTxRunner tx;
    JdbcTaskQueueRepository queue;
    JdbcCoordinationStore store;
    JdbcIdentifierSetRepository identifiers;
    Clock clock;

    @BeforeAll
    void initAll() {
        tx = new JdbcTxRunner(ds);
        queue = new JdbcTaskQueueRepository();
        store = new JdbcCoordinationStore();
        identifiers = new JdbcIdentifierSetRepository();
        clock = Clock.system();
    }

    @BeforeEach
    void truncate() throws Exception {
        truncateAll(tx);
    }

    @Test
    void a1_enqueue_argsSurviveJsonColumn() throws Exception {
        Instant started = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        CursorTaskArgs args = CursorTaskArgs.start("lib-1")
                .withRunId("run-1")
                .withCursor("page-7")
                .withForce(true)
                .withUpdateNumber(12L)
                .withStartedAt(started)
                .withAttribute("format", "marc21");

        TaskInvocation ti = tx.required(() -> queue.enqueue("cursor-import", "run-1", null, args, null));

        assertEquals(TaskInvocation.Status.READY, ti.status());
        assertEquals(Long.valueOf(1), ti.attempt());
        assertNull(ti.parentId());
        assertEquals(args, ti.args());
        assertNotNull(ti.availableAt());
    }

    @Test
    void a2_claim_heartbeat_retry_done() throws Exception {
        long id = tx.required(() -> queue.enqueue("cursor-import", "root-1", null,
                CursorTaskArgs.start("lib-1"), null)).id();

        TaskInvocation running = tx.required(() -> queue.claimReady(Duration.ofSeconds(30), "worker-1")).orElseThrow();
        assertEquals(id, running.id());
        assertEquals(TaskInvocation.Status.RUNNING, running.status());
        assertEquals("worker-1", running.workerToken());
        assertTrue(tx.required(() -> queue.claimReady(Duration.ofSeconds(30), "worker-2")).isEmpty());

        tx.required(() -> { queue.heartbeat(id, Duration.ofSeconds(120)); return null; });
        Instant extended = tx.required(() -> queue.findById(id).orElseThrow()).leaseUntil();
        assertTrue(extended.isAfter(running.leaseUntil()), "lease extended");

        tx.required(() -> { queue.retryWithBackoff(id, Duration.ZERO, "feed timeout"); return null; });
        TaskInvocation retried = tx.required(() -> queue.findById(id).orElseThrow());
        assertEquals(TaskInvocation.Status.READY, retried.status());
        assertEquals(Long.valueOf(2), retried.attempt());
        assertEquals("feed timeout", retried.lastError());
        assertNull(retried.workerToken());

        TaskInvocation again = tx.required(() -> queue.claimReady(Duration.ofSeconds(30), "worker-2")).orElseThrow();
        assertEquals(id, again.id());
        tx.required(() -> { queue.markDone(id); return null; });
        TaskInvocation done = tx.required(() -> queue.findById(id).orElseThrow());
        assertEquals(TaskInvocation.Status.DONE, done.status());
        assertNotNull(done.finishedAt());
    }

    // ========== READY 10건을 6스레드가 분산 Claim: 중복 없이 정확히 10건 ==========
    @Test
    void a3_parallelClaim_distributesWithoutDuplication() throws Exception {
        tx.required(() -> {
            for (int i = 0; i < 10; i++) queue.enqueue("cursor-import", "root-" + i, null, CursorTaskArgs.start("lib-" + i), null);
            return null;
        });

        int threads = 6;
        ExecutorService es = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<List<Long>>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            futures.add(es.submit(() -> {
                start.await();
                List<Long> mine = new ArrayList<>();
                while (true) {
                    Optional<TaskInvocation> t = tx.requiresNew(() -> queue.claimReady(Duration.ofSeconds(30), "w"));
                    if (t.isEmpty()) return mine;
                    mine.add(t.get().id());
                }
            }));
        }
        start.countDown();

        List<Long> all = new ArrayList<>();
        for (Future<List<Long>> f : futures) all.addAll(f.get());
        es.shutdown();
        assertEquals(10, all.size());
        assertEquals(10, new HashSet<>(all).size(), "no invocation claimed twice");
    }

    @Test
    void a4_maintenance_recoversExpiredLease_andArchives() throws Exception {
        long stuck = tx.required(() -> queue.enqueue("cursor-import", "root-s", null, CursorTaskArgs.start("lib-1"), null)).id();
        long finished = tx.required(() -> queue.enqueue("cursor-import", "root-f", null, CursorTaskArgs.start("lib-2"), null)).id();
        tx.required(() -> queue.claimReady(Duration.ofMillis(200), "dead-worker"));
        tx.required(() -> queue.claimReady(Duration.ofSeconds(30), "worker-1"));
        tx.required(() -> { queue.markDone(finished); return null; });
        Thread.sleep(600);

        var maintenance = new MaintenanceService(store, queue, new JdbcUploadSessionRepository(),
                new InMemoryObjectStorage(), tx, () -> Instant.now().plusSeconds(3600));
        var report = maintenance.runOnce(Duration.ZERO, Duration.ofMinutes(1), 10);

        assertEquals(1, report.recoveredTasks);
        assertEquals(1, report.archivedFinished);
        TaskInvocation recovered = tx.required(() -> queue.findById(stuck).orElseThrow());
        assertEquals(TaskInvocation.Status.READY, recovered.status());
        assertEquals(Long.valueOf(2), recovered.attempt());
        assertEquals(MaintenanceService.DEFAULT_EXPIRED_REASON, recovered.lastError());
        assertTrue(tx.required(() -> queue.findById(finished)).isEmpty());
    }

    @Test
    void a5_cursorImport_overOracle_followsCursorAndCollectsIdentifiers() throws Exception {
        Map<String, Page> pages = Map.of(
                "", new Page(List.of(new FeedRecord("r1", null), new FeedRecord("r2", null)), "A"),
                "A", new Page(List.of(new FeedRecord("r3", null)), "B"),
                "B", new Page(List.of(new FeedRecord("r4", null)), null));
        List<String> applied = new CopyOnWriteArrayList<>();
        List<CompletionEvent> events = new CopyOnWriteArrayList<>();
        CompletionListener listener = events::add;

        var locks = new LeaseLockFactory(store, tx, Duration.ofSeconds(30), Duration.ofMillis(20));
        var task = new CursorImportTask(CursorImportTask.DEFAULT_LOCK_TYPE,
                (resourceId, cursor) -> pages.get(cursor == null ? "" : cursor),
                record -> { applied.add(record.identifier()); return ApplyResult.unchanged(); },
                locks, identifiers, tx, listener, clock, Duration.ofSeconds(5));
        var svc = new TaskDispatchService(queue, tx, RetryPolicy.fixed(Duration.ZERO),
                Map.of(CursorImportTask.DEFAULT_NAME, task), 3, "worker-1", clock);

        TaskInvocation root = svc.enqueue(CursorImportTask.DEFAULT_NAME,
                CursorTaskArgs.start("lib-1").withCollectIdentifiers(true));
        while (svc.claimAndRunUpTo(5, Duration.ofSeconds(30)) > 0) {
            // 큐가 빌 때까지
        }

        List<TaskInvocation> chain = tx.required(() -> queue.findByRoot(root.rootId()));
        assertEquals(3, chain.size(), "one invocation per page");
        assertThat(chain).allMatch(t -> t.status() == TaskInvocation.Status.DONE);
        assertEquals(chain.get(0).id(), chain.get(1).parentId());
        assertEquals("A", chain.get(1).args().cursor());
        assertEquals("B", chain.get(2).args().cursor());

        assertEquals(List.of("r1", "r2", "r3", "r4"), applied);
        assertEquals(1, events.size());
        String setKey = events.get(0).identifierSetKey();
        assertEquals(CoordinationKeys.identifierSet("lib-1", root.rootId()), setKey);
        assertEquals(Set.of("r1", "r2", "r3", "r4"), tx.required(() -> identifiers.members(setKey)));
    }
}
