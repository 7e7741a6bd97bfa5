package net.shelfsync.adapter.memory;

import net.shelfsync.core.error.RecordRejectedException;
import net.shelfsync.core.error.TransientFailureException;
import net.shelfsync.core.key.CoordinationKeys;
import net.shelfsync.core.lock.LeaseLockFactory;
import net.shelfsync.core.model.ApplyResult;
import net.shelfsync.core.model.CompletionEvent;
import net.shelfsync.core.model.CursorTaskArgs;
import net.shelfsync.core.model.FeedRecord;
import net.shelfsync.core.model.Page;
import net.shelfsync.core.spi.ApplyCollaborator;
import net.shelfsync.core.spi.PageSource;
import net.shelfsync.core.task.CursorImportTask;
import net.shelfsync.core.task.TaskContext;
import net.shelfsync.core.task.TaskResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 리소스 R: page1 → A, page2@A → B, page3@B → 끝. 페이지마다 레코드 2건.
 */
@TestMethodOrder(MethodOrderer.MethodName.class)
class CursorImportTaskAcceptanceTest {

    static final String R = "lib-1";

    MutableClock clock;
    InMemoryCoordinationStore store;
    InMemoryIdentifierSetRepository identifiers;
    LeaseLockFactory locks;

    Map<String, Page> pages;
    List<String> fetched;
    Map<String, Integer> applyCalls;
    Map<String, ApplyResult> scripted;
    List<CompletionEvent> events;

    @BeforeEach
    void init() {
        clock = new MutableClock();
        store = new InMemoryCoordinationStore(clock);
        identifiers = new InMemoryIdentifierSetRepository();
        locks = new LeaseLockFactory(store, new DirectTxRunner(), Duration.ofMinutes(5), Duration.ofMillis(5));

        pages = new HashMap<>();
        pages.put(null, new Page(List.of(rec("r1"), rec("r2")), "A"));
        pages.put("A", new Page(List.of(rec("r3"), rec("r4")), "B"));
        pages.put("B", new Page(List.of(rec("r5"), rec("r6")), null));
        fetched = new ArrayList<>();
        applyCalls = new ConcurrentHashMap<>();
        scripted = new HashMap<>();
        events = new ArrayList<>();
    }

    static FeedRecord rec(String id) {
        return new FeedRecord(id, id.getBytes());
    }

    PageSource source() {
        return (resourceId, cursor) -> {
            fetched.add(cursor);
            return pages.get(cursor);
        };
    }

    ApplyCollaborator applier() {
        return record -> {
            applyCalls.merge(record.identifier(), 1, Integer::sum);
            return scripted.getOrDefault(record.identifier(), ApplyResult.applied());
        };
    }

    CursorImportTask task(PageSource source, ApplyCollaborator applier) {
        return new CursorImportTask(CursorImportTask.DEFAULT_LOCK_TYPE, source, applier, locks, identifiers,
                new DirectTxRunner(), events::add, clock, Duration.ofMillis(50));
    }

    TaskContext ctx() {
        return TaskContext.direct(CursorImportTask.DEFAULT_NAME, "root-1");
    }

    @Test
    void b1_threePages_eachRecordAppliedOnce_andLastInvocationHasNoSuccessor() throws Exception {
        var task = task(source(), applier());

        TaskResult first = task.run(CursorTaskArgs.start(R), ctx());
        var c1 = assertInstanceOf(TaskResult.Continue.class, first);
        assertEquals("A", c1.next().cursor());
        assertEquals("root-1", c1.next().runId());
        assertNotNull(c1.next().startedAt());

        TaskResult second = task.run(c1.next(), ctx());
        var c2 = assertInstanceOf(TaskResult.Continue.class, second);
        assertEquals("B", c2.next().cursor());
        assertEquals(c1.next().startedAt(), c2.next().startedAt());

        TaskResult third = task.run(c2.next(), ctx());
        var done = assertInstanceOf(TaskResult.Done.class, third);
        assertEquals(2, done.summary().applied());

        assertEquals(6, applyCalls.values().stream().mapToInt(Integer::intValue).sum());
        assertThat(applyCalls).containsOnlyKeys("r1", "r2", "r3", "r4", "r5", "r6").allSatisfy((k, v) -> assertThat(v).isEqualTo(1));
        assertEquals(Arrays.asList(null, "A", "B"), fetched);

        // 리소스 락과 레코드 락은 모두 반납됨
        assertTrue(store.get(CoordinationKeys.lock(CursorImportTask.DEFAULT_LOCK_TYPE, R)).isEmpty());
        assertTrue(store.get(CoordinationKeys.lock(LeaseLockFactory.RECORD_LOCK, "r1")).isEmpty());

        assertEquals(1, events.size());
        assertTrue(events.get(0).exhausted());
        assertNull(events.get(0).identifierSetKey());
    }

    @Test
    void b2_unchangedRecord_stopsIncrementalSync() throws Exception {
        scripted.put("r2", ApplyResult.unchanged());
        var task = task(source(), applier());

        TaskResult r = task.run(CursorTaskArgs.start(R), ctx());

        var done = assertInstanceOf(TaskResult.Done.class, r);
        assertEquals(1, done.summary().unchanged());
        assertEquals(Collections.singletonList(null), fetched);
        assertFalse(events.get(0).exhausted());
    }

    @Test
    void b3_force_walksPastUnchanged() throws Exception {
        scripted.put("r2", ApplyResult.unchanged());
        var task = task(source(), applier());

        TaskResult r = task.run(CursorTaskArgs.start(R).withForce(true), ctx());

        assertInstanceOf(TaskResult.Continue.class, r);
        assertTrue(((TaskResult.Continue) r).next().force());
    }

    @Test
    void b4_collectIdentifiers_accumulatesAcrossInvocations() throws Exception {
        scripted.put("r1", ApplyResult.unchanged());
        var task = task(source(), applier());

        CursorTaskArgs args = CursorTaskArgs.start(R).withCollectIdentifiers(true);
        TaskResult r;
        while ((r = task.run(args, ctx())) instanceof TaskResult.Continue c) {
            args = c.next();
        }

        String setKey = CoordinationKeys.identifierSet(R, "root-1");
        assertEquals(Set.of("r1", "r2", "r3", "r4", "r5", "r6"), identifiers.members(setKey));
        assertEquals(setKey, events.get(0).identifierSetKey());
        assertTrue(events.get(0).exhausted());
    }

    @Test
    void b5_resourceHeldByAnotherRun_skipsWithoutFetching() throws Exception {
        locks.resourceLock(CursorImportTask.DEFAULT_LOCK_TYPE, R, "other-run").acquire();
        var task = task(source(), applier());

        TaskResult r = task.run(CursorTaskArgs.start(R), ctx());

        assertInstanceOf(TaskResult.Skipped.class, r);
        assertTrue(fetched.isEmpty());
        assertTrue(applyCalls.isEmpty());
    }

    @Test
    void b6_transientSourceFailure_propagates_andReleasesResourceLock() {
        PageSource failing = (resourceId, cursor) -> { throw new TransientFailureException("feed unavailable"); };
        var task = task(failing, applier());

        assertThrows(TransientFailureException.class, () -> task.run(CursorTaskArgs.start(R), ctx()));
        assertTrue(store.get(CoordinationKeys.lock(CursorImportTask.DEFAULT_LOCK_TYPE, R)).isEmpty());
        assertTrue(events.isEmpty());
    }

    @Test
    void b7_permanentRecordFailure_isCounted_andPageContinues() throws Exception {
        scripted.put("r1", ApplyResult.failed("missing title"));
        ApplyCollaborator applier = record -> {
            if (record.identifier().equals("r2")) throw new RecordRejectedException("bad isbn");
            return applier().apply(record);
        };
        var task = task(source(), applier);

        TaskResult r = task.run(CursorTaskArgs.start(R), ctx());

        var c = assertInstanceOf(TaskResult.Continue.class, r);
        assertEquals(2, c.summary().failed());
        assertEquals(2, c.summary().processed());
    }

    @Test
    void b8_recordLockTimeout_isTransient() throws Exception {
        locks.recordLock("r1").acquire();
        var task = task(source(), applier());

        assertThrows(TransientFailureException.class, () -> task.run(CursorTaskArgs.start(R), ctx()));
        assertFalse(applyCalls.containsKey("r1"));
    }

    @Test
    void b9_applierReturningNothing_failsWithRecordNamed_andReleasesLocks() {
        ApplyCollaborator applier = record -> record.identifier().equals("r2") ? null : applier().apply(record);
        var task = task(source(), applier);

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> task.run(CursorTaskArgs.start(R), ctx()));

        assertThat(e.getMessage()).contains("r2");
        assertTrue(store.get(CoordinationKeys.lock(CursorImportTask.DEFAULT_LOCK_TYPE, R)).isEmpty());
        assertTrue(store.get(locks.recordLock("r2").key()).isEmpty());
        assertTrue(events.isEmpty());
    }
}
