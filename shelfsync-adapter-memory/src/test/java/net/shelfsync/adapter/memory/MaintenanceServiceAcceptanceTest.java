package net.shelfsync.adapter.memory;

import net.shelfsync.core.lock.Outcome;
import net.shelfsync.core.maintenance.MaintenanceService;
import net.shelfsync.core.maintenance.MaintenanceService.MaintenanceReport;
import net.shelfsync.core.model.CursorTaskArgs;
import net.shelfsync.core.model.TaskInvocation;
import net.shelfsync.core.upload.UploadManager;
import net.shelfsync.core.upload.UploadSession;
import net.shelfsync.core.upload.UploadSessionFactory;
import net.shelfsync.core.upload.UploadSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MaintenanceServiceAcceptanceTest {

    MutableClock clock;
    InMemoryCoordinationStore store;
    InMemoryTaskQueueRepository queue;
    InMemoryUploadSessionRepository sessions;
    InMemoryObjectStorage storage;
    MaintenanceService maintenance;

    @BeforeEach
    void init() {
        clock = new MutableClock();
        store = new InMemoryCoordinationStore(clock);
        queue = new InMemoryTaskQueueRepository(clock);
        sessions = new InMemoryUploadSessionRepository(clock);
        storage = new InMemoryObjectStorage();
        maintenance = new MaintenanceService(store, queue, sessions, storage, new DirectTxRunner(), clock);
    }

    @Test
    void runOnce_cleansEverythingThatOutlivedItsLease() throws Exception {
        // 만료될 락 + 살아있는 무기한 락
        store.setIfAbsent("shelfsync:Record:r1", "t1", Duration.ofSeconds(30));
        store.setIfAbsent("shelfsync:Task:pinned", "t2", null);

        // 죽은 워커가 쥐고 있던 호출
        TaskInvocation crashed = queue.enqueue("cursor-import", "root-1", null, CursorTaskArgs.start("lib-1"), clock.now());
        queue.claimReady(Duration.ofMinutes(1), "dead-worker");

        // 오래전에 끝난 호출
        TaskInvocation old = queue.enqueue("cursor-import", "root-0", null, CursorTaskArgs.start("lib-0"), clock.now());
        queue.markDone(old.id());

        // 방치된 업로드 세션(파트 1개 업로드됨)
        var uploads = new UploadSessionFactory(sessions, storage, new DirectTxRunner(),
                new UploadSettings(4, null, Duration.ofMinutes(1), Duration.ofMinutes(30)), Duration.ofMillis(5));
        UploadSession abandoned = uploads.session("lib-1:run-x", null);
        UploadManager m = uploads.manager(abandoned);
        m.begin(r -> {
            m.addRecord("lib-1/run-x/all.mrc", "12345".getBytes());
            m.sync();
            return Outcome.completed(null);
        });
        assertEquals(1, storage.openUploads().size());

        clock.advance(Duration.ofHours(2));
        MaintenanceReport r = maintenance.runOnce(Duration.ZERO, Duration.ofHours(1), 100);

        assertEquals(1, r.purgedLocks);
        assertTrue(store.get("shelfsync:Task:pinned").isPresent());

        assertEquals(1, r.recoveredTasks);
        TaskInvocation recovered = queue.findById(crashed.id()).orElseThrow();
        assertEquals(TaskInvocation.Status.READY, recovered.status());
        assertEquals(Long.valueOf(2), recovered.attempt());
        assertEquals(MaintenanceService.DEFAULT_EXPIRED_REASON, recovered.lastError());

        assertEquals(1, r.expiredSessions);
        assertEquals(1, r.abortedUploads);
        assertTrue(storage.openUploads().isEmpty());
        assertEquals(Map.of(), sessions.get(abandoned.key()));

        assertEquals(1, r.archivedFinished);
        assertTrue(queue.findById(old.id()).isEmpty());
        assertEquals(clock.now(), r.timestamp);
    }

    @Test
    void runOnce_leavesLiveSessionsAlone() throws Exception {
        var uploads = new UploadSessionFactory(sessions, storage, new DirectTxRunner(),
                UploadSettings.defaults(), Duration.ofMillis(5));
        UploadSession live = uploads.session("lib-2:run-y", null);
        live.acquire();
        live.appendBuffers(Map.of("k", new byte[]{1, 2, 3}));

        MaintenanceReport r = maintenance.runOnce(Duration.ZERO, null, 100);

        assertEquals(0, r.expiredSessions);
        assertEquals(1, sessions.get(live.key()).size());
        assertEquals(0, r.archivedFinished);
    }
}
