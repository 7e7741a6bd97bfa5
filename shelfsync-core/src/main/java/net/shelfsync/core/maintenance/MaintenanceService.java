package net.shelfsync.core.maintenance;

import net.shelfsync.core.model.UploadRecord;
import net.shelfsync.core.spi.Clock;
import net.shelfsync.core.spi.CoordinationStore;
import net.shelfsync.core.spi.ObjectStorage;
import net.shelfsync.core.spi.TaskQueueRepository;
import net.shelfsync.core.spi.TxRunner;
import net.shelfsync.core.spi.UploadSessionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public final class MaintenanceService {
    private static final Logger log = LoggerFactory.getLogger(MaintenanceService.class);

    public static final String DEFAULT_EXPIRED_REASON = "lease expired, recovered by maintenance";

    private final CoordinationStore locks;
    private final TaskQueueRepository queue;
    private final UploadSessionRepository sessions;
    private final ObjectStorage storage;
    private final TxRunner tx;
    private final Clock clock;

    public MaintenanceService(CoordinationStore locks,
                              TaskQueueRepository queue,
                              UploadSessionRepository sessions,
                              ObjectStorage storage,
                              TxRunner tx,
                              Clock clock) {
        this.locks = locks;
        this.queue = queue;
        this.sessions = sessions;
        this.storage = storage;
        this.tx = tx;
        this.clock = clock;
    }

    /**
     * 주기 점검 메인 루틴.
     * - 만료된 락 레코드 삭제
     * - 만료된 RUNNING 재노출(READY)
     * - 방치된 업로드 세션의 멀티파트 abort + 세션 삭제
     * - 오래된 완료건 아카이브(선택)
     */
    public MaintenanceReport runOnce(Duration defaultBackoff,
                                     Duration finishedTtl,
                                     int sessionBatch) throws Exception {
        Instant now = clock.now();
        MaintenanceReport r = new MaintenanceReport();

        // 1) 만료 락 정리
        r.purgedLocks = tx.required(locks::purgeExpired);

        // 2) RUNNING lease 만료 복구 → READY(+backoff, attempt++)
        r.recoveredTasks = tx.required(() ->
                queue.recoverExpiredLeases(defaultBackoff, DEFAULT_EXPIRED_REASON));

        // 3) 만료 세션: 열린 멀티파트 업로드를 닫고 세션 삭제
        List<String> expired = tx.required(() -> sessions.findExpired(sessionBatch));
        for (String key : expired) {
            r.abortedUploads += abortUploads(key);
            if (tx.required(() -> sessions.forceDelete(key))) r.expiredSessions++;
        }

        // 4) 오래된 완료건 아카이브 (TTL 지난 것)
        if (finishedTtl != null && !finishedTtl.isZero() && !finishedTtl.isNegative()) {
            Instant threshold = now.minus(finishedTtl);
            r.archivedFinished = tx.required(() ->
                    queue.archiveFinishedOlderThan(threshold));
        }

        r.timestamp = now;
        return r;
    }

    private int abortUploads(String sessionKey) throws Exception {
        Map<String, UploadRecord> uploads = tx.required(() -> sessions.get(sessionKey));
        int aborted = 0;
        for (var e : uploads.entrySet()) {
            String uploadId = e.getValue().uploadId();
            if (uploadId == null) continue;
            try {
                storage.multipartAbort(e.getKey(), uploadId);
                aborted++;
            } catch (RuntimeException ex) {
                log.error("Failed to abort upload {} (UploadID: {}) due to exception ({})",
                        e.getKey(), uploadId, ex.getMessage(), ex);
            }
        }
        log.info("Expired upload session {}: aborted {} multipart upload(s)", sessionKey, aborted);
        return aborted;
    }

    /** 간단 리포트 DTO */
    public static final class MaintenanceReport {
        public Instant timestamp;
        public int purgedLocks;
        public int recoveredTasks;
        public int expiredSessions;
        public int abortedUploads;
        public int archivedFinished;

        @Override public String toString() {
            return "MaintenanceReport{" +
                    "timestamp=" + timestamp +
                    ", purgedLocks=" + purgedLocks +
                    ", recoveredTasks=" + recoveredTasks +
                    ", expiredSessions=" + expiredSessions +
                    ", abortedUploads=" + abortedUploads +
                    ", archivedFinished=" + archivedFinished +
                    '}';
        }
    }
}
