package net.shelfsync.core.upload;

import net.shelfsync.core.error.TransientFailureException;
import net.shelfsync.core.error.UploadSessionException;
import net.shelfsync.core.lock.LockResult;
import net.shelfsync.core.lock.LockedBody;
import net.shelfsync.core.lock.Outcome;
import net.shelfsync.core.model.GuardStatus;
import net.shelfsync.core.model.UploadPart;
import net.shelfsync.core.model.UploadRecord;
import net.shelfsync.core.spi.ObjectStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 출력 키별 바이트를 모아 멀티파트 업로드로 흘려보낸다.
 *
 * <p>addRecord()는 프로세스 메모리에만 쌓는다(내구성 없음). sync()를 통과한 데이터만
 * 세션에 남아 다음 호출이 이어받을 수 있다.
 */
public class UploadManager {
    private static final Logger log = LoggerFactory.getLogger(UploadManager.class);

    private final ObjectStorage storage;
    private final UploadSession session;
    private final UploadSettings settings;
    private final Map<String, ByteArrayOutputStream> buffers = new LinkedHashMap<>();
    private boolean locked;

    public UploadManager(ObjectStorage storage, UploadSession session, UploadSettings settings) {
        this.storage = storage;
        this.session = session;
        this.settings = settings;
    }

    public UploadSession session() {
        return session;
    }

    public boolean locked() {
        return locked;
    }

    /**
     * 세션 락 범위.
     * 정상/Superseded 종료 또는 TransientFailureException → 락만 반납(다음 호출이 이어감).
     * 그 밖의 예외 또는 Failed → 진행 중 멀티파트 업로드 전부 abort + 세션 삭제.
     */
    public <T> Outcome<T> begin(LockedBody<T> body) throws Exception {
        LockResult result = session.acquire();
        locked = result.held();

        Outcome<T> outcome;
        try {
            outcome = body.run(result);
        } catch (TransientFailureException e) {
            if (result.held()) releaseQuietly(e);
            throw e;
        } catch (Exception e) {
            if (result.held()) abort();
            throw e;
        } finally {
            locked = false;
        }

        if (result.held()) {
            if (outcome.failed()) {
                abort();
            } else {
                session.release();
            }
        }
        return outcome;
    }

    public void addRecord(String key, byte[] data) {
        buffers.computeIfAbsent(key, k -> new ByteArrayOutputStream()).writeBytes(data);
    }

    public void sync() throws Exception {
        sync(false);
    }

    /**
     * 로컬 버퍼를 세션에 반영한 뒤, 임계값 이상 쌓인 키를 파트로 올린다.
     * complete=true면 이미 멀티파트가 시작된 키는 크기와 무관하게 남은 버퍼를 마지막 파트로 올린다.
     * 멀티파트가 없고 임계값 미만인 키는 complete()에서 단일 오브젝트로 저장된다.
     */
    public void sync(boolean complete) throws Exception {
        requireLocked();

        if (!buffers.isEmpty()) {
            Map<String, byte[]> data = new LinkedHashMap<>();
            buffers.forEach((k, v) -> data.put(k, v.toByteArray()));
            session.appendBuffers(data);
            buffers.clear();
        }

        for (var e : session.get().entrySet()) {
            UploadRecord upload = e.getValue();
            boolean full = upload.bufferSize() >= settings.minimumPartSize();
            boolean last = complete && upload.uploadId() != null && upload.bufferSize() > 0;
            if (full || last) {
                uploadPart(e.getKey(), upload);
            }
        }
    }

    /**
     * 마지막 sync 후 모든 키를 완성한다.
     *
     * @return 완성된 출력 키
     */
    public Set<String> complete() throws Exception {
        sync(true);

        Map<String, UploadRecord> inProgress = session.get();
        for (var e : inProgress.entrySet()) {
            String key = e.getKey();
            UploadRecord upload = e.getValue();
            if (upload.uploadId() == null) {
                // 임계값을 넘은 적이 없음 → 그냥 한 번에 저장
                storage.store(key, upload.buffer(), settings.contentType());
            } else {
                if (!upload.partsContiguous()) {
                    throw new UploadSessionException("Non-contiguous parts for " + key + ": " + upload.parts(),
                            GuardStatus.STALE);
                }
                storage.multipartComplete(key, upload.uploadId(), upload.parts());
            }
        }

        if (!inProgress.isEmpty()) {
            session.clearUploads();
        }
        log.debug("Completed {} upload(s) for session {}", inProgress.size(), session.key());
        return inProgress.keySet();
    }

    /** 순회가 성공적으로 끝난 뒤 세션 레코드 제거 */
    public boolean removeSession() throws Exception {
        return session.delete();
    }

    private void uploadPart(String key, UploadRecord upload) throws Exception {
        String uploadId = upload.uploadId();
        if (uploadId == null) {
            uploadId = storage.multipartCreate(key, settings.contentType());
            session.setUploadId(key, uploadId);
        }
        int partNumber = upload.nextPartNumber();
        UploadPart part = storage.multipartUpload(key, uploadId, partNumber, upload.buffer());
        session.addPartAndClearBuffer(key, part);
        log.debug("Uploaded part {} ({} bytes) for {} (UploadID: {})", partNumber, upload.bufferSize(), key, uploadId);
    }

    /**
     * best-effort: 실패는 로그만 남기고 원래 예외를 가리지 않는다.
     * 락이 만료됐으면 다시 잡아 본다. 그 사이 다른 호출이 세션을 잡았거나 진행시켰으면 손대지 않는다.
     */
    private void abort() {
        buffers.clear();
        try {
            if (!reclaimForAbort()) return;
        } catch (Exception e) {
            log.error("Failed to check ownership of upload session {} while aborting", session.key(), e);
            return;
        }

        Map<String, UploadRecord> uploads = Map.of();
        try {
            uploads = session.get();
        } catch (Exception e) {
            log.error("Failed to read upload session {} while aborting", session.key(), e);
        }

        for (var entry : uploads.entrySet()) {
            String uploadId = entry.getValue().uploadId();
            if (uploadId == null) continue;
            try {
                storage.multipartAbort(entry.getKey(), uploadId);
            } catch (Exception e) {
                log.error("Failed to abort upload {} (UploadID: {}) due to exception ({})",
                        entry.getKey(), uploadId, e.getMessage(), e);
            }
        }

        try {
            if (!session.delete()) {
                log.warn("Upload session {} could not be deleted (lock lost), it stays until it expires", session.key());
            }
        } catch (Exception e) {
            log.error("Failed to delete upload session {}", session.key(), e);
        }
    }

    private boolean reclaimForAbort() throws Exception {
        if (session.locked(true)) return true;

        long seen = session.updateNumber();
        if (!session.acquire().held()) {
            log.warn("Upload session {} was taken over after its lock lapsed, leaving its uploads to the new owner",
                    session.key());
            return false;
        }
        if (session.updateNumber() != seen) {
            // 락이 비어 있던 사이 다른 호출이 진행시켰다
            log.warn("Upload session {} moved on to update number {} after its lock lapsed, not aborting",
                    session.key(), session.updateNumber());
            session.release();
            return false;
        }
        log.warn("Upload session {} lock lapsed before abort, re-acquired it", session.key());
        return true;
    }

    private void releaseQuietly(Exception original) {
        try {
            session.release();
        } catch (Exception e) {
            original.addSuppressed(e);
        }
    }

    private void requireLocked() {
        if (!locked) {
            throw new UploadSessionException("Must hold lock on " + session.key() + " (use begin())", GuardStatus.NOT_OWNER);
        }
    }
}
