package net.shelfsync.adapter.memory;

import net.shelfsync.core.error.StorageException;
import net.shelfsync.core.model.UploadPart;
import net.shelfsync.core.spi.ObjectStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 멀티파트 업로드를 흉내 내는 오브젝트 스토어. 로컬 실행과 테스트용.
 * complete 시 S3처럼 파트 번호 연속성과 etag를 검사한다.
 */
public final class InMemoryObjectStorage implements ObjectStorage {
    private static final Logger log = LoggerFactory.getLogger(InMemoryObjectStorage.class);

    public enum Operation { CREATE, UPLOAD, COMPLETE, ABORT, STORE }

    private record Upload(String key, String contentType, Map<Integer, byte[]> parts) {}

    private final Map<String, byte[]> objects = new ConcurrentHashMap<>();
    private final Map<String, String> contentTypes = new ConcurrentHashMap<>();
    private final Map<String, Upload> open = new ConcurrentHashMap<>();
    private final Set<String> aborted = ConcurrentHashMap.newKeySet();
    private final AtomicInteger partUploads = new AtomicInteger();
    private final Map<Operation, RuntimeException> failures = new EnumMap<>(Operation.class);

    /** 다음 번 해당 연산을 한 번 실패시킨다 */
    public synchronized void failNext(Operation op, RuntimeException error) {
        failures.put(op, error);
    }

    @Override
    public String multipartCreate(String key, String contentType) {
        maybeFail(Operation.CREATE);
        String uploadId = UUID.randomUUID().toString();
        open.put(uploadId, new Upload(key, contentType, new TreeMap<>()));
        return uploadId;
    }

    @Override
    public UploadPart multipartUpload(String key, String uploadId, int partNumber, byte[] content) {
        maybeFail(Operation.UPLOAD);
        Upload u = openUpload(key, uploadId);
        synchronized (u) {
            u.parts().put(partNumber, content.clone());
        }
        partUploads.incrementAndGet();
        return new UploadPart(partNumber, etag(uploadId, partNumber, content));
    }

    @Override
    public void multipartComplete(String key, String uploadId, List<UploadPart> parts) {
        maybeFail(Operation.COMPLETE);
        Upload u = openUpload(key, uploadId);
        var out = new ByteArrayOutputStream();
        synchronized (u) {
            for (int i = 0; i < parts.size(); i++) {
                UploadPart p = parts.get(i);
                if (p.partNumber() != i + 1) {
                    throw new StorageException("InvalidPartOrder: " + key + " part " + p.partNumber(), 400, null);
                }
                byte[] bytes = u.parts().get(p.partNumber());
                if (bytes == null || !etag(uploadId, p.partNumber(), bytes).equals(p.etag())) {
                    throw new StorageException("InvalidPart: " + key + " part " + p.partNumber(), 400, null);
                }
                out.writeBytes(bytes);
            }
        }
        open.remove(uploadId);
        objects.put(key, out.toByteArray());
        contentTypes.put(key, u.contentType());
    }

    @Override
    public void multipartAbort(String key, String uploadId) {
        maybeFail(Operation.ABORT);
        if (open.remove(uploadId) == null) {
            throw new StorageException("NoSuchUpload: " + key + " (UploadID: " + uploadId + ")", 404, null);
        }
        aborted.add(uploadId);
        log.debug("Aborted {} (UploadID: {})", key, uploadId);
    }

    @Override
    public void store(String key, byte[] content, String contentType) {
        maybeFail(Operation.STORE);
        objects.put(key, content.clone());
        contentTypes.put(key, contentType);
    }

    public Optional<byte[]> object(String key) {
        return Optional.ofNullable(objects.get(key));
    }

    public Optional<String> contentType(String key) {
        return Optional.ofNullable(contentTypes.get(key));
    }

    public Set<String> objectKeys() {
        return Set.copyOf(objects.keySet());
    }

    /** 완료도 abort도 되지 않은 업로드 id */
    public Set<String> openUploads() {
        return Set.copyOf(open.keySet());
    }

    public Set<String> abortedUploads() {
        return Set.copyOf(aborted);
    }

    public int partUploadCount() {
        return partUploads.get();
    }

    private Upload openUpload(String key, String uploadId) {
        Upload u = open.get(uploadId);
        if (u == null || !u.key().equals(key)) {
            throw new StorageException("NoSuchUpload: " + key + " (UploadID: " + uploadId + ")", 404, null);
        }
        return u;
    }

    private synchronized void maybeFail(Operation op) {
        RuntimeException e = failures.remove(op);
        if (e != null) throw e;
    }

    private static String etag(String uploadId, int partNumber, byte[] content) {
        return Integer.toHexString((uploadId + ":" + partNumber).hashCode() * 31 + Arrays.hashCode(content));
    }
}
