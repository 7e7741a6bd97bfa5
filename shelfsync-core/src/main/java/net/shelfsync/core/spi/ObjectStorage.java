package net.shelfsync.core.spi;

import net.shelfsync.core.model.UploadPart;

import java.util.List;

/**
 * 오브젝트 스토어 경계. 실패는 StorageException(unchecked)으로 전파된다.
 */
public interface ObjectStorage {
    String multipartCreate(String key, String contentType);

    UploadPart multipartUpload(String key, String uploadId, int partNumber, byte[] content);

    void multipartComplete(String key, String uploadId, List<UploadPart> parts);

    void multipartAbort(String key, String uploadId);

    void store(String key, byte[] content, String contentType);
}
