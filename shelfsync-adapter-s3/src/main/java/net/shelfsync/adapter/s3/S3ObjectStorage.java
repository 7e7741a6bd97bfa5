package net.shelfsync.adapter.s3;

import net.shelfsync.core.error.StorageException;
import net.shelfsync.core.model.UploadPart;
import net.shelfsync.core.spi.ObjectStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.AbortMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompleteMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompletedMultipartUpload;
import software.amazon.awssdk.services.s3.model.CompletedPart;
import software.amazon.awssdk.services.s3.model.CreateMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.UploadPartRequest;

import java.util.List;
import java.util.function.Supplier;

/**
 * S3 멀티파트 업로드. 오류는 StorageException으로 바꿔 던진다
 * (SdkClientException = 네트워크 등 클라이언트 측 → statusCode -1, 재시도 가능).
 */
public final class S3ObjectStorage implements ObjectStorage {
    private static final Logger log = LoggerFactory.getLogger(S3ObjectStorage.class);

    private final S3Client s3;
    private final String bucket;

    public S3ObjectStorage(S3Client s3, String bucket) {
        if (bucket == null || bucket.isBlank()) {
            throw new IllegalStateException("S3 bucket not configured: shelfsync.s3.bucket");
        }
        this.s3 = s3;
        this.bucket = bucket;
    }

    @Override
    public String multipartCreate(String key, String contentType) {
        final String k = normalize(key);
        return call("CREATE_MULTIPART", k, () -> {
            var b = CreateMultipartUploadRequest.builder().bucket(bucket).key(k);
            if (contentType != null && !contentType.isBlank()) b = b.contentType(contentType);
            String uploadId = s3.createMultipartUpload(b.build()).uploadId();
            log.debug("Created multipart upload s3://{}/{} (UploadID: {})", bucket, k, uploadId);
            return uploadId;
        });
    }

    @Override
    public UploadPart multipartUpload(String key, String uploadId, int partNumber, byte[] content) {
        final String k = normalize(key);
        return call("UPLOAD_PART", k, () -> {
            var req = UploadPartRequest.builder()
                    .bucket(bucket)
                    .key(k)
                    .uploadId(uploadId)
                    .partNumber(partNumber)
                    .contentLength((long) content.length)
                    .build();
            String etag = s3.uploadPart(req, RequestBody.fromBytes(content)).eTag();
            return new UploadPart(partNumber, etag);
        });
    }

    @Override
    public void multipartComplete(String key, String uploadId, List<UploadPart> parts) {
        final String k = normalize(key);
        List<CompletedPart> completed = parts.stream()
                .map(p -> CompletedPart.builder().partNumber(p.partNumber()).eTag(p.etag()).build())
                .toList();
        call("COMPLETE_MULTIPART", k, () -> s3.completeMultipartUpload(CompleteMultipartUploadRequest.builder()
                .bucket(bucket)
                .key(k)
                .uploadId(uploadId)
                .multipartUpload(CompletedMultipartUpload.builder().parts(completed).build())
                .build()));
        log.debug("Completed s3://{}/{} with {} part(s)", bucket, k, parts.size());
    }

    @Override
    public void multipartAbort(String key, String uploadId) {
        final String k = normalize(key);
        call("ABORT_MULTIPART", k, () -> s3.abortMultipartUpload(AbortMultipartUploadRequest.builder()
                .bucket(bucket)
                .key(k)
                .uploadId(uploadId)
                .build()));
    }

    @Override
    public void store(String key, byte[] content, String contentType) {
        final String k = normalize(key);
        call("PUT", k, () -> {
            var b = PutObjectRequest.builder().bucket(bucket).key(k);
            if (contentType != null && !contentType.isBlank()) b = b.contentType(contentType);
            return s3.putObject(b.build(), RequestBody.fromBytes(content));
        });
    }

    private static <T> T call(String op, String key, Supplier<T> body) {
        try {
            return body.get();
        } catch (S3Exception e) {
            String code = e.awsErrorDetails() != null ? e.awsErrorDetails().errorCode() : null;
            throw new StorageException(msg(op, key, code != null ? code : e.getMessage()), e.statusCode(), e);
        } catch (SdkClientException e) {
            throw new StorageException(msg(op, key, e.getMessage()), -1, e);
        }
    }

    private static String normalize(String key) {
        return key.startsWith("/") ? key.substring(1) : key;
    }

    private static String msg(String op, String key, String detail) {
        return "s3 " + op + " failed for key=" + key + (detail == null ? "" : " : " + detail);
    }
}
