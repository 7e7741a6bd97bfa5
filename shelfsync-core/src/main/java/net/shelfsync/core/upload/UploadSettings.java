package net.shelfsync.core.upload;

import java.time.Duration;

/**
 * @param minimumPartSize 이 크기 이상 쌓인 버퍼만 파트로 올린다 (S3 최소 5 MiB, 마지막 파트 예외)
 * @param lockTtl         세션 락 리스
 * @param sessionTtl      마지막 변경 후 세션이 방치되면 만료되는 시간
 */
public record UploadSettings(int minimumPartSize, String contentType, Duration lockTtl, Duration sessionTtl) {
    public static final int S3_MINIMUM_PART_SIZE = 5 * 1024 * 1024;

    public UploadSettings {
        if (minimumPartSize < 1) throw new IllegalArgumentException("minimumPartSize must be positive");
        if (contentType == null || contentType.isBlank()) contentType = "application/octet-stream";
    }

    public static UploadSettings defaults() {
        return new UploadSettings(S3_MINIMUM_PART_SIZE, "application/octet-stream",
                Duration.ofMinutes(5), Duration.ofMinutes(30));
    }
}
