package net.shelfsync.core.model;

/** 완료된 멀티파트 파트 디스크립터 */
public record UploadPart(int partNumber, String etag) {
    public UploadPart {
        if (partNumber < 1) throw new IllegalArgumentException("partNumber must be >= 1: " + partNumber);
    }
}
