package net.shelfsync.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/** 출력 키 하나의 영속 상태: 진행 중 업로드 id, 아직 올리지 않은 버퍼, 완료된 파트 */
public record UploadRecord(String uploadId, byte[] buffer, List<UploadPart> parts) {
    public UploadRecord {
        buffer = buffer == null ? new byte[0] : buffer;
        parts = parts == null ? List.of() : List.copyOf(parts);
    }

    public static UploadRecord buffered(byte[] buffer) {
        return new UploadRecord(null, buffer, List.of());
    }

    public int bufferSize() {
        return buffer.length;
    }

    public int nextPartNumber() {
        return parts.size() + 1;
    }

    /** 파트 번호가 1부터 빈틈없이 증가하는지 */
    public boolean partsContiguous() {
        for (int i = 0; i < parts.size(); i++) {
            if (parts.get(i).partNumber() != i + 1) return false;
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UploadRecord other)) return false;
        return Objects.equals(uploadId, other.uploadId)
                && Arrays.equals(buffer, other.buffer)
                && parts.equals(other.parts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(uploadId, Arrays.hashCode(buffer), parts);
    }

    @Override
    public String toString() {
        return "UploadRecord{uploadId='" + uploadId + "', buffered=" + buffer.length + ", parts=" + parts + '}';
    }
}
