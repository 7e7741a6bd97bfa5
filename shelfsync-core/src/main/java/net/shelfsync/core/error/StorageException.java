package net.shelfsync.core.error;

/** 오브젝트 스토어 실패. statusCode가 없으면 -1 */
public class StorageException extends ShelfsyncException {
    private final int statusCode;

    public StorageException(String message) {
        this(message, -1, null);
    }

    public StorageException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }

    /** 5xx 또는 클라이언트 I/O 실패 */
    public boolean retryable() {
        return statusCode < 0 || statusCode >= 500;
    }
}
