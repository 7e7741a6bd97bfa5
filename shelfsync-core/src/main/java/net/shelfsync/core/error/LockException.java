package net.shelfsync.core.error;

/** 락 API 오용(음수 타임아웃 등). 경합은 예외가 아니라 LockResult로 보고된다. */
public class LockException extends ShelfsyncException {
    public LockException(String message) {
        super(message);
    }
}
