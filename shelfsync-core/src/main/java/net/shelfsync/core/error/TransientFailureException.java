package net.shelfsync.core.error;

/**
 * 네트워크/외부 시스템 일시 장애. 태스크 큐가 백오프 후 같은 인자로 다시 실행한다.
 */
public class TransientFailureException extends ShelfsyncException {
    public TransientFailureException(String message) {
        super(message);
    }

    public TransientFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
