package net.shelfsync.core.error;

public class ShelfsyncException extends RuntimeException {
    public ShelfsyncException(String message) {
        super(message);
    }

    public ShelfsyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
