package net.shelfsync.core.error;

import net.shelfsync.core.model.GuardStatus;

public class UploadSessionException extends ShelfsyncException {
    private final GuardStatus status;

    public UploadSessionException(String message, GuardStatus status) {
        super(message);
        this.status = status;
    }

    public GuardStatus status() {
        return status;
    }

    /** 다른 호출이 세션을 먼저 바꿨음 */
    public boolean stale() {
        return status == GuardStatus.STALE;
    }
}
