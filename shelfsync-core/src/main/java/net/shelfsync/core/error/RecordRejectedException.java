package net.shelfsync.core.error;

/** 레코드 단위 영구 실패. 해당 레코드만 실패로 기록하고 다음 레코드로 진행한다. */
public class RecordRejectedException extends ShelfsyncException {
    public RecordRejectedException(String message) {
        super(message);
    }
}
