package net.shelfsync.core.model;

public enum GuardStatus {
    /** 반영됨, update number +1 */
    APPLIED,
    /** 락을 쥐고 있지 않음(또는 만료) */
    NOT_OWNER,
    /** 다른 호출이 먼저 세션을 변경함 */
    STALE
}
