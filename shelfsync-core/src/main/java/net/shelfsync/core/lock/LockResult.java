package net.shelfsync.core.lock;

public enum LockResult {
    /** 새로 잡음 */
    ACQUIRED,
    /** 이미 내 토큰으로 잡혀 있어서 TTL만 갱신 */
    EXTENDED,
    /** 다른 소유자가 쥐고 있음 */
    FAILED,
    /** 블로킹 획득이 타임아웃까지 실패 */
    TIMED_OUT;

    public boolean held() {
        return this == ACQUIRED || this == EXTENDED;
    }
}
