package net.shelfsync.core.lock;

@FunctionalInterface
public interface LockedBody<T> {
    /** @param result 획득 결과. 반드시 held()인지 확인할 것 */
    Outcome<T> run(LockResult result) throws Exception;
}
