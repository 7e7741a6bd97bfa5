package net.shelfsync.core.lock;

import java.time.Duration;

/**
 * 범위 락 정책.
 *
 * @param timeout blocking일 때만 의미. null 또는 0이면 무기한 대기
 */
public record LockOptions(boolean blocking, Duration timeout, boolean releaseOnError, boolean releaseOnExit) {

    public static LockOptions nonBlocking() {
        return new LockOptions(false, null, true, true);
    }

    public static LockOptions blocking(Duration timeout) {
        return new LockOptions(true, timeout, true, true);
    }

    public LockOptions withReleaseOnError(boolean release) {
        return new LockOptions(blocking, timeout, release, releaseOnExit);
    }

    public LockOptions withReleaseOnExit(boolean release) {
        return new LockOptions(blocking, timeout, releaseOnError, release);
    }
}
