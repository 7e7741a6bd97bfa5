package net.shelfsync.core.service;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

public interface RetryPolicy {
    /** @param attempt 0부터 시작하는 재시도 회차 */
    Duration nextBackoff(long attempt);

    /** 고정 백오프 정책 */
    static RetryPolicy fixed(Duration backoff) {
        if (backoff == null || backoff.isNegative()) {
            throw new IllegalArgumentException("backoff must be >= 0: " + backoff);
        }
        return attempt -> backoff;
    }

    /** 지터 지수 백오프 (Backoff 참고) */
    static RetryPolicy exponential(double factor, double base, double jitter, Duration maxTime) {
        return new ExponentialRetryPolicy(factor, base, jitter, maxTime);
    }

    static RetryPolicy exponential() {
        return new ExponentialRetryPolicy(Backoff.DEFAULT_FACTOR, Backoff.DEFAULT_BASE, Backoff.DEFAULT_JITTER, null);
    }

    /** [0, maxDelay) 균등 분포. 블로킹 락 재시도 기본값 */
    static RetryPolicy uniform(Duration maxDelay) {
        long maxNanos = Math.max(1, maxDelay.toNanos());
        return attempt -> Duration.ofNanos(ThreadLocalRandom.current().nextLong(maxNanos));
    }
}
