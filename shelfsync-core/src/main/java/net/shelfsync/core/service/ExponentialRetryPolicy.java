package net.shelfsync.core.service;

import java.time.Duration;

final class ExponentialRetryPolicy implements RetryPolicy {
    private final double factor;
    private final double base;
    private final double jitter;
    private final Double maxSeconds;

    ExponentialRetryPolicy(double factor, double base, double jitter, Duration maxTime) {
        this.factor = factor;
        this.base = base;
        this.jitter = jitter;
        this.maxSeconds = maxTime == null ? null : maxTime.toNanos() / 1_000_000_000d;
        // 잘못된 파라미터는 생성 시점에 실패
        Backoff.seconds(0, factor, base, jitter, maxSeconds);
    }

    @Override
    public Duration nextBackoff(long attempt) {
        int retries = (int) Math.min(Integer.MAX_VALUE, Math.max(0, attempt));
        return Backoff.duration(retries, factor, base, jitter, maxSeconds);
    }
}
