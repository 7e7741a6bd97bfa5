package net.shelfsync.core.lock;

import net.shelfsync.core.error.LockException;
import net.shelfsync.core.service.RetryPolicy;

import java.time.Duration;
import java.util.UUID;

/**
 * 소유 토큰 기반 분산 리스 락.
 * 해제/연장은 현재 값이 내 토큰일 때만 원자적으로 수행되므로, 리스가 만료되어
 * 다른 소유자가 잡은 뒤에 늦게 도착한 해제 요청은 무시된다.
 * 리스 만료는 자동 감지하지 않는다. 오래 쥐는 호출자는 extendTimeout()을 주기적으로 부른다.
 */
public abstract class LeaseLock {
    protected final String token;
    private final RetryPolicy acquireRetry;

    protected LeaseLock(String token, RetryPolicy acquireRetry) {
        this.token = token != null ? token : UUID.randomUUID().toString();
        this.acquireRetry = acquireRetry;
    }

    public abstract String key();

    /** 논블로킹 획득 */
    public abstract LockResult acquire() throws Exception;

    /** @return 내 토큰이 아직 유효해서 해제했으면 true */
    public abstract boolean release() throws Exception;

    /** @return 내 토큰이 아직 유효해서 TTL을 갱신했으면 true */
    public abstract boolean extendTimeout() throws Exception;

    /** 조회용. 정합성 판단에 쓰지 말 것 */
    public abstract boolean locked(boolean byUs) throws Exception;

    public boolean locked() throws Exception {
        return locked(false);
    }

    public String token() {
        return token;
    }

    public LockResult acquire(boolean blocking, Duration timeout) throws Exception {
        if (!blocking) return acquire();
        if (timeout != null && timeout.isNegative()) {
            throw new LockException("Cannot specify a negative timeout");
        }
        boolean forever = timeout == null || timeout.isZero();
        long deadline = forever ? Long.MAX_VALUE : System.nanoTime() + timeout.toNanos();

        long attempt = 0;
        while (true) {
            LockResult r = acquire();
            if (r.held()) return r;

            long remaining = deadline - System.nanoTime();
            if (!forever && remaining <= 0) return LockResult.TIMED_OUT;

            long sleepNanos = acquireRetry.nextBackoff(attempt++).toNanos();
            if (!forever) sleepNanos = Math.min(sleepNanos, remaining);
            if (sleepNanos > 0) {
                Thread.sleep(sleepNanos / 1_000_000, (int) (sleepNanos % 1_000_000));
            }
        }
    }

    /** 본문이 예외 또는 Failed로 끝났을 때 정리 */
    protected void onErrorExit() throws Exception {
        release();
    }

    /** 본문이 정상(Completed/Superseded)으로 끝났을 때 정리 */
    protected void onNormalExit() throws Exception {
        release();
    }

    /**
     * 획득 → 본문 실행 → 정책에 따라 해제.
     * 락을 못 잡았어도 본문은 실행된다(결과를 보고 판단). 정리는 잡았을 때만 한다.
     */
    public <T> Outcome<T> lock(LockOptions options, LockedBody<T> body) throws Exception {
        LockResult result = acquire(options.blocking(), options.timeout());
        boolean held = result.held();

        Outcome<T> outcome;
        try {
            outcome = body.run(result);
        } catch (Exception e) {
            if (held && options.releaseOnError()) {
                try {
                    onErrorExit();
                } catch (Exception cleanup) {
                    e.addSuppressed(cleanup);
                }
            }
            throw e;
        }

        if (held) {
            if (outcome.failed()) {
                if (options.releaseOnError()) onErrorExit();
            } else if (options.releaseOnExit()) {
                onNormalExit();
            }
        }
        return outcome;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{key='" + key() + "'}";
    }
}
