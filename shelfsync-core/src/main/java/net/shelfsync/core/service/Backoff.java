package net.shelfsync.core.service;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 지터가 들어간 지수 백오프.
 * {@code factor * base^retries * uniform(1 - jitter, 1 + jitter)}, maxTime이 있으면 그 값으로 상한.
 * 동시에 재시도하는 워커들이 같은 시각에 몰리지 않게 한다.
 */
public final class Backoff {
    public static final double DEFAULT_FACTOR = 3;
    public static final double DEFAULT_BASE = 3;
    public static final double DEFAULT_JITTER = 0.3;

    private Backoff() {}

    /** 기본값(factor=3, base=3, jitter=0.3) */
    public static double seconds(int retries) {
        return seconds(retries, DEFAULT_FACTOR, DEFAULT_BASE, DEFAULT_JITTER, null);
    }

    public static double seconds(int retries, double factor, double base, double jitter, Double maxTime) {
        return seconds(retries, factor, base, jitter, maxTime, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random [0, 1) 난수 공급자 (테스트용 주입)
     */
    public static double seconds(int retries, double factor, double base, double jitter,
                                 Double maxTime, DoubleSupplier random) {
        if (retries < 0) throw new IllegalArgumentException("retries must be >= 0: " + retries);
        if (jitter < 0 || jitter > 1) throw new IllegalArgumentException("jitter must be in [0, 1]: " + jitter);
        if (factor < 0) throw new IllegalArgumentException("factor must be >= 0: " + factor);
        if (base <= 1) throw new IllegalArgumentException("base must be > 1: " + base);
        if (maxTime != null && maxTime < 0) throw new IllegalArgumentException("maxTime must be >= 0: " + maxTime);

        double delay = factor * Math.pow(base, retries);
        if (jitter > 0) {
            double low = 1 - jitter;
            delay *= low + (2 * jitter) * random.getAsDouble();
        }
        if (maxTime != null && delay > maxTime) {
            delay = maxTime;
        }
        return delay;
    }

    public static Duration duration(int retries, double factor, double base, double jitter, Double maxTime) {
        return toDuration(seconds(retries, factor, base, jitter, maxTime));
    }

    static Duration toDuration(double seconds) {
        if (Double.isInfinite(seconds) || seconds > Long.MAX_VALUE / 1_000_000_000d) {
            return Duration.ofSeconds(Long.MAX_VALUE / 1_000_000_000L);
        }
        return Duration.ofNanos(Math.round(seconds * 1_000_000_000d));
    }
}
