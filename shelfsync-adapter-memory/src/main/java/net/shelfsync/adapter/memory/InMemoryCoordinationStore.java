package net.shelfsync.adapter.memory;

import net.shelfsync.core.spi.Clock;
import net.shelfsync.core.spi.CoordinationStore;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** ConcurrentHashMap.compute로 키 단위 check-then-act를 원자적으로 수행 */
public final class InMemoryCoordinationStore implements CoordinationStore {
    private record Entry(String owner, Instant expiresAt) {
        boolean live(Instant now) { return expiresAt == null || expiresAt.isAfter(now); }
    }

    private final Map<String, Entry> map = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCoordinationStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<String> setIfAbsent(String key, String value, Duration ttl) {
        final String[] previous = {null};
        Instant now = clock.now();
        map.compute(key, (k, cur) -> {
            if (cur != null && cur.live(now)) {
                previous[0] = cur.owner();
                return cur;
            }
            return new Entry(value, ttl == null ? null : now.plus(ttl));
        });
        return Optional.ofNullable(previous[0]);
    }

    @Override
    public boolean compareAndDelete(String key, String expected) {
        final boolean[] deleted = {false};
        Instant now = clock.now();
        map.computeIfPresent(key, (k, cur) -> {
            if (cur.live(now) && cur.owner().equals(expected)) {
                deleted[0] = true;
                return null;
            }
            return cur;
        });
        return deleted[0];
    }

    @Override
    public boolean compareAndExpire(String key, String expected, Duration ttl) {
        final boolean[] extended = {false};
        Instant now = clock.now();
        map.computeIfPresent(key, (k, cur) -> {
            if (cur.live(now) && cur.owner().equals(expected)) {
                extended[0] = true;
                return new Entry(cur.owner(), ttl == null ? null : now.plus(ttl));
            }
            return cur;
        });
        return extended[0];
    }

    @Override
    public Optional<String> get(String key) {
        Entry e = map.get(key);
        return e != null && e.live(clock.now()) ? Optional.of(e.owner()) : Optional.empty();
    }

    @Override
    public int purgeExpired() {
        Instant now = clock.now();
        int before = map.size();
        map.entrySet().removeIf(e -> !e.getValue().live(now));
        return Math.max(0, before - map.size());
    }
}
