package net.shelfsync.adapter.memory;

import net.shelfsync.core.lock.LockResult;
import net.shelfsync.core.model.GuardStatus;
import net.shelfsync.core.model.Guarded;
import net.shelfsync.core.model.SessionGuard;
import net.shelfsync.core.model.UploadPart;
import net.shelfsync.core.model.UploadRecord;
import net.shelfsync.core.model.UploadState;
import net.shelfsync.core.spi.Clock;
import net.shelfsync.core.spi.UploadSessionRepository;

import java.io.ByteArrayOutputStream;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.function.Function;

/** 모든 메서드를 모니터 하나로 직렬화한다(가드 검사 + 변경이 한 단계). */
public final class InMemoryUploadSessionRepository implements UploadSessionRepository {

    private static final class Buffer {
        String uploadId;
        final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        final List<UploadPart> parts = new ArrayList<>();
    }

    private static final class Session {
        String token;
        Instant lockUntil;
        long updateNumber;
        UploadState state = UploadState.INITIAL;
        Instant expiresAt;
        final Map<String, Buffer> uploads = new LinkedHashMap<>();

        boolean lockedBy(String t, Instant now) {
            return token != null && token.equals(t) && lockUntil.isAfter(now);
        }

        Optional<String> owner(Instant now) {
            return token != null && lockUntil.isAfter(now) ? Optional.of(token) : Optional.empty();
        }
    }

    private final Map<String, Session> sessions = new HashMap<>();
    private final Clock clock;

    public InMemoryUploadSessionRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized LockResult acquire(String sessionKey, String token, Duration lockTtl, Duration sessionTtl) {
        Instant now = clock.now();
        Session s = sessions.computeIfAbsent(sessionKey, k -> new Session());
        Optional<String> owner = s.owner(now);
        if (owner.isPresent() && !owner.get().equals(token)) return LockResult.FAILED;

        LockResult result = owner.isPresent() ? LockResult.EXTENDED : LockResult.ACQUIRED;
        s.token = token;
        s.lockUntil = now.plus(lockTtl);
        s.expiresAt = now.plus(sessionTtl);
        return result;
    }

    @Override
    public synchronized boolean release(String sessionKey, String token) {
        Session s = sessions.get(sessionKey);
        if (s == null || !s.lockedBy(token, clock.now())) return false;
        s.token = null;
        s.lockUntil = null;
        return true;
    }

    @Override
    public synchronized boolean extend(String sessionKey, String token, Duration lockTtl) {
        Instant now = clock.now();
        Session s = sessions.get(sessionKey);
        if (s == null || !s.lockedBy(token, now)) return false;
        s.lockUntil = now.plus(lockTtl);
        return true;
    }

    @Override
    public synchronized Optional<String> lockOwner(String sessionKey) {
        Session s = sessions.get(sessionKey);
        return s == null ? Optional.empty() : s.owner(clock.now());
    }

    @Override
    public synchronized boolean delete(String sessionKey, String token) {
        Session s = sessions.get(sessionKey);
        if (s == null || !s.lockedBy(token, clock.now())) return false;
        sessions.remove(sessionKey);
        return true;
    }

    @Override
    public synchronized OptionalLong updateNumber(String sessionKey) {
        Session s = sessions.get(sessionKey);
        return s == null ? OptionalLong.empty() : OptionalLong.of(s.updateNumber);
    }

    @Override
    public synchronized Optional<UploadState> state(String sessionKey) {
        Session s = sessions.get(sessionKey);
        return s == null ? Optional.empty() : Optional.of(s.state);
    }

    @Override
    public synchronized Map<String, UploadRecord> get(String sessionKey) {
        Session s = sessions.get(sessionKey);
        if (s == null) return Map.of();
        Map<String, UploadRecord> out = new LinkedHashMap<>();
        s.uploads.forEach((k, b) -> out.put(k, new UploadRecord(b.uploadId, b.bytes.toByteArray(), b.parts)));
        return out;
    }

    @Override
    public synchronized Guarded<Map<String, Integer>> appendBuffers(String sessionKey, SessionGuard guard,
                                                                    Map<String, byte[]> data) {
        return guarded(sessionKey, guard, s -> {
            Map<String, Integer> sizes = new LinkedHashMap<>();
            data.forEach((k, bytes) -> {
                Buffer b = s.uploads.computeIfAbsent(k, x -> new Buffer());
                b.bytes.writeBytes(bytes);
                sizes.put(k, b.bytes.size());
            });
            return sizes;
        });
    }

    @Override
    public synchronized GuardStatus setUploadId(String sessionKey, SessionGuard guard, String outputKey, String uploadId) {
        return guarded(sessionKey, guard, s -> {
            s.uploads.computeIfAbsent(outputKey, x -> new Buffer()).uploadId = uploadId;
            return null;
        }).status();
    }

    @Override
    public synchronized GuardStatus addPartAndClearBuffer(String sessionKey, SessionGuard guard,
                                                          String outputKey, UploadPart part) {
        return guarded(sessionKey, guard, s -> {
            Buffer b = s.uploads.computeIfAbsent(outputKey, x -> new Buffer());
            b.parts.add(part);
            b.bytes.reset();
            return null;
        }).status();
    }

    @Override
    public synchronized GuardStatus clearUploads(String sessionKey, SessionGuard guard) {
        return guarded(sessionKey, guard, s -> {
            s.uploads.clear();
            return null;
        }).status();
    }

    @Override
    public synchronized GuardStatus setState(String sessionKey, SessionGuard guard, UploadState state) {
        return guarded(sessionKey, guard, s -> {
            s.state = state;
            return null;
        }).status();
    }

    @Override
    public synchronized List<String> findExpired(int limit) {
        Instant now = clock.now();
        List<String> out = new ArrayList<>();
        for (var e : sessions.entrySet()) {
            if (out.size() >= limit) break;
            Session s = e.getValue();
            if (s.expiresAt != null && !s.expiresAt.isAfter(now) && s.owner(now).isEmpty()) {
                out.add(e.getKey());
            }
        }
        return out;
    }

    @Override
    public synchronized boolean forceDelete(String sessionKey) {
        return sessions.remove(sessionKey) != null;
    }

    private <T> Guarded<T> guarded(String sessionKey, SessionGuard guard, Function<Session, T> op) {
        Instant now = clock.now();
        Session s = sessions.get(sessionKey);
        if (s == null || !s.lockedBy(guard.token(), now)) return Guarded.rejected(GuardStatus.NOT_OWNER);
        if (s.updateNumber != guard.expectedUpdateNumber()) return Guarded.rejected(GuardStatus.STALE);

        T value = op.apply(s);
        s.updateNumber++;
        s.expiresAt = now.plus(guard.sessionTtl());
        return Guarded.applied(value);
    }
}
