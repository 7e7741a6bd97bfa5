package net.shelfsync.core.lock;

import net.shelfsync.core.error.LockException;
import net.shelfsync.core.service.RetryPolicy;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/** 저장소 없이 범위 락 정책(lock())과 블로킹 획득만 검증 */
class LeaseLockTest {

    /** 단일 슬롯 락: owner 참조 하나를 공유 */
    static final class SlotLock extends LeaseLock {
        final AtomicReference<String> owner;
        final AtomicInteger releases = new AtomicInteger();

        SlotLock(AtomicReference<String> owner, String token) {
            super(token, RetryPolicy.fixed(Duration.ofMillis(5)));
            this.owner = owner;
        }

        @Override public String key() { return "shelfsync:Test:slot"; }

        @Override public LockResult acquire() {
            if (owner.compareAndSet(null, token)) return LockResult.ACQUIRED;
            return token.equals(owner.get()) ? LockResult.EXTENDED : LockResult.FAILED;
        }

        @Override public boolean release() {
            releases.incrementAndGet();
            return owner.compareAndSet(token, null);
        }

        @Override public boolean extendTimeout() { return token.equals(owner.get()); }

        @Override public boolean locked(boolean byUs) {
            String o = owner.get();
            return byUs ? token.equals(o) : o != null;
        }
    }

    @Test
    void completed_releasesOnExit() throws Exception {
        var slot = new AtomicReference<String>();
        var lock = new SlotLock(slot, "a");

        Outcome<String> out = lock.lock(LockOptions.nonBlocking(), r -> {
            assertEquals(LockResult.ACQUIRED, r);
            return Outcome.completed("ok");
        });

        assertEquals("ok", out.valueOrNull());
        assertNull(slot.get());
    }

    @Test
    void superseded_takesNormalExitPath_andKeepsLockWhenReleaseOnExitDisabled() throws Exception {
        var slot = new AtomicReference<String>();
        var lock = new SlotLock(slot, "a");

        Outcome<String> out = lock.lock(LockOptions.nonBlocking().withReleaseOnExit(false),
                r -> Outcome.superseded("newer run"));

        assertFalse(out.failed());
        assertNull(out.valueOrNull());
        assertEquals("a", slot.get());
    }

    @Test
    void exception_releasesOnError_andPropagates() {
        var slot = new AtomicReference<String>();
        var lock = new SlotLock(slot, "a");

        var ex = assertThrows(IllegalStateException.class, () ->
                lock.lock(LockOptions.nonBlocking(), r -> { throw new IllegalStateException("boom"); }));

        assertEquals("boom", ex.getMessage());
        assertNull(slot.get());
    }

    @Test
    void failedOutcome_keepsLockWhenReleaseOnErrorDisabled() throws Exception {
        var slot = new AtomicReference<String>();
        var lock = new SlotLock(slot, "a");

        Outcome<Void> out = lock.lock(LockOptions.nonBlocking().withReleaseOnError(false), r -> Outcome.failed("bad"));

        assertTrue(out.failed());
        assertEquals("a", slot.get());
    }

    @Test
    void notHeld_bodyStillRuns_butNothingIsReleased() throws Exception {
        var slot = new AtomicReference<>("other");
        var lock = new SlotLock(slot, "a");

        Outcome<LockResult> out = lock.lock(LockOptions.nonBlocking(), Outcome::completed);

        assertEquals(LockResult.FAILED, out.valueOrNull());
        assertEquals(0, lock.releases.get());
        assertEquals("other", slot.get());
    }

    @Test
    void blocking_timesOut_whileOtherOwnerHolds() throws Exception {
        var slot = new AtomicReference<>("other");
        var lock = new SlotLock(slot, "a");

        long start = System.nanoTime();
        assertEquals(LockResult.TIMED_OUT, lock.acquire(true, Duration.ofMillis(60)));
        assertTrue(Duration.ofNanos(System.nanoTime() - start).toMillis() >= 55);
    }

    @Test
    void blocking_acquiresOnceReleased() throws Exception {
        var slot = new AtomicReference<>("other");
        var lock = new SlotLock(slot, "a");

        Thread releaser = new Thread(() -> {
            try { Thread.sleep(30); } catch (InterruptedException ignore) { }
            slot.set(null);
        });
        releaser.start();

        assertEquals(LockResult.ACQUIRED, lock.acquire(true, Duration.ofSeconds(5)));
        releaser.join();
    }

    @Test
    void reacquire_bySameToken_isExtension() throws Exception {
        var slot = new AtomicReference<String>();
        var lock = new SlotLock(slot, "a");
        assertEquals(LockResult.ACQUIRED, lock.acquire());
        assertEquals(LockResult.EXTENDED, lock.acquire());
        assertEquals(LockResult.FAILED, new SlotLock(slot, "b").acquire());
    }

    @Test
    void negativeTimeout_isRejected() {
        var lock = new SlotLock(new AtomicReference<>(), "a");
        assertThrows(LockException.class, () -> lock.acquire(true, Duration.ofSeconds(-1)));
    }
}
