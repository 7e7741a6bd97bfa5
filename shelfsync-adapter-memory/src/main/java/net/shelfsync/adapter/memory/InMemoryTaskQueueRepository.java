package net.shelfsync.adapter.memory;

import net.shelfsync.core.model.CursorTaskArgs;
import net.shelfsync.core.model.TaskInvocation;
import net.shelfsync.core.model.TaskInvocation.Status;
import net.shelfsync.core.spi.Clock;
import net.shelfsync.core.spi.TaskQueueRepository;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;

public final class InMemoryTaskQueueRepository implements TaskQueueRepository {
    private final Map<Long, TaskInvocation> rows = new TreeMap<>();
    private final AtomicLong ids = new AtomicLong();
    private final Clock clock;

    public InMemoryTaskQueueRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized TaskInvocation enqueue(String taskName, String rootId, Long parentId,
                                               CursorTaskArgs args, Instant availableAt) {
        Instant now = clock.now();
        long id = ids.incrementAndGet();
        var inv = new TaskInvocation(id, taskName, rootId, parentId, args, Status.READY, 1L, null,
                availableAt != null ? availableAt : now, null, null, null, now, now, null);
        rows.put(id, inv);
        return inv;
    }

    @Override
    public synchronized Optional<TaskInvocation> claimReady(Duration lease, String workerToken) {
        Instant now = clock.now();
        Optional<TaskInvocation> next = rows.values().stream()
                .filter(t -> t.status() == Status.READY && !t.availableAt().isAfter(now))
                .min(Comparator.comparing(TaskInvocation::availableAt).thenComparing(TaskInvocation::id));
        if (next.isEmpty()) return Optional.empty();

        TaskInvocation t = next.get();
        var running = new TaskInvocation(t.id(), t.taskName(), t.rootId(), t.parentId(), t.args(), Status.RUNNING,
                t.attempt(), workerToken, t.availableAt(), now.plus(lease),
                t.startedAt() != null ? t.startedAt() : now, null, t.createdAt(), now, t.lastError());
        rows.put(t.id(), running);
        return Optional.of(running);
    }

    @Override
    public synchronized void heartbeat(long invocationId, Duration lease) {
        TaskInvocation t = rows.get(invocationId);
        if (t == null || t.status() != Status.RUNNING) return;
        Instant now = clock.now();
        rows.put(t.id(), new TaskInvocation(t.id(), t.taskName(), t.rootId(), t.parentId(), t.args(), t.status(),
                t.attempt(), t.workerToken(), t.availableAt(), now.plus(lease), t.startedAt(), t.finishedAt(),
                t.createdAt(), now, t.lastError()));
    }

    @Override
    public synchronized void markDone(long invocationId) {
        finish(invocationId, Status.DONE, null);
    }

    @Override
    public synchronized void markFailed(long invocationId, String lastError) {
        finish(invocationId, Status.FAILED, lastError);
    }

    @Override
    public synchronized void retryWithBackoff(long invocationId, Duration backoff, String lastError) {
        TaskInvocation t = rows.get(invocationId);
        if (t == null) return;
        rows.put(t.id(), requeued(t, clock.now(), backoff, lastError));
    }

    @Override
    public synchronized Optional<TaskInvocation> findById(long id) {
        return Optional.ofNullable(rows.get(id));
    }

    @Override
    public synchronized List<TaskInvocation> findByRoot(String rootId) {
        return rows.values().stream().filter(t -> rootId.equals(t.rootId())).toList();
    }

    @Override
    public synchronized int recoverExpiredLeases(Duration backoff, String reason) {
        Instant now = clock.now();
        int n = 0;
        for (TaskInvocation t : List.copyOf(rows.values())) {
            if (t.status() == Status.RUNNING && t.leaseUntil() != null && !t.leaseUntil().isAfter(now)) {
                rows.put(t.id(), requeued(t, now, backoff, reason));
                n++;
            }
        }
        return n;
    }

    @Override
    public synchronized int archiveFinishedOlderThan(Instant threshold) {
        int before = rows.size();
        rows.values().removeIf(t -> (t.status() == Status.DONE || t.status() == Status.FAILED)
                && t.finishedAt() != null && t.finishedAt().isBefore(threshold));
        return before - rows.size();
    }

    private void finish(long id, Status status, String lastError) {
        TaskInvocation t = rows.get(id);
        if (t == null) return;
        Instant now = clock.now();
        rows.put(id, new TaskInvocation(t.id(), t.taskName(), t.rootId(), t.parentId(), t.args(), status,
                t.attempt(), t.workerToken(), t.availableAt(), t.leaseUntil(), t.startedAt(), now,
                t.createdAt(), now, lastError != null ? lastError : t.lastError()));
    }

    private static TaskInvocation requeued(TaskInvocation t, Instant now, Duration backoff, String error) {
        return new TaskInvocation(t.id(), t.taskName(), t.rootId(), t.parentId(), t.args(), Status.READY,
                t.attempt() + 1, null, now.plus(backoff), null, t.startedAt(), null,
                t.createdAt(), now, error);
    }
}
