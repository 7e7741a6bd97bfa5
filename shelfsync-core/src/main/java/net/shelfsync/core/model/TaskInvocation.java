package net.shelfsync.core.model;

import java.time.Instant;

public record TaskInvocation(
        Long id,
        String taskName,
        String rootId,          // 같은 논리 태스크의 연속 호출은 같은 rootId
        Long parentId,          // self-requeue 이전 호출
        CursorTaskArgs args,
        Status status,
        Long attempt,
        String workerToken,
        Instant availableAt,
        Instant leaseUntil,
        Instant startedAt,
        Instant finishedAt,
        Instant createdAt,
        Instant updatedAt,
        String lastError
) {
    public enum Status {
        READY, RUNNING, DONE, FAILED, UNKNOWN;

        public static Status from(String s) {
            if (s == null) return UNKNOWN;
            try { return Status.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return UNKNOWN; }
        }
        public String code() { return name(); }
    }
}
