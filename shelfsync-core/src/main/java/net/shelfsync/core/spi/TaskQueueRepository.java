package net.shelfsync.core.spi;

import net.shelfsync.core.model.CursorTaskArgs;
import net.shelfsync.core.model.TaskInvocation;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface TaskQueueRepository {
    /** READY 상태로 적재. parentId는 self-requeue 시 이전 호출 id */
    TaskInvocation enqueue(String taskName, String rootId, Long parentId,
                           CursorTaskArgs args, Instant availableAt) throws Exception;

    /** READY + available_at<=now 중 하나를 선점(RUNNING 전환, lease_until 설정) */
    Optional<TaskInvocation> claimReady(Duration lease, String workerToken) throws Exception;

    /** 하트비트: lease 연장 */
    void heartbeat(long invocationId, Duration lease) throws Exception;

    void markDone(long invocationId) throws Exception;

    void markFailed(long invocationId, String lastError) throws Exception;

    /** 실패 후 백오프 재시도: READY로 되돌리고 available_at = now + backoff, attempt++ */
    void retryWithBackoff(long invocationId, Duration backoff, String lastError) throws Exception;

    Optional<TaskInvocation> findById(long id) throws Exception;

    List<TaskInvocation> findByRoot(String rootId) throws Exception;

    // Maintenance용
    /** lease_until 만료된 RUNNING을 READY로 되돌리고 attempt+1, last_error 세팅 */
    int recoverExpiredLeases(Duration backoff, String reason) throws Exception;

    /** 오래된 DONE/FAILED 호출 삭제 */
    int archiveFinishedOlderThan(Instant threshold) throws Exception;
}
