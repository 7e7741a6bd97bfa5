package net.shelfsync.core.task;

/**
 * @param rootId  같은 논리 태스크(연속 호출, 재시도 포함)가 공유하는 id
 * @param attempt 1부터. 재시도마다 증가
 */
public record TaskContext(String taskName, Long invocationId, String rootId, long attempt) {

    /** 큐 없이 직접 실행할 때 */
    public static TaskContext direct(String taskName, String rootId) {
        return new TaskContext(taskName, null, rootId, 1);
    }
}
