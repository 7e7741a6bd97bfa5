package net.shelfsync.core.task;

import net.shelfsync.core.model.CursorTaskArgs;

/**
 * 페이지 하나를 처리하고 이어갈지 결정하는 태스크 핸들러.
 * 호출 사이에 공유 메모리는 없다. 이어가는 데 필요한 값은 전부 args로 넘긴다.
 */
@FunctionalInterface
public interface CursorTask {
    TaskResult run(CursorTaskArgs args, TaskContext ctx) throws Exception;

    /** 호출이 최종 FAILED로 끝난 뒤 한 번 불린다(재시도 소진 포함). 순회 단위 자원 정리용 */
    default void onFailed(CursorTaskArgs args, TaskContext ctx, Exception error) throws Exception {
    }
}
