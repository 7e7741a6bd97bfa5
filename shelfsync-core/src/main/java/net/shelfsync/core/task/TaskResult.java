package net.shelfsync.core.task;

import net.shelfsync.core.model.CursorTaskArgs;
import net.shelfsync.core.model.PageSummary;

/**
 * 핸들러 한 번 실행의 결과. 큐 어댑터(TaskDispatchService)가 해석한다.
 * Continue는 "현재 호출을 다음 인자로 교체"를 뜻한다.
 */
public interface TaskResult {

    record Done(PageSummary summary) implements TaskResult {}

    record Continue(CursorTaskArgs next, PageSummary summary) implements TaskResult {}

    /** 다른 호출이 같은 리소스를 처리 중이라 아무것도 하지 않음 */
    record Skipped(String reason) implements TaskResult {}

    /** 더 새로운 호출이 세션을 가져감. 정리는 그쪽 몫 */
    record Superseded(String reason) implements TaskResult {}

    static TaskResult done(PageSummary summary) { return new Done(summary); }

    static TaskResult next(CursorTaskArgs next, PageSummary summary) { return new Continue(next, summary); }

    static TaskResult skipped(String reason) { return new Skipped(reason); }

    static TaskResult superseded(String reason) { return new Superseded(reason); }
}
