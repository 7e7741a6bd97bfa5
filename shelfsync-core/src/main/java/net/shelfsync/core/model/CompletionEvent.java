package net.shelfsync.core.model;

import java.time.Instant;
import java.util.Set;

/**
 * @param identifierSetKey collectIdentifiers 순회였다면 수집된 식별자 집합 키, 아니면 null
 * @param exhausted        마지막 페이지까지 갔으면 true, unchanged로 조기 종료했으면 false
 * @param outputKeys       내보내기 순회에서 완성된 오브젝트 키
 */
public record CompletionEvent(String taskName,
                              String resourceId,
                              String runId,
                              Instant startedAt,
                              Instant finishedAt,
                              boolean exhausted,
                              String identifierSetKey,
                              Set<String> outputKeys) {
    public CompletionEvent {
        outputKeys = outputKeys == null ? Set.of() : Set.copyOf(outputKeys);
    }
}
