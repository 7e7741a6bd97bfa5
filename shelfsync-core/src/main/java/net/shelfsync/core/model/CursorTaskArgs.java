package net.shelfsync.core.model;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 커서 태스크 호출 인자. 다음 호출이 이어서 처리하는 데 필요한 값은 전부 여기 실린다.
 *
 * @param runId              논리적 순회 하나의 id. 첫 호출에서 정해지고 이후 그대로 전달된다
 * @param cursor             null = 피드 처음
 * @param force              unchanged 레코드를 만나도 멈추지 않는다
 * @param collectIdentifiers 본 식별자를 전부 모은다(reap 용). 역시 끝까지 순회한다
 * @param updateNumber       내보내기 세션의 update number. 다른 호출이 세션을 바꿨는지 확인용
 * @param startedAt          순회 시작 시각
 */
public record CursorTaskArgs(String resourceId,
                             String runId,
                             String cursor,
                             boolean force,
                             boolean collectIdentifiers,
                             Long updateNumber,
                             Instant startedAt,
                             Map<String, String> attributes) {
    public CursorTaskArgs {
        Objects.requireNonNull(resourceId, "resourceId");
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static CursorTaskArgs start(String resourceId) {
        return new CursorTaskArgs(resourceId, null, null, false, false, null, null, Map.of());
    }

    /** 끝까지 순회해야 하는지 */
    public boolean exhaustive() {
        return force || collectIdentifiers;
    }

    public CursorTaskArgs withRunId(String runId) {
        return new CursorTaskArgs(resourceId, runId, cursor, force, collectIdentifiers, updateNumber, startedAt, attributes);
    }

    public CursorTaskArgs withCursor(String cursor) {
        return new CursorTaskArgs(resourceId, runId, cursor, force, collectIdentifiers, updateNumber, startedAt, attributes);
    }

    public CursorTaskArgs withForce(boolean force) {
        return new CursorTaskArgs(resourceId, runId, cursor, force, collectIdentifiers, updateNumber, startedAt, attributes);
    }

    public CursorTaskArgs withCollectIdentifiers(boolean collect) {
        return new CursorTaskArgs(resourceId, runId, cursor, force, collect, updateNumber, startedAt, attributes);
    }

    public CursorTaskArgs withUpdateNumber(Long updateNumber) {
        return new CursorTaskArgs(resourceId, runId, cursor, force, collectIdentifiers, updateNumber, startedAt, attributes);
    }

    public CursorTaskArgs withStartedAt(Instant startedAt) {
        return new CursorTaskArgs(resourceId, runId, cursor, force, collectIdentifiers, updateNumber, startedAt, attributes);
    }

    public CursorTaskArgs withAttribute(String name, String value) {
        var copy = new HashMap<>(attributes);
        copy.put(name, value);
        return new CursorTaskArgs(resourceId, runId, cursor, force, collectIdentifiers, updateNumber, startedAt, copy);
    }
}
