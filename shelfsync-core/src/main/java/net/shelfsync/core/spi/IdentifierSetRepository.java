package net.shelfsync.core.spi;

import java.util.Collection;
import java.util.Set;

/** 여러 태스크 호출에 걸쳐 누적되는 식별자 집합 (reap 단계 입력) */
public interface IdentifierSetRepository {
    /** @return 새로 추가된 식별자 수 */
    int add(String setKey, Collection<String> identifiers) throws Exception;

    Set<String> members(String setKey) throws Exception;

    int size(String setKey) throws Exception;

    boolean delete(String setKey) throws Exception;
}
