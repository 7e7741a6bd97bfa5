package net.shelfsync.core.spi;

import net.shelfsync.core.model.Page;

/**
 * 외부 페이지네이션 피드. 일시적 실패는 TransientFailureException으로 던진다.
 */
@FunctionalInterface
public interface PageSource {
    /** @param cursor null이면 첫 페이지 */
    Page fetch(String resourceId, String cursor) throws Exception;
}
