package net.shelfsync.core.spi;

import net.shelfsync.core.model.ApplyResult;
import net.shelfsync.core.model.FeedRecord;

/** 레코드 단위 카탈로그 반영. 레코드 식별자 락 안에서 호출된다. */
@FunctionalInterface
public interface ApplyCollaborator {
    ApplyResult apply(FeedRecord record) throws Exception;
}
