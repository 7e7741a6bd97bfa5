package net.shelfsync.core.spi;

import net.shelfsync.core.model.FeedRecord;

import java.util.Map;

/**
 * 레코드를 출력 키별 바이트로 직렬화 (예: 도서관별 파일 하나).
 * 잘못된 레코드는 RecordRejectedException으로 알린다.
 */
@FunctionalInterface
public interface RecordSerializer {
    Map<String, byte[]> serialize(String resourceId, FeedRecord record) throws Exception;
}
