package net.shelfsync.core.spi;

import java.time.Duration;
import java.util.Optional;

/**
 * 리스 락 레코드 저장소. 모든 메서드는 TxRunner 컨텍스트 안에서 호출된다.
 * 만료된 레코드는 존재하지 않는 것으로 취급한다.
 */
public interface CoordinationStore {
    /**
     * key가 없으면(또는 만료됐으면) value로 생성한다.
     *
     * @param ttl null이면 만료 없음
     * @return 이미 살아있는 레코드가 있으면 그 소유자 토큰, 새로 생성했으면 empty
     */
    Optional<String> setIfAbsent(String key, String value, Duration ttl) throws Exception;

    /** 현재 값이 expected일 때만 삭제 */
    boolean compareAndDelete(String key, String expected) throws Exception;

    /** 현재 값이 expected일 때만 만료시각을 now + ttl로 갱신 */
    boolean compareAndExpire(String key, String expected, Duration ttl) throws Exception;

    Optional<String> get(String key) throws Exception;

    /** 만료된 레코드 일괄 삭제(maintenance) */
    int purgeExpired() throws Exception;
}
