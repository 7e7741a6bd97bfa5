package net.shelfsync.core.spi;

import net.shelfsync.core.lock.LockResult;
import net.shelfsync.core.model.GuardStatus;
import net.shelfsync.core.model.Guarded;
import net.shelfsync.core.model.SessionGuard;
import net.shelfsync.core.model.UploadPart;
import net.shelfsync.core.model.UploadRecord;
import net.shelfsync.core.model.UploadState;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * 업로드 세션 저장소.
 * 변경 메서드는 모두 (소유 토큰, 기대 update number) 가드를 한 번에 검사하고,
 * 통과하면 UPDATE_NUMBER를 1 증가시키고 세션 만료시각을 갱신한다.
 */
public interface UploadSessionRepository {
    /** 세션이 없으면 INITIAL 상태로 만들고 락을 잡는다. 이미 같은 토큰이면 연장(EXTENDED). */
    LockResult acquire(String sessionKey, String token, Duration lockTtl, Duration sessionTtl) throws Exception;

    boolean release(String sessionKey, String token) throws Exception;

    boolean extend(String sessionKey, String token, Duration lockTtl) throws Exception;

    Optional<String> lockOwner(String sessionKey) throws Exception;

    /** 락 소유자만 세션 전체(버퍼/파트 포함) 삭제 가능 */
    boolean delete(String sessionKey, String token) throws Exception;

    OptionalLong updateNumber(String sessionKey) throws Exception;

    Optional<UploadState> state(String sessionKey) throws Exception;

    Map<String, UploadRecord> get(String sessionKey) throws Exception;

    /** @return 출력 키별 누적 버퍼 크기 */
    Guarded<Map<String, Integer>> appendBuffers(String sessionKey, SessionGuard guard,
                                                Map<String, byte[]> data) throws Exception;

    GuardStatus setUploadId(String sessionKey, SessionGuard guard, String outputKey, String uploadId) throws Exception;

    GuardStatus addPartAndClearBuffer(String sessionKey, SessionGuard guard, String outputKey, UploadPart part) throws Exception;

    GuardStatus clearUploads(String sessionKey, SessionGuard guard) throws Exception;

    GuardStatus setState(String sessionKey, SessionGuard guard, UploadState state) throws Exception;

    // --- maintenance ---

    /** 세션 만료시각이 지난 세션 키 */
    List<String> findExpired(int limit) throws Exception;

    /** 소유권 확인 없이 삭제(만료 세션 정리용) */
    boolean forceDelete(String sessionKey) throws Exception;
}
