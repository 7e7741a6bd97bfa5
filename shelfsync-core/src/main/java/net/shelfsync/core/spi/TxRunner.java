package net.shelfsync.core.spi;

import java.util.concurrent.Callable;

/**
 * 저장소 호출을 감싸는 트랜잭션 경계.
 * 락과 업로드 세션 변경은 다른 워커가 즉시 봐야 하므로 requiresNew로 따로 커밋한다.
 */
public interface TxRunner {
    /** 진행 중인 트랜잭션이 있으면 참여, 없으면 새로 시작 */
    <T> T required(Callable<T> body) throws Exception;

    /** 바깥 트랜잭션과 무관하게 새 트랜잭션에서 실행하고 커밋 */
    <T> T requiresNew(Callable<T> body) throws Exception;
}
