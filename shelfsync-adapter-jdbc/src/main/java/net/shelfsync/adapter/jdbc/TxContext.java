package net.shelfsync.adapter.jdbc;

import java.sql.Connection;

/**
 * 현재 스레드에 묶인 트랜잭션 커넥션.
 * JDBC 저장소는 커넥션을 직접 열지 않고 여기 묶인 것만 쓴다.
 * 러너는 bind()로 교체하고 끝나면 restore()로 이전 커넥션을 되돌린다(REQUIRES_NEW 중첩).
 */
public final class TxContext {
    private static final ThreadLocal<Connection> CURRENT = new ThreadLocal<>();

    private TxContext() {}

    public static Connection get() { return CURRENT.get(); }

    public static boolean active() { return CURRENT.get() != null; }

    /** @return 교체되기 전 커넥션(없으면 null) */
    public static Connection bind(Connection c) {
        Connection previous = CURRENT.get();
        CURRENT.set(c);
        return previous;
    }

    public static void restore(Connection previous) {
        if (previous == null) CURRENT.remove();
        else CURRENT.set(previous);
    }

    public static void clear() { CURRENT.remove(); }
}
