package net.shelfsync.adapter.jdbc;

import net.shelfsync.core.spi.TxRunner;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.Callable;

public final class JdbcTxRunner implements TxRunner {
    private final DataSource ds;

    public JdbcTxRunner(DataSource ds) { this.ds = ds; }

    @Override
    public <T> T required(Callable<T> body) throws Exception {
        if (TxContext.active()) {
            // 이미 진행 중인 트랜잭션에 참여
            return body.call();
        }
        return inNewTransaction(body);
    }

    @Override
    public <T> T requiresNew(Callable<T> body) throws Exception {
        // 바깥 트랜잭션은 그대로 두고 새 커넥션으로 실행. 락/세션 변경은 즉시 다른 워커에 보여야 한다
        return inNewTransaction(body);
    }

    private <T> T inNewTransaction(Callable<T> body) throws Exception {
        try (Connection c = ds.getConnection()) {
            boolean prevAuto = c.getAutoCommit();
            c.setAutoCommit(false);
            Connection suspended = TxContext.bind(c);
            try {
                T r = body.call();
                c.commit();
                return r;
            } catch (Throwable t) {            // Throwable로 롤백 보장
                safeRollback(c, t);
                sneakyThrow(t);                 // 검사/비검사 구분없이 재던짐
                return null; // unreachable
            } finally {
                TxContext.restore(suspended);
                restoreAutoCommit(c, prevAuto);
            }
        }
    }

    private static void safeRollback(Connection c, Throwable original) {
        try { c.rollback(); } catch (SQLException e) { original.addSuppressed(e); }
    }

    private static void restoreAutoCommit(Connection c, boolean prevAuto) throws SQLException {
        if (c.getAutoCommit() != prevAuto) c.setAutoCommit(prevAuto);
    }

    @SuppressWarnings("unchecked")
    private static <E extends Throwable> void sneakyThrow(Throwable t) throws E { throw (E) t; }
}
