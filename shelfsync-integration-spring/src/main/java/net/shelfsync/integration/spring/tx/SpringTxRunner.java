package net.shelfsync.integration.spring.tx;

import net.shelfsync.adapter.jdbc.TxContext;
import net.shelfsync.core.spi.TxRunner;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.concurrent.Callable;

public final class SpringTxRunner implements TxRunner {
    private final PlatformTransactionManager tm;
    private final DataSource ds;

    public SpringTxRunner(PlatformTransactionManager tm, DataSource ds) {
        this.tm = tm;
        this.ds = ds;
    }

    @Override
    public <T> T required(Callable<T> body) throws Exception {
        return execute(TransactionDefinition.PROPAGATION_REQUIRED, body);
    }

    @Override
    public <T> T requiresNew(Callable<T> body) throws Exception {
        return execute(TransactionDefinition.PROPAGATION_REQUIRES_NEW, body);
    }

    private <T> T execute(int propagation, Callable<T> body) throws Exception {
        var tpl = new TransactionTemplate(tm);
        tpl.setPropagationBehavior(propagation);

        try {
            return tpl.execute(status -> {
                // 스프링 트랜잭션의 물리 커넥션을 끌어와 TxContext에 꽂아줌.
                // REQUIRES_NEW면 새 커넥션이므로 바깥 컨텍스트는 잠시 치워두고 복원한다
                Connection con = DataSourceUtils.getConnection(ds);
                Connection outer = TxContext.bind(con);
                try {
                    return body.call();
                } catch (RuntimeException re) {
                    throw re;
                } catch (Exception e) {
                    throw new CheckedBodyException(e);
                } finally {
                    TxContext.restore(outer);
                    DataSourceUtils.releaseConnection(con, ds); // 스프링이 관리하는 방식으로 반납
                }
            });
        } catch (CheckedBodyException e) {
            // 롤백은 끝났고 원래 검사 예외를 그대로 돌려준다
            throw (Exception) e.getCause();
        }
    }

    private static final class CheckedBodyException extends RuntimeException {
        CheckedBodyException(Exception cause) {
            super(cause);
        }
    }
}
