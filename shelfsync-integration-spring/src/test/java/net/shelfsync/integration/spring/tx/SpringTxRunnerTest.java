package net.shelfsync.integration.spring.tx;

import net.shelfsync.adapter.jdbc.TxContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;

import javax.sql.DataSource;
import java.io.IOException;
import java.sql.Connection;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SpringTxRunnerTest {

    DataSource ds;
    Connection outer;
    Connection inner;
    SpringTxRunner tx;

    @BeforeEach
    void setUp() throws Exception {
        ds = mock(DataSource.class);
        outer = mock(Connection.class);
        inner = mock(Connection.class);
        when(ds.getConnection()).thenReturn(outer, inner);
        tx = new SpringTxRunner(new DataSourceTransactionManager(ds), ds);
    }

    @AfterEach
    void tearDown() {
        TxContext.clear();
    }

    @Test
    void required_bindsConnection_andCommits() throws Exception {
        Connection seen = tx.required(TxContext::get);

        assertSame(outer, seen);
        assertNull(TxContext.get(), "context cleared after the transaction");
        verify(outer).commit();
    }

    @Test
    void requiresNew_usesOwnConnection_andRestoresOuter() throws Exception {
        tx.required(() -> {
            Connection nested = tx.requiresNew(TxContext::get);
            assertSame(inner, nested);
            assertSame(outer, TxContext.get(), "outer connection restored");
            return null;
        });

        verify(inner).commit();
        verify(outer).commit();
    }

    @Test
    void nestedRequired_joinsOuterConnection() throws Exception {
        tx.required(() -> {
            assertSame(outer, tx.required(TxContext::get));
            return null;
        });
        verify(ds, times(1)).getConnection();
    }

    @Test
    void checkedException_rollsBack_andPropagatesUnwrapped() throws Exception {
        IOException boom = new IOException("feed closed");

        IOException thrown = assertThrows(IOException.class, () -> tx.required(() -> {
            throw boom;
        }));

        assertSame(boom, thrown);
        verify(outer).rollback();
        verify(outer, never()).commit();
    }

    @Test
    void runtimeException_rollsBack() throws Exception {
        assertThrows(IllegalStateException.class, () -> tx.requiresNew(() -> {
            throw new IllegalStateException("boom");
        }));
        verify(outer).rollback();
    }
}
