package net.shelfsync.integration.spring;

import net.shelfsync.adapter.jdbc.repo.JdbcCoordinationStore;
import net.shelfsync.adapter.jdbc.repo.JdbcIdentifierSetRepository;
import net.shelfsync.adapter.jdbc.repo.JdbcTaskQueueRepository;
import net.shelfsync.adapter.jdbc.repo.JdbcUploadSessionRepository;
import net.shelfsync.core.spi.CoordinationStore;
import net.shelfsync.core.spi.IdentifierSetRepository;
import net.shelfsync.core.spi.TaskQueueRepository;
import net.shelfsync.core.spi.TxRunner;
import net.shelfsync.core.spi.UploadSessionRepository;
import net.shelfsync.integration.spring.tx.SpringTxRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

/** JDBC 저장소 구성. 저장소는 TxContext 커넥션만 쓰므로 DataSource는 TxRunner만 안다 */
@Configuration
public class ShelfsyncSpringConfig {

    // TxRunner (Spring)
    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    // Repository 구현 등록 (adapter-jdbc 재사용)
    @Bean public CoordinationStore coordinationStore() { return new JdbcCoordinationStore(); }
    @Bean public IdentifierSetRepository identifierSetRepository() { return new JdbcIdentifierSetRepository(); }
    @Bean public UploadSessionRepository uploadSessionRepository() { return new JdbcUploadSessionRepository(); }
    @Bean public TaskQueueRepository taskQueueRepository() { return new JdbcTaskQueueRepository(); }
}
