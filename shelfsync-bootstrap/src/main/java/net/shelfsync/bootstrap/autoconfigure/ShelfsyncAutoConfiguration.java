package net.shelfsync.bootstrap.autoconfigure;

import net.shelfsync.adapter.memory.DirectTxRunner;
import net.shelfsync.adapter.memory.InMemoryCoordinationStore;
import net.shelfsync.adapter.memory.InMemoryIdentifierSetRepository;
import net.shelfsync.adapter.memory.InMemoryObjectStorage;
import net.shelfsync.adapter.memory.InMemoryTaskQueueRepository;
import net.shelfsync.adapter.memory.InMemoryUploadSessionRepository;
import net.shelfsync.adapter.s3.S3Clients;
import net.shelfsync.adapter.s3.S3ObjectStorage;
import net.shelfsync.bootstrap.props.ShelfsyncProperties;
import net.shelfsync.core.lock.LeaseLockFactory;
import net.shelfsync.core.maintenance.MaintenanceService;
import net.shelfsync.core.service.RetryPolicy;
import net.shelfsync.core.service.TaskDispatchService;
import net.shelfsync.core.spi.ApplyCollaborator;
import net.shelfsync.core.spi.Clock;
import net.shelfsync.core.spi.CompletionListener;
import net.shelfsync.core.spi.CoordinationStore;
import net.shelfsync.core.spi.IdentifierSetRepository;
import net.shelfsync.core.spi.ObjectStorage;
import net.shelfsync.core.spi.PageSource;
import net.shelfsync.core.spi.RecordSerializer;
import net.shelfsync.core.spi.TaskQueueRepository;
import net.shelfsync.core.spi.TxRunner;
import net.shelfsync.core.spi.UploadSessionRepository;
import net.shelfsync.core.task.CursorExportTask;
import net.shelfsync.core.task.CursorImportTask;
import net.shelfsync.core.task.CursorTask;
import net.shelfsync.core.task.ExportLauncher;
import net.shelfsync.core.upload.UploadSessionFactory;
import net.shelfsync.core.upload.UploadSettings;
import net.shelfsync.integration.spring.ShelfsyncSpringConfig;
import net.shelfsync.integration.spring.sched.ShelfsyncSchedulers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

import java.net.URI;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@AutoConfiguration(after = {DataSourceAutoConfiguration.class, DataSourceTransactionManagerAutoConfiguration.class})
@EnableConfigurationProperties(ShelfsyncProperties.class)
public class ShelfsyncAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(ShelfsyncAutoConfiguration.class);

    // --- 저장소 선택: shelfsync.store = jdbc | memory ---

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "shelfsync", name = "store", havingValue = "jdbc", matchIfMissing = true)
    @Import(ShelfsyncSpringConfig.class) // integration-spring: repos/tx wiring
    static class JdbcStoreConfiguration {
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "shelfsync", name = "store", havingValue = "memory")
    static class MemoryStoreConfiguration {
        @Bean public TxRunner txRunner() { return new DirectTxRunner(); }
        @Bean public CoordinationStore coordinationStore(Clock clock) { return new InMemoryCoordinationStore(clock); }
        @Bean public IdentifierSetRepository identifierSetRepository() { return new InMemoryIdentifierSetRepository(); }
        @Bean public UploadSessionRepository uploadSessionRepository(Clock clock) { return new InMemoryUploadSessionRepository(clock); }
        @Bean public TaskQueueRepository taskQueueRepository(Clock clock) { return new InMemoryTaskQueueRepository(clock); }
    }

    // --- SPI 기본 구현(없으면) 제공 ---

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Instant::now;
    }

    @Bean
    @ConditionalOnMissingBean
    public CompletionListener completionListener() {
        return CompletionListener.none();
    }

    /** bucket이 설정돼 있으면 S3, 아니면 프로세스 로컬 저장소 */
    @Bean
    @ConditionalOnMissingBean
    public ObjectStorage objectStorage(ShelfsyncProperties props) {
        ShelfsyncProperties.S3 s3 = props.getS3();
        if (s3.getBucket() == null || s3.getBucket().isBlank()) {
            log.warn("shelfsync.s3.bucket not set, exported objects are kept in memory only");
            return new InMemoryObjectStorage();
        }
        URI endpoint = s3.getEndpoint() == null || s3.getEndpoint().isBlank() ? null : URI.create(s3.getEndpoint());
        var client = S3Clients.create(s3.getRegion(), endpoint, s3.isPathStyleAccess(),
                s3.getAccessKeyId(), s3.getSecretAccessKey());
        log.info("Object storage: s3 bucket={} region={} endpoint={}", s3.getBucket(), s3.getRegion(), endpoint);
        return new S3ObjectStorage(client, s3.getBucket());
    }

    // --- 코어 서비스 조립 ---

    @Bean
    @ConditionalOnMissingBean
    public LeaseLockFactory leaseLockFactory(CoordinationStore store, TxRunner tx, ShelfsyncProperties props) {
        return new LeaseLockFactory(store, tx, props.getLock().getTtl(), props.getLock().getRetryDelay());
    }

    @Bean
    @ConditionalOnMissingBean
    public UploadSessionFactory uploadSessionFactory(UploadSessionRepository sessions,
                                                     ObjectStorage storage,
                                                     TxRunner tx,
                                                     ShelfsyncProperties props) {
        var u = props.getUpload();
        var settings = new UploadSettings(u.getMinimumPartSize(), u.getContentType(), u.getLockTtl(), u.getSessionTtl());
        return new UploadSessionFactory(sessions, storage, tx, settings, props.getLock().getRetryDelay());
    }

    @Bean
    @ConditionalOnMissingBean
    public ExportLauncher exportLauncher(UploadSessionFactory uploads, LeaseLockFactory locks, Clock clock) {
        return new ExportLauncher(uploads, locks, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean({PageSource.class, ApplyCollaborator.class})
    public CursorImportTask cursorImportTask(PageSource source,
                                             ApplyCollaborator apply,
                                             LeaseLockFactory locks,
                                             IdentifierSetRepository identifiers,
                                             TxRunner tx,
                                             CompletionListener listener,
                                             Clock clock,
                                             ShelfsyncProperties props) {
        return new CursorImportTask(props.getTask().getImportLockType(), source, apply, locks, identifiers,
                tx, listener, clock, props.getLock().getRecordTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean({PageSource.class, RecordSerializer.class})
    public CursorExportTask cursorExportTask(PageSource source,
                                             RecordSerializer serializer,
                                             UploadSessionFactory uploads,
                                             LeaseLockFactory locks,
                                             CompletionListener listener,
                                             Clock clock) {
        return new CursorExportTask(source, serializer, uploads, locks, listener, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy taskRetryPolicy(ShelfsyncProperties props) {
        var b = props.getTask().getBackoff();
        return RetryPolicy.exponential(b.getFactor(), b.getBase(), b.getJitter(), b.getMaxTime());
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskDispatchService taskDispatch(TaskQueueRepository queue,
                                            TxRunner tx,
                                            RetryPolicy retry,
                                            ObjectProvider<CursorImportTask> importTask,
                                            ObjectProvider<CursorExportTask> exportTask,
                                            Clock clock,
                                            ShelfsyncProperties props) {
        Map<String, CursorTask> handlers = new LinkedHashMap<>();
        importTask.ifAvailable(t -> handlers.put(CursorImportTask.DEFAULT_NAME, t));
        exportTask.ifAvailable(t -> handlers.put(CursorExportTask.DEFAULT_NAME, t));

        String token = props.getWorker().getToken();
        if (token == null || token.isBlank()) token = "worker-" + UUID.randomUUID();
        log.info("Task handlers: {} (store={}, worker={})", handlers.keySet(), props.getStore(), token);
        return new TaskDispatchService(queue, tx, retry, handlers, props.getTask().getMaxRetries(), token, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public MaintenanceService maintenance(CoordinationStore locks,
                                          TaskQueueRepository queue,
                                          UploadSessionRepository sessions,
                                          ObjectStorage storage,
                                          TxRunner tx,
                                          Clock clock) {
        return new MaintenanceService(locks, queue, sessions, storage, tx, clock);
    }

    // --- 스케줄러 등록 (프로퍼티로 주기 제어) ---

    @Bean
    @ConditionalOnProperty(prefix = "shelfsync.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ShelfsyncSchedulers shelfsyncSchedulers(TaskDispatchService dispatch,
                                                   MaintenanceService maintenance,
                                                   ShelfsyncProperties props) {
        var s = new ShelfsyncSchedulers(dispatch, maintenance);

        // @Scheduled의 딜레이는 YAML 키(shelfsync.worker.poll-delay-ms / shelfsync.maintenance.delay-ms)에서 읽힘.
        // 나머지 파라미터만 세터로 주입
        s.setTaskLease(props.getTask().getLease());
        s.setMaxClaims(props.getWorker().getMaxClaims());
        s.setMaintBackoff(props.getMaintenance().getRetryBackoff());
        s.setFinishedTtl(props.getMaintenance().getFinishedTtl());
        s.setSessionBatch(props.getMaintenance().getSessionBatch());
        return s;
    }
}
