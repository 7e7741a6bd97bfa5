package net.shelfsync.bootstrap.props;

import net.shelfsync.core.service.Backoff;
import net.shelfsync.core.upload.UploadSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties("shelfsync")
public class ShelfsyncProperties {
    /** jdbc | memory */
    private String store = "jdbc";
    private Lock lock = new Lock();
    private Upload upload = new Upload();
    private Task task = new Task();
    private Worker worker = new Worker();
    private Maintenance maintenance = new Maintenance();
    private S3 s3 = new S3();

    public String getStore() {
        return store;
    }

    public void setStore(String store) {
        this.store = store;
    }

    public Lock getLock() {
        return lock;
    }

    public void setLock(Lock lock) {
        this.lock = lock;
    }

    public Upload getUpload() {
        return upload;
    }

    public void setUpload(Upload upload) {
        this.upload = upload;
    }

    public Task getTask() {
        return task;
    }

    public void setTask(Task task) {
        this.task = task;
    }

    public Worker getWorker() {
        return worker;
    }

    public void setWorker(Worker worker) {
        this.worker = worker;
    }

    public Maintenance getMaintenance() {
        return maintenance;
    }

    public void setMaintenance(Maintenance maintenance) {
        this.maintenance = maintenance;
    }

    public S3 getS3() {
        return s3;
    }

    public void setS3(S3 s3) {
        this.s3 = s3;
    }

    public static class Lock {
        private Duration ttl = Duration.ofMinutes(5);
        private Duration retryDelay = Duration.ofMillis(100);
        /** 레코드 락 블로킹 획득 한도 */
        private Duration recordTimeout = Duration.ofSeconds(30);

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public Duration getRetryDelay() {
            return retryDelay;
        }

        public void setRetryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
        }

        public Duration getRecordTimeout() {
            return recordTimeout;
        }

        public void setRecordTimeout(Duration recordTimeout) {
            this.recordTimeout = recordTimeout;
        }
    }

    public static class Upload {
        private int minimumPartSize = UploadSettings.S3_MINIMUM_PART_SIZE;
        private String contentType = "application/octet-stream";
        private Duration lockTtl = Duration.ofMinutes(5);
        private Duration sessionTtl = Duration.ofMinutes(30);

        public int getMinimumPartSize() {
            return minimumPartSize;
        }

        public void setMinimumPartSize(int minimumPartSize) {
            this.minimumPartSize = minimumPartSize;
        }

        public String getContentType() {
            return contentType;
        }

        public void setContentType(String contentType) {
            this.contentType = contentType;
        }

        public Duration getLockTtl() {
            return lockTtl;
        }

        public void setLockTtl(Duration lockTtl) {
            this.lockTtl = lockTtl;
        }

        public Duration getSessionTtl() {
            return sessionTtl;
        }

        public void setSessionTtl(Duration sessionTtl) {
            this.sessionTtl = sessionTtl;
        }
    }

    public static class Task {
        private Duration lease = Duration.ofMinutes(5);
        private long maxRetries = 5;
        private String importLockType = "CollectionImport";
        private BackoffDef backoff = new BackoffDef();

        public Duration getLease() {
            return lease;
        }

        public void setLease(Duration lease) {
            this.lease = lease;
        }

        public long getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(long maxRetries) {
            this.maxRetries = maxRetries;
        }

        public String getImportLockType() {
            return importLockType;
        }

        public void setImportLockType(String importLockType) {
            this.importLockType = importLockType;
        }

        public BackoffDef getBackoff() {
            return backoff;
        }

        public void setBackoff(BackoffDef backoff) {
            this.backoff = backoff;
        }
    }

    public static class BackoffDef {
        private double factor = Backoff.DEFAULT_FACTOR;
        private double base = Backoff.DEFAULT_BASE;
        private double jitter = Backoff.DEFAULT_JITTER;
        private Duration maxTime;   // null = 상한 없음

        public double getFactor() {
            return factor;
        }

        public void setFactor(double factor) {
            this.factor = factor;
        }

        public double getBase() {
            return base;
        }

        public void setBase(double base) {
            this.base = base;
        }

        public double getJitter() {
            return jitter;
        }

        public void setJitter(double jitter) {
            this.jitter = jitter;
        }

        public Duration getMaxTime() {
            return maxTime;
        }

        public void setMaxTime(Duration maxTime) {
            this.maxTime = maxTime;
        }
    }

    public static class Worker {
        private boolean enabled = true;
        private String token;       // null이면 호스트명 기반으로 생성
        private long pollDelayMs = 1000;
        private int maxClaims = 10;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = token;
        }

        public long getPollDelayMs() {
            return pollDelayMs;
        }

        public void setPollDelayMs(long pollDelayMs) {
            this.pollDelayMs = pollDelayMs;
        }

        public int getMaxClaims() {
            return maxClaims;
        }

        public void setMaxClaims(int maxClaims) {
            this.maxClaims = maxClaims;
        }
    }

    public static class Maintenance {
        private long delayMs = 60000;
        private Duration retryBackoff = Duration.ofSeconds(10);
        private Duration finishedTtl = Duration.ofDays(7);
        private int sessionBatch = 100;

        public long getDelayMs() {
            return delayMs;
        }

        public void setDelayMs(long delayMs) {
            this.delayMs = delayMs;
        }

        public Duration getRetryBackoff() {
            return retryBackoff;
        }

        public void setRetryBackoff(Duration retryBackoff) {
            this.retryBackoff = retryBackoff;
        }

        public Duration getFinishedTtl() {
            return finishedTtl;
        }

        public void setFinishedTtl(Duration finishedTtl) {
            this.finishedTtl = finishedTtl;
        }

        public int getSessionBatch() {
            return sessionBatch;
        }

        public void setSessionBatch(int sessionBatch) {
            this.sessionBatch = sessionBatch;
        }
    }

    public static class S3 {
        private String bucket;
        private String region = "us-east-1";
        private String endpoint;
        private boolean pathStyleAccess = false;
        private String accessKeyId;
        private String secretAccessKey;

        public String getBucket() {
            return bucket;
        }

        public void setBucket(String bucket) {
            this.bucket = bucket;
        }

        public String getRegion() {
            return region;
        }

        public void setRegion(String region) {
            this.region = region;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public boolean isPathStyleAccess() {
            return pathStyleAccess;
        }

        public void setPathStyleAccess(boolean pathStyleAccess) {
            this.pathStyleAccess = pathStyleAccess;
        }

        public String getAccessKeyId() {
            return accessKeyId;
        }

        public void setAccessKeyId(String accessKeyId) {
            this.accessKeyId = accessKeyId;
        }

        public String getSecretAccessKey() {
            return secretAccessKey;
        }

        public void setSecretAccessKey(String secretAccessKey) {
            this.secretAccessKey = secretAccessKey;
        }
    }
}
