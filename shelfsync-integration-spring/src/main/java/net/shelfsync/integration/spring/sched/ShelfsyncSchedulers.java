package net.shelfsync.integration.spring.sched;

import net.shelfsync.core.maintenance.MaintenanceService;
import net.shelfsync.core.service.TaskDispatchService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Duration;

public class ShelfsyncSchedulers {
    private static final Logger log = LoggerFactory.getLogger(ShelfsyncSchedulers.class);

    private final TaskDispatchService dispatch;
    private final MaintenanceService maintenance;

    private Duration taskLease = Duration.ofMinutes(5);
    private int maxClaims = 10;
    private Duration maintBackoff = Duration.ofSeconds(10);
    private Duration finishedTtl = Duration.ofDays(7);
    private int sessionBatch = 100;

    public ShelfsyncSchedulers(TaskDispatchService dispatch, MaintenanceService maintenance) {
        this.dispatch = dispatch;
        this.maintenance = maintenance;
    }

    @Scheduled(fixedDelayString = "${shelfsync.worker.poll-delay-ms:1000}")
    public void work() throws Exception {
        int ran = dispatch.claimAndRunUpTo(maxClaims, taskLease);
        if (ran > 0) log.debug("Worker tick ran {} invocation(s)", ran);
    }

    @Scheduled(fixedDelayString = "${shelfsync.maintenance.delay-ms:60000}")
    public void maintenance() throws Exception {
        var report = maintenance.runOnce(maintBackoff, finishedTtl, sessionBatch);
        log.debug("Maintenance: {}", report);
    }

    public void setTaskLease(Duration taskLease) {
        this.taskLease = taskLease;
    }

    public void setMaxClaims(int maxClaims) {
        this.maxClaims = maxClaims;
    }

    public void setMaintBackoff(Duration maintBackoff) {
        this.maintBackoff = maintBackoff;
    }

    public void setFinishedTtl(Duration finishedTtl) {
        this.finishedTtl = finishedTtl;
    }

    public void setSessionBatch(int sessionBatch) {
        this.sessionBatch = sessionBatch;
    }
}
