package tms.task_management_be.report.jobs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

public class SnapshotJobScheduler {
    private static final Logger log = LoggerFactory.getLogger(SnapshotJobScheduler.class);

    private final SnapshotJobService jobService;

    public SnapshotJobScheduler(SnapshotJobService jobService) {
        this.jobService = jobService;
    }

    @Scheduled(cron = "${snapshots.job.cron:0 30 0 * * *}", zone = "${calendar.zone:Asia/Tehran}")
    public void run() {
        log.info("Scheduled saved report generation started");
        try {
            GenerationSummary summary = jobService.generatePreviousPeriods();
            log.info("Scheduled saved report generation finished: created={}, existing={}, failed={}",
                    summary.created, summary.existing, summary.failed);
        } catch (Exception ex) {
            log.error("Scheduled saved report generation failed", ex);
        }
    }
}
