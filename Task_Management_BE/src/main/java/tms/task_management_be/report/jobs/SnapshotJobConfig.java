package tms.task_management_be.report.jobs;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "snapshots.job", name = "enabled", havingValue = "true")
public class SnapshotJobConfig {

    @Bean
    public SnapshotJobScheduler snapshotJobScheduler(SnapshotJobService jobService) {
        return new SnapshotJobScheduler(jobService);
    }
}
