package tms.task_management_be.report.snapshot;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

@Configuration
public class SnapshotModuleConfig {

    @Bean
    public SavedReportRepository savedReportRepository(JdbcTemplate jdbcTemplate) {
        return new SavedReportRepository(jdbcTemplate);
    }
}
