package tms.task_management_be.directory;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

@Configuration
public class DirectoryModuleConfig {

    @Bean
    public ScopeDirectoryRepository scopeDirectoryRepository(JdbcTemplate jdbcTemplate) {
        return new ScopeDirectoryRepository(jdbcTemplate);
    }
}
