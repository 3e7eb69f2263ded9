package tms.task_management_be.directory;

import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;

/**
 * Read access to the users and domains that reports are generated for.
 */
public class ScopeDirectoryRepository {

    private static final String SQL_ACTIVE_USER_IDS =
            """
            SELECT id
            FROM app_user
            WHERE active
            ORDER BY id
            """;

    private static final String SQL_DOMAIN_IDS =
            """
            SELECT id
            FROM domain
            ORDER BY id
            """;

    private final JdbcTemplate jdbc;

    public ScopeDirectoryRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public List<Long> listActiveUserIds() {
        return jdbc.queryForList(SQL_ACTIVE_USER_IDS, Long.class);
    }

    public List<Long> listDomainIds() {
        return jdbc.queryForList(SQL_DOMAIN_IDS, Long.class);
    }
}
