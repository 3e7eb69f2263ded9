package tms.task_management_be.report.snapshot;

import tms.task_management_be.period.PeriodType;
import org.springframework.dao.support.DataAccessUtils;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Data-access component for the {@code saved_report} table.
 *
 * <p>Rows are write-once: there is no update statement here, and the table itself rejects
 * {@code UPDATE}. The {@code content} column is {@code json} (not {@code jsonb}) so the text comes
 * back exactly as it was inserted.</p>
 */
public class SavedReportRepository {

    private static final String COLUMNS =
            """
            id, report_type, period_type, jalali_year, jalali_month, jalali_week,
            user_id, domain_id, content, created_at
            """;

    private static final String SQL_SELECT_BASE =
            "SELECT " + COLUMNS + " FROM saved_report\n";

    private static final String SQL_SELECT_BY_ID =
            SQL_SELECT_BASE +
            " WHERE id = ?";

    // Nullable key parts compare with IS NOT DISTINCT FROM, matching the NULLS NOT DISTINCT unique key.
    private static final String SQL_SELECT_BY_KEY =
            SQL_SELECT_BASE +
            """
             WHERE report_type = ?
               AND period_type = ?
               AND jalali_year = ?
               AND jalali_month IS NOT DISTINCT FROM CAST(? AS INTEGER)
               AND jalali_week IS NOT DISTINCT FROM CAST(? AS INTEGER)
               AND user_id IS NOT DISTINCT FROM CAST(? AS BIGINT)
               AND domain_id IS NOT DISTINCT FROM CAST(? AS BIGINT)
            """;

    private static final String SQL_LIST_FOR_USER =
            SQL_SELECT_BASE +
            " WHERE report_type = 'INDIVIDUAL' AND user_id = ?\n" +
            " ORDER BY jalali_year DESC, created_at DESC, id DESC";

    private static final String SQL_LIST_FOR_DOMAIN =
            SQL_SELECT_BASE +
            " WHERE report_type = 'TEAM' AND domain_id = ?\n" +
            " ORDER BY jalali_year DESC, created_at DESC, id DESC";

    private static final String SQL_INSERT_IF_ABSENT =
            """
            INSERT INTO saved_report (report_type, period_type, jalali_year, jalali_month, jalali_week,
                                      user_id, domain_id, content)
            VALUES (?, ?, ?, CAST(? AS INTEGER), CAST(? AS INTEGER), CAST(? AS BIGINT), CAST(? AS BIGINT), CAST(? AS JSON))
            ON CONFLICT ON CONSTRAINT uq_saved_report_key DO NOTHING
            RETURNING
            """ + COLUMNS;

    private static final RowMapper<SavedReportEntity> ROW_MAPPER = new RowMapper<>() {
        @Override
        public SavedReportEntity mapRow(ResultSet rs, int rowNum) throws SQLException {
            SnapshotKey key = new SnapshotKey(
                    ReportType.valueOf(rs.getString("report_type")),
                    PeriodType.valueOf(rs.getString("period_type")),
                    rs.getInt("jalali_year"),
                    rs.getObject("jalali_month", Integer.class),
                    rs.getObject("jalali_week", Integer.class),
                    rs.getObject("user_id", Long.class),
                    rs.getObject("domain_id", Long.class));
            return new SavedReportEntity(
                    rs.getLong("id"),
                    key,
                    rs.getString("content"),
                    rs.getObject("created_at", OffsetDateTime.class));
        }
    };

    private final JdbcTemplate jdbc;

    public SavedReportRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<SavedReportEntity> findById(long id) {
        List<SavedReportEntity> rows = jdbc.query(SQL_SELECT_BY_ID, ROW_MAPPER, id);
        return Optional.ofNullable(DataAccessUtils.singleResult(rows));
    }

    public Optional<SavedReportEntity> findByKey(SnapshotKey key) {
        Objects.requireNonNull(key, "key");
        List<SavedReportEntity> rows = jdbc.query(SQL_SELECT_BY_KEY, ROW_MAPPER, keyArguments(key));
        return Optional.ofNullable(DataAccessUtils.singleResult(rows));
    }

    public List<SavedReportEntity> listForUser(long userId) {
        return jdbc.query(SQL_LIST_FOR_USER, ROW_MAPPER, userId);
    }

    public List<SavedReportEntity> listForDomain(long domainId) {
        return jdbc.query(SQL_LIST_FOR_DOMAIN, ROW_MAPPER, domainId);
    }

    /**
     * Inserts the snapshot unless a row with the same key exists. Returns the new row, or empty when
     * another writer got there first; the existing row is left untouched.
     */
    public Optional<SavedReportEntity> insertIfAbsent(SnapshotKey key, String content) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(content, "content");
        Object[] keyArgs = keyArguments(key);
        Object[] args = new Object[keyArgs.length + 1];
        System.arraycopy(keyArgs, 0, args, 0, keyArgs.length);
        args[keyArgs.length] = content;
        List<SavedReportEntity> rows = jdbc.query(SQL_INSERT_IF_ABSENT, ROW_MAPPER, args);
        return Optional.ofNullable(DataAccessUtils.singleResult(rows));
    }

    private static Object[] keyArguments(SnapshotKey key) {
        return new Object[]{
                key.reportType().name(),
                key.periodType().name(),
                key.jalaliYear(),
                key.jalaliMonth(),
                key.jalaliWeek(),
                key.userId(),
                key.domainId()};
    }
}
