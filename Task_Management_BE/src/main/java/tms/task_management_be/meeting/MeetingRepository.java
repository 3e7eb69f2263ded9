package tms.task_management_be.meeting;

import tms.task_management_be.meeting.recurrence.RecurrenceCalendar;
import tms.task_management_be.meeting.recurrence.RecurrenceRule;
import tms.task_management_be.meeting.recurrence.RecurrenceType;
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
 * Data-access component for the {@code meeting} and {@code meeting_participant} tables.
 */
public class MeetingRepository {

    private static final String SQL_SELECT_BASE =
            """
            SELECT m.id,
                   m.topic,
                   m.meeting_type,
                   m.location,
                   m.starts_at,
                   m.recurrence_type,
                   m.recurrence_interval,
                   m.recurrence_end_date,
                   m.recurrence_count,
                   m.recurrence_calendar,
                   m.domain_id,
                   m.created_at,
                   m.updated_at
            FROM meeting m
            """;

    private static final String SQL_SELECT_BY_ID =
            SQL_SELECT_BASE +
            " WHERE m.id = ?";

    // A meeting can only occur inside [from, until) if it starts before `until`, and a one-off or
    // already finished series must still reach `from`.
    private static final String SQL_CANDIDATE_FILTER =
            """
             AND m.starts_at < ?
             AND (m.recurrence_type <> 'NONE' OR m.starts_at >= ?)
             AND (m.recurrence_type = 'NONE' OR m.recurrence_end_date IS NULL OR m.recurrence_end_date >= ?)
             ORDER BY m.starts_at, m.id
            """;

    private static final String SQL_CANDIDATES_FOR_PARTICIPANT =
            SQL_SELECT_BASE +
            " JOIN meeting_participant p ON p.meeting_id = m.id\n" +
            " WHERE p.user_id = ?" +
            SQL_CANDIDATE_FILTER;

    private static final String SQL_CANDIDATES_FOR_DOMAIN =
            SQL_SELECT_BASE +
            " WHERE m.domain_id = ?" +
            SQL_CANDIDATE_FILTER;

    private static final String SQL_INSERT =
            """
            INSERT INTO meeting (topic, meeting_type, location, starts_at,
                                 recurrence_type, recurrence_interval, recurrence_end_date,
                                 recurrence_count, recurrence_calendar, domain_id)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            RETURNING id, topic, meeting_type, location, starts_at,
                      recurrence_type, recurrence_interval, recurrence_end_date,
                      recurrence_count, recurrence_calendar, domain_id, created_at, updated_at
            """;

    private static final String SQL_INSERT_PARTICIPANT =
            """
            INSERT INTO meeting_participant (meeting_id, user_id)
            VALUES (?, ?)
            ON CONFLICT DO NOTHING
            """;

    private final JdbcTemplate jdbc;
    private final RowMapper<MeetingEntity> rowMapper;

    public MeetingRepository(JdbcTemplate jdbc, RecurrenceCalendar defaultCalendar) {
        this.jdbc = jdbc;
        Objects.requireNonNull(defaultCalendar, "defaultCalendar");
        this.rowMapper = (rs, rowNum) -> mapRow(rs, defaultCalendar);
    }

    public Optional<MeetingEntity> findById(long meetingId) {
        List<MeetingEntity> rows = jdbc.query(SQL_SELECT_BY_ID, rowMapper, meetingId);
        return Optional.ofNullable(DataAccessUtils.singleResult(rows));
    }

    /**
     * Meetings a user takes part in that may have an occurrence inside {@code [from, until)}.
     */
    public List<MeetingEntity> findCandidatesForParticipant(long userId, OffsetDateTime from, OffsetDateTime until) {
        return jdbc.query(SQL_CANDIDATES_FOR_PARTICIPANT, rowMapper, userId, until, from, from);
    }

    /**
     * Meetings of a domain that may have an occurrence inside {@code [from, until)}.
     */
    public List<MeetingEntity> findCandidatesForDomain(long domainId, OffsetDateTime from, OffsetDateTime until) {
        return jdbc.query(SQL_CANDIDATES_FOR_DOMAIN, rowMapper, domainId, until, from, from);
    }

    public MeetingEntity insert(String topic,
                                MeetingType type,
                                String location,
                                OffsetDateTime startsAt,
                                RecurrenceRule recurrence,
                                Long domainId) {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(startsAt, "startsAt");
        Objects.requireNonNull(recurrence, "recurrence");
        return jdbc.queryForObject(SQL_INSERT, rowMapper,
                topic,
                type.name(),
                location,
                startsAt,
                recurrence.type().name(),
                recurrence.interval(),
                recurrence.endDate(),
                recurrence.count(),
                recurrence.calendar().name(),
                domainId);
    }

    public void addParticipant(long meetingId, long userId) {
        jdbc.update(SQL_INSERT_PARTICIPANT, meetingId, userId);
    }

    private static MeetingEntity mapRow(ResultSet rs, RecurrenceCalendar defaultCalendar) throws SQLException {
        String calendar = rs.getString("recurrence_calendar");
        Integer count = rs.getObject("recurrence_count", Integer.class);
        RecurrenceRule recurrence = new RecurrenceRule(
                RecurrenceType.parse(rs.getString("recurrence_type")),
                rs.getInt("recurrence_interval"),
                rs.getObject("recurrence_end_date", OffsetDateTime.class),
                count,
                calendar != null ? RecurrenceCalendar.valueOf(calendar) : defaultCalendar);
        Long domainId = rs.getObject("domain_id", Long.class);
        return new MeetingEntity(
                rs.getLong("id"),
                rs.getString("topic"),
                MeetingType.valueOf(rs.getString("meeting_type")),
                rs.getString("location"),
                rs.getObject("starts_at", OffsetDateTime.class),
                recurrence,
                domainId,
                rs.getObject("created_at", OffsetDateTime.class),
                rs.getObject("updated_at", OffsetDateTime.class));
    }
}
