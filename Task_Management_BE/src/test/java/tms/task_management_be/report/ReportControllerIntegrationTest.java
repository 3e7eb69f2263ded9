package tms.task_management_be.report;

import tms.task_management_be.meeting.MeetingEntity;
import tms.task_management_be.meeting.MeetingRepository;
import tms.task_management_be.meeting.MeetingType;
import tms.task_management_be.meeting.recurrence.RecurrenceRule;
import tms.task_management_be.meeting.recurrence.RecurrenceType;
import tms.task_management_be.period.PeriodDescriptor;
import tms.task_management_be.period.PeriodResolver;
import tms.task_management_be.period.PeriodType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.OffsetDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
class ReportControllerIntegrationTest {

    private static final DockerImageName POSTGRES_IMAGE = DockerImageName
            .parse("postgres:16-alpine")
            .asCompatibleSubstituteFor("postgres");

    @Container
    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>(POSTGRES_IMAGE);

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        if (!POSTGRES.isRunning()) {
            POSTGRES.start();
        }
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
        registry.add("spring.datasource.driver-class-name", () -> "org.postgresql.Driver");
        registry.add("spring.flyway.enabled", () -> "true");
        registry.add("spring.flyway.locations", () -> "classpath:db/migration");
        registry.add("calendar.label-language", () -> "EN");
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private MeetingRepository meetingRepository;

    @Autowired
    private PeriodResolver periodResolver;

    @BeforeEach
    void cleanDatabase() {
        jdbcTemplate.execute("TRUNCATE saved_report, meeting_participant, meeting, domain, app_user RESTART IDENTITY CASCADE");
    }

    @Test
    void closedPeriodReportIsSavedOnceAndNeverChanges() throws Exception {
        long userId = insertUser("alice");
        MeetingEntity standup = meetingRepository.insert("Standup", MeetingType.ONLINE, null,
                OffsetDateTime.parse("2024-03-23T09:30:00+03:30"),
                RecurrenceRule.every(1, RecurrenceType.WEEKLY), null);
        meetingRepository.addParticipant(standup.id(), userId);

        String url = "/api/reports/individual?userId=" + userId + "&type=monthly&year=1403&month=1";
        JsonNode first = read(mockMvc.perform(get(url))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.source").value("snapshot"))
                .andExpect(jsonPath("$.period.startDate").value("2024-03-20"))
                .andExpect(jsonPath("$.content.meetings[0].topic").value("Standup"))
                .andReturn().getResponse().getContentAsString());

        jdbcTemplate.update("UPDATE meeting SET topic = 'Renamed' WHERE id = ?", standup.id());

        JsonNode second = read(mockMvc.perform(get(url))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content.meetings[0].topic").value("Standup"))
                .andReturn().getResponse().getContentAsString());

        assertThat(second.path("savedReportId").asLong()).isEqualTo(first.path("savedReportId").asLong());
        assertThat(second.path("content")).isEqualTo(first.path("content"));
        assertThat(first.path("content").path("meetings").get(0).path("occurrences")).hasSize(4);
        Integer rows = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM saved_report", Integer.class);
        assertThat(rows).isEqualTo(1);

        mockMvc.perform(get("/api/saved-reports").param("userId", String.valueOf(userId)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].periodType").value("monthly"))
                .andExpect(jsonPath("$[0].jalaliMonth").value(1));
        mockMvc.perform(get("/api/saved-reports/" + first.path("savedReportId").asLong()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content.meetings[0].topic").value("Standup"));
    }

    @Test
    void currentPeriodIsServedLiveWithoutSaving() throws Exception {
        long domainId = insertDomain("Backend");
        PeriodDescriptor current = periodResolver.current(PeriodType.MONTHLY);

        mockMvc.perform(get("/api/reports/team")
                        .param("domainId", String.valueOf(domainId))
                        .param("type", "monthly")
                        .param("year", String.valueOf(current.jalaliYear()))
                        .param("month", String.valueOf(current.jalaliMonth())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.source").value("live"))
                .andExpect(jsonPath("$.content.domainId").value(domainId));

        Integer rows = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM saved_report", Integer.class);
        assertThat(rows).isZero();
    }

    @Test
    void generateSavesReportsForEveryScope() throws Exception {
        insertUser("alice");
        insertUser("bob");
        insertDomain("Backend");

        mockMvc.perform(post("/api/saved-reports/generate")
                        .param("type", "yearly")
                        .param("year", "1402"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.created").value(3))
                .andExpect(jsonPath("$.failed").value(0));

        mockMvc.perform(post("/api/saved-reports/generate")
                        .param("type", "yearly")
                        .param("year", "1402"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.created").value(0))
                .andExpect(jsonPath("$.existing").value(3));
    }

    @Test
    void generatingOpenPeriodIsConflict() throws Exception {
        PeriodDescriptor current = periodResolver.current(PeriodType.YEARLY);

        mockMvc.perform(post("/api/saved-reports/generate")
                        .param("type", "yearly")
                        .param("year", String.valueOf(current.jalaliYear())))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error.code").value("CONFLICT"))
                .andExpect(jsonPath("$.error.details").value("period_not_closed"));
    }

    @Test
    void unknownSavedReportIsNotFound() throws Exception {
        mockMvc.perform(get("/api/saved-reports/12345"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"))
                .andExpect(jsonPath("$.error.details").value("saved_report"));
    }

    private JsonNode read(String body) throws Exception {
        return objectMapper.readTree(body);
    }

    private long insertUser(String username) {
        return jdbcTemplate.queryForObject("INSERT INTO app_user (username) VALUES (?) RETURNING id", Long.class, username);
    }

    private long insertDomain(String name) {
        return jdbcTemplate.queryForObject("INSERT INTO domain (name) VALUES (?) RETURNING id", Long.class, name);
    }
}
