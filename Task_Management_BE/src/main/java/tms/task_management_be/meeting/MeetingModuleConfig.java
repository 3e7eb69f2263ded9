package tms.task_management_be.meeting;

import tms.task_management_be.calendar.CalendarConverter;
import tms.task_management_be.meeting.recurrence.RecurrenceExpander;
import tms.task_management_be.meeting.recurrence.RecurrenceProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

@Configuration
public class MeetingModuleConfig {

    @Bean
    public RecurrenceExpander recurrenceExpander(CalendarConverter converter, RecurrenceProperties properties) {
        return new RecurrenceExpander(converter, properties.getBoundPolicy());
    }

    @Bean
    public MeetingRepository meetingRepository(JdbcTemplate jdbcTemplate, RecurrenceProperties properties) {
        return new MeetingRepository(jdbcTemplate, properties.getDefaultCalendar());
    }
}
