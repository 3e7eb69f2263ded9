package tms.task_management_be.calendar;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class CalendarModuleConfig {

    @Bean
    public Clock clock(CalendarProperties properties) {
        return Clock.system(properties.zoneId());
    }

    @Bean
    public CalendarConverter calendarConverter(CalendarProperties properties, Clock clock) {
        return new CalendarConverter(properties.zoneId(), clock);
    }
}
