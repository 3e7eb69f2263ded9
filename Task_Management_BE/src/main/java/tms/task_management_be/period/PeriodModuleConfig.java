package tms.task_management_be.period;

import tms.task_management_be.calendar.CalendarConverter;
import tms.task_management_be.calendar.CalendarProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PeriodModuleConfig {

    @Bean
    public PeriodResolver periodResolver(CalendarConverter converter, CalendarProperties properties) {
        return new PeriodResolver(converter, new PeriodLabelFormatter(properties.getLabelLanguage()));
    }
}
