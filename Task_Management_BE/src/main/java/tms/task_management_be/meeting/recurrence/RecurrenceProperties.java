package tms.task_management_be.meeting.recurrence;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "recurrence")
public class RecurrenceProperties {
    /** Treatment of rules that set both an end date and a count */
    @NotNull
    private BoundPolicy boundPolicy = BoundPolicy.FIRST_BOUND_WINS;
    /** Calendar applied to stored monthly/yearly rules that do not name one */
    @NotNull
    private RecurrenceCalendar defaultCalendar = RecurrenceCalendar.GREGORIAN;

    public BoundPolicy getBoundPolicy() { return boundPolicy; }
    public void setBoundPolicy(BoundPolicy boundPolicy) { this.boundPolicy = boundPolicy; }
    public RecurrenceCalendar getDefaultCalendar() { return defaultCalendar; }
    public void setDefaultCalendar(RecurrenceCalendar defaultCalendar) { this.defaultCalendar = defaultCalendar; }
}
