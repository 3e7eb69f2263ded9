package tms.task_management_be.meeting.recurrence;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * Recurrence of a meeting relative to its anchor datetime.
 *
 * <p>{@code endDate} is inclusive. Neither bound set means the rule is unbounded. For
 * {@link RecurrenceType#NONE} the interval and both bounds are ignored.</p>
 */
public record RecurrenceRule(RecurrenceType type,
                             int interval,
                             OffsetDateTime endDate,
                             Integer count,
                             RecurrenceCalendar calendar) {

    public RecurrenceRule {
        Objects.requireNonNull(type, "type");
        if (calendar == null) {
            calendar = RecurrenceCalendar.GREGORIAN;
        }
        if (type != RecurrenceType.NONE) {
            if (interval < 1) {
                throw new IllegalArgumentException("Recurrence interval must be at least 1, got " + interval);
            }
            if (count != null && count < 1) {
                throw new IllegalArgumentException("Recurrence count must be at least 1, got " + count);
            }
        }
    }

    public static RecurrenceRule none() {
        return new RecurrenceRule(RecurrenceType.NONE, 1, null, null, RecurrenceCalendar.GREGORIAN);
    }

    public static RecurrenceRule every(int interval, RecurrenceType type) {
        return new RecurrenceRule(type, interval, null, null, RecurrenceCalendar.GREGORIAN);
    }

    public RecurrenceRule until(OffsetDateTime endDate) {
        return new RecurrenceRule(type, interval, endDate, count, calendar);
    }

    public RecurrenceRule times(Integer count) {
        return new RecurrenceRule(type, interval, endDate, count, calendar);
    }

    public RecurrenceRule inCalendar(RecurrenceCalendar calendar) {
        return new RecurrenceRule(type, interval, endDate, count, calendar);
    }

    public boolean isRecurring() {
        return type != RecurrenceType.NONE;
    }

    public boolean isBounded() {
        return !isRecurring() || endDate != null || count != null;
    }
}
